package com.example.pvp.api.response;

import com.example.pvp.model.MatchHistoryEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchHistoryEntryResponse(
    String matchId,
    String matchType,
    String opponentId,
    int playerScore,
    int opponentScore,
    @JsonProperty("is_winner") boolean winner,
    @JsonProperty("is_draw") boolean draw,
    long durationSeconds,
    String finishedAt) {

  public static MatchHistoryEntryResponse from(MatchHistoryEntry entry) {
    return new MatchHistoryEntryResponse(
        entry.matchId(),
        entry.matchType().value(),
        entry.opponentId(),
        entry.playerScore(),
        entry.opponentScore(),
        entry.winner(),
        entry.draw(),
        entry.durationSeconds(),
        MatchResponse.toIsoOrNull(entry.finishedAt()));
  }
}
