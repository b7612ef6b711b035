package com.example.pvp.api.response;

import com.example.pvp.model.PlayerRankingRecord;
import com.example.pvp.model.RankedPlayer;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerRankingResponse(
    String playerId,
    String seasonId,
    int rating,
    int maxRating,
    int rank,
    int matchesPlayed,
    int matchesWon,
    int matchesLost,
    int matchesDrawn,
    int currentStreak,
    int maxStreak,
    double winRate) {

  public static PlayerRankingResponse from(RankedPlayer ranked) {
    final PlayerRankingRecord ranking = ranked.ranking();
    return new PlayerRankingResponse(
        ranking.playerId(),
        ranking.seasonId(),
        ranking.rating(),
        ranking.maxRating(),
        ranked.rank(),
        ranking.matchesPlayed(),
        ranking.matchesWon(),
        ranking.matchesLost(),
        ranking.matchesDrawn(),
        ranking.currentStreak(),
        ranking.maxStreak(),
        ranking.winRate());
  }
}
