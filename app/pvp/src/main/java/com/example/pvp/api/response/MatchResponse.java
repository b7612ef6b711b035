/*
 * どこで: PVP API レスポンス DTO
 * 何を: 試合 1 件の状態を定義する
 * なぜ: 参照・開始・一覧・マッチ成立で同じ試合表現を返すため
 */
package com.example.pvp.api.response;

import com.example.pvp.model.MatchRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchResponse(
    String matchId,
    String matchType,
    String seasonId,
    @JsonProperty("player_a_id") String playerAId,
    @JsonProperty("player_b_id") String playerBId,
    @JsonProperty("player_a_rating") int playerARating,
    @JsonProperty("player_b_rating") int playerBRating,
    String status,
    int scoreA,
    int scoreB,
    String winnerId,
    int movesA,
    int movesB,
    long durationSeconds,
    int spectatorCount,
    boolean allowSpectate,
    String createdAt,
    String startedAt,
    String finishedAt) {

  public static MatchResponse from(MatchRecord match) {
    return new MatchResponse(
        match.matchId(),
        match.matchType().value(),
        match.seasonId(),
        match.playerAId(),
        match.playerBId(),
        match.playerARating(),
        match.playerBRating(),
        match.status().value(),
        match.scoreA(),
        match.scoreB(),
        match.winnerId(),
        match.movesA(),
        match.movesB(),
        match.durationSeconds(),
        match.spectatorCount(),
        match.allowSpectate(),
        toIsoOrNull(match.createdAt()),
        toIsoOrNull(match.startedAt()),
        toIsoOrNull(match.finishedAt()));
  }

  static String toIsoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
