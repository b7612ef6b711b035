/*
 * どこで: PVP API レスポンス DTO
 * 何を: 結果送信 API の応答を定義する
 * なぜ: 確定した試合結果と両者のレート変動を 1 レスポンスで返すため
 */
package com.example.pvp.api.response;

import com.example.pvp.model.MatchResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitResultResponse(
    String matchId,
    String status,
    String winnerId,
    int scoreA,
    int scoreB,
    long durationSeconds,
    RatingChanges ratingChanges) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record RatingChanges(RatingChangeResponse playerA, RatingChangeResponse playerB) {}

  public static SubmitResultResponse from(MatchResult result) {
    return new SubmitResultResponse(
        result.match().matchId(),
        result.match().status().value(),
        result.match().winnerId(),
        result.match().scoreA(),
        result.match().scoreB(),
        result.match().durationSeconds(),
        new RatingChanges(
            RatingChangeResponse.from(result.playerA()),
            RatingChangeResponse.from(result.playerB())));
  }
}
