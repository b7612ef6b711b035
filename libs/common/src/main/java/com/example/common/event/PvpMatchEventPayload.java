/*
 * どこで: common のイベント payload 定義
 * 何を: PVP 試合の生成・終了イベントを共通レコードとして提供する
 * なぜ: 購読側 (通知・集計) と同一のペイロード形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PvpMatchEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String matchId,
    String matchType,
    String seasonId,
    @JsonProperty("player_a_id") String playerAId,
    @JsonProperty("player_b_id") String playerBId,
    String status,
    String winnerId,
    Integer ratingDeltaA,
    Integer ratingDeltaB,
    String traceId) {

  public static final String MATCH_CREATED = "pvp.match.created";
  public static final String MATCH_FINISHED = "pvp.match.finished";
}
