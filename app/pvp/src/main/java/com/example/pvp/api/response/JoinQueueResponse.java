package com.example.pvp.api.response;

import com.example.pvp.model.JoinQueueResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** status ごとに使う項目だけを返す (queued / matched / already_queued)。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JoinQueueResponse(
    String status,
    String playerId,
    Integer rating,
    Integer queuePosition,
    Long estimatedWaitTime,
    MatchResponse match) {

  public static JoinQueueResponse from(JoinQueueResult result) {
    if (result instanceof JoinQueueResult.Queued queued) {
      return new JoinQueueResponse(
          "queued",
          queued.playerId(),
          queued.rating(),
          queued.queuePosition(),
          queued.estimatedWaitSeconds(),
          null);
    }
    if (result instanceof JoinQueueResult.Matched matched) {
      return new JoinQueueResponse(
          "matched", matched.playerId(), null, null, null, MatchResponse.from(matched.match()));
    }
    final JoinQueueResult.AlreadyQueued already = (JoinQueueResult.AlreadyQueued) result;
    return new JoinQueueResponse(
        "already_queued", already.playerId(), null, already.queuePosition(), null, null);
  }
}
