/*
 * どこで: PVP ドメインモデル
 * 何を: キュー参加の 3 通りの結果を表す
 * なぜ: 待機・成立・既に待機中を呼び出し側で取りこぼさず分岐させるため
 */
package com.example.pvp.model;

public sealed interface JoinQueueResult
    permits JoinQueueResult.Queued, JoinQueueResult.Matched, JoinQueueResult.AlreadyQueued {

  String playerId();

  record Queued(String playerId, int rating, int queuePosition, long estimatedWaitSeconds)
      implements JoinQueueResult {}

  record Matched(String playerId, MatchRecord match) implements JoinQueueResult {}

  record AlreadyQueued(String playerId, int queuePosition) implements JoinQueueResult {}
}
