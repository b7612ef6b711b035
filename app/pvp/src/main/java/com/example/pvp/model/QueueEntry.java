/*
 * どこで: PVP ドメインモデル
 * 何を: マッチメイクキューの 1 エントリを表す
 * なぜ: 待機開始時点のレートと許容幅を固定して走査に使うため
 */
package com.example.pvp.model;

import java.time.Duration;
import java.time.Instant;

public record QueueEntry(
    String playerId, int rating, MatchType matchType, int ratingRange, Instant queuedAt) {

  /**
   * 役割: この待機者の許容幅に候補レートが収まるか判定する。
   * 前提: 判定は要求者側の幅だけで行う (候補側の幅は見ない)。
   */
  public boolean accepts(int candidateRating, int requesterRange) {
    return Math.abs(candidateRating - rating) <= requesterRange;
  }

  public long waitSeconds(Instant now) {
    return Math.max(0, Duration.between(queuedAt, now).getSeconds());
  }
}
