/*
 * どこで: PVP サービス層
 * 何を: プロセス内のマッチメイク待機列を保持し、参加時に first-fit で対戦相手を探す
 * なぜ: 重複参加チェック・走査・取り出し・試合生成を 1 つの排他区間で行うため
 */
package com.example.pvp.service;

import com.example.pvp.api.InvalidPvpRequestException;
import com.example.pvp.config.PvpProperties;
import com.example.pvp.model.CancelQueueResult;
import com.example.pvp.model.JoinQueueResult;
import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.MatchType;
import com.example.pvp.model.PlayerRankingRecord;
import com.example.pvp.model.QueueEntry;
import com.example.pvp.model.QueuedPlayer;
import com.example.pvp.model.SeasonRecord;
import com.example.pvp.repository.PlayerRankingRepository;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MatchmakingQueue {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakingQueue.class);

  private final SeasonContext seasonContext;
  private final PlayerRankingRepository rankingRepository;
  private final MatchLifecycleService matchLifecycleService;
  private final PvpMetrics metrics;
  private final PvpProperties properties;
  private final Clock clock;

  // 挿入順 = 待機開始順。lock 保持中のみ参照・変更する。
  private final List<QueueEntry> entries = new ArrayList<>();
  private final ReentrantLock lock = new ReentrantLock();

  public MatchmakingQueue(
      SeasonContext seasonContext,
      PlayerRankingRepository rankingRepository,
      MatchLifecycleService matchLifecycleService,
      PvpMetrics metrics,
      PvpProperties properties,
      Clock clock) {
    this.seasonContext = seasonContext;
    this.rankingRepository = rankingRepository;
    this.matchLifecycleService = matchLifecycleService;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * 役割: プレイヤーを待機列へ入れるか、条件に合う待機者と試合を成立させる。
   * 動作: シーズン確認 -> 重複確認 -> レート解決 -> 挿入順の first-fit 走査の順に評価する。
   *     幅の判定は要求者の ratingRange だけを使い、成立時は要求者が player A になる。
   * 前提: matchType / ratingRange が null の場合は既定値 (arena / 設定値) を使う。
   */
  public JoinQueueResult join(String playerId, MatchType matchType, Integer ratingRange) {
    if (playerId == null || playerId.isBlank()) {
      throw new InvalidPvpRequestException("player_id is required");
    }
    final MatchType type = matchType == null ? MatchType.ARENA : matchType;
    final int range = ratingRange == null ? properties.defaultRatingRange() : ratingRange;
    if (range < 0) {
      throw new InvalidPvpRequestException("rating_range must not be negative");
    }
    final SeasonRecord season = seasonContext.requireActiveSeason();

    lock.lock();
    try {
      final int existing = indexOf(playerId);
      if (existing >= 0) {
        metrics.recordMatchmakingResult(PvpMetrics.RESULT_ALREADY_QUEUED);
        return new JoinQueueResult.AlreadyQueued(playerId, existing + 1);
      }

      final int rating = currentRating(playerId, season.seasonId());
      final Instant now = Instant.now(clock);
      final QueueEntry requester = new QueueEntry(playerId, rating, type, range, now);

      final Iterator<QueueEntry> iterator = entries.iterator();
      while (iterator.hasNext()) {
        final QueueEntry candidate = iterator.next();
        if (candidate.matchType() != type) {
          continue;
        }
        if (!requester.accepts(candidate.rating(), range)) {
          continue;
        }
        final MatchRecord match =
            matchLifecycleService.createMatch(
                playerId,
                candidate.playerId(),
                rating,
                candidate.rating(),
                type,
                season.seasonId());
        iterator.remove();
        metrics.recordMatchmakingResult(PvpMetrics.RESULT_MATCHED);
        metrics.recordTimeToMatchSeconds(candidate.waitSeconds(now));
        refreshDepth(type);
        logger.info(
            "pvp matched player_a={} player_b={} match_id={} rating_gap={}",
            playerId,
            candidate.playerId(),
            match.matchId(),
            Math.abs(rating - candidate.rating()));
        return new JoinQueueResult.Matched(playerId, match);
      }

      entries.add(requester);
      final int position = entries.size();
      metrics.recordMatchmakingResult(PvpMetrics.RESULT_QUEUED);
      refreshDepth(type);
      logger.info(
          "pvp queued player_id={} match_type={} rating={} position={}",
          playerId,
          type.value(),
          rating,
          position);
      return new JoinQueueResult.Queued(
          playerId, rating, position, (long) position * properties.estimatedWaitSecondsPerEntry());
    } finally {
      lock.unlock();
    }
  }

  public CancelQueueResult cancel(String playerId) {
    lock.lock();
    try {
      final int index = indexOf(playerId);
      if (index < 0) {
        return CancelQueueResult.NOT_QUEUED;
      }
      final QueueEntry removed = entries.remove(index);
      metrics.recordMatchmakingResult(PvpMetrics.RESULT_CANCELLED);
      refreshDepth(removed.matchType());
      logger.info("pvp queue cancelled player_id={}", playerId);
      return CancelQueueResult.CANCELLED;
    } finally {
      lock.unlock();
    }
  }

  /** 現在の待機者を待機開始順に返す。 */
  public List<QueuedPlayer> snapshot() {
    final Instant now = Instant.now(clock);
    lock.lock();
    try {
      return entries.stream()
          .map(entry -> new QueuedPlayer(entry, entry.waitSeconds(now)))
          .toList();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  @PreDestroy
  public void clear() {
    lock.lock();
    try {
      if (!entries.isEmpty()) {
        logger.info("pvp queue cleared on shutdown dropped_entries={}", entries.size());
      }
      entries.clear();
      for (MatchType type : MatchType.values()) {
        refreshDepth(type);
      }
    } finally {
      lock.unlock();
    }
  }

  // ランキング行はここでは作らない。未作成なら既定レート。
  private int currentRating(String playerId, String seasonId) {
    return rankingRepository
        .find(playerId, seasonId)
        .map(PlayerRankingRecord::rating)
        .orElse(properties.defaultRating());
  }

  private int indexOf(String playerId) {
    for (int i = 0; i < entries.size(); i++) {
      if (entries.get(i).playerId().equals(playerId)) {
        return i;
      }
    }
    return -1;
  }

  private void refreshDepth(MatchType type) {
    final long depth = entries.stream().filter(entry -> entry.matchType() == type).count();
    metrics.updateQueueDepth(type, depth);
  }
}
