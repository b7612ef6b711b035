/*
 * どこで: PVP サービス層
 * 何を: 試合の生成・開始・結果確定とレーティング反映を行う
 * なぜ: WAITING -> ACTIVE -> FINISHED の遷移とレート更新を 1 箇所で一貫させるため
 */
package com.example.pvp.service;

import com.example.pvp.api.InvalidMatchStatusException;
import com.example.pvp.api.InvalidPvpRequestException;
import com.example.pvp.api.InvalidWinnerException;
import com.example.pvp.api.MatchNotFoundException;
import com.example.pvp.config.PvpProperties;
import com.example.pvp.model.MatchFinish;
import com.example.pvp.model.MatchHistoryEntry;
import com.example.pvp.model.MatchOutcome;
import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.MatchResult;
import com.example.pvp.model.MatchStatus;
import com.example.pvp.model.MatchType;
import com.example.pvp.model.PlayerRankingRecord;
import com.example.pvp.model.RatingChange;
import com.example.pvp.repository.MatchRepository;
import com.example.pvp.repository.PlayerRankingRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Service
public class MatchLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(MatchLifecycleService.class);

  private final MatchRepository matchRepository;
  private final PlayerRankingRepository rankingRepository;
  private final EloRatingCalculator ratingCalculator;
  private final KeyedLockRegistry lockRegistry;
  private final PvpEventPublisher eventPublisher;
  private final PvpMetrics metrics;
  private final PvpProperties properties;
  private final Clock clock;

  public MatchLifecycleService(
      MatchRepository matchRepository,
      PlayerRankingRepository rankingRepository,
      EloRatingCalculator ratingCalculator,
      KeyedLockRegistry lockRegistry,
      PvpEventPublisher eventPublisher,
      PvpMetrics metrics,
      PvpProperties properties,
      Clock clock) {
    this.matchRepository = matchRepository;
    this.rankingRepository = rankingRepository;
    this.ratingCalculator = ratingCalculator;
    this.lockRegistry = lockRegistry;
    this.eventPublisher = eventPublisher;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * 役割: ペアリング済みの 2 人で WAITING の試合を作る。
   * 前提: 呼び出し側 (キュー) が両者のレートとシーズンを確定させていること。
   */
  public MatchRecord createMatch(
      String playerAId,
      String playerBId,
      int playerARating,
      int playerBRating,
      MatchType matchType,
      String seasonId) {
    final MatchRecord match =
        MatchRecord.waiting(
            UUID.randomUUID().toString(),
            matchType,
            seasonId,
            playerAId,
            playerARating,
            playerBId,
            playerBRating,
            Instant.now(clock));
    matchRepository.insert(match);
    metrics.recordTransition(MatchStatus.WAITING);
    logger.info(
        "pvp match created match_id={} match_type={} season_id={} player_a={} player_b={}",
        match.matchId(),
        matchType.value(),
        seasonId,
        playerAId,
        playerBId);
    afterCommit(
        () -> publishSafely("match_created", () -> eventPublisher.publishMatchCreated(match)));
    return match;
  }

  public MatchRecord getMatch(String matchId) {
    return requireMatch(matchId);
  }

  public MatchRecord startMatch(String matchId) {
    final MatchRecord current = requireMatch(matchId);
    if (current.status() != MatchStatus.WAITING) {
      throw rejected(current, "start");
    }
    final MatchRecord started =
        matchRepository
            .transitionToActive(matchId, Instant.now(clock))
            .orElseThrow(() -> rejected(requireMatch(matchId), "start"));
    metrics.recordTransition(MatchStatus.ACTIVE);
    logger.info("pvp match started match_id={}", matchId);
    return started;
  }

  /**
   * 役割: 結果を確定し、両プレイヤーのランキングを更新する。
   * 動作: ACTIVE -> FINISHED を条件付き更新で一度だけ成功させ、勝者だけがレートを反映する。
   *     レートは試合のシーズンに書き込み、未作成のランキング行はここで作る。
   */
  @Transactional
  public MatchResult submitResult(
      String matchId, String winnerId, int scoreA, int scoreB, int movesA, int movesB) {
    if (scoreA < 0 || scoreB < 0 || movesA < 0 || movesB < 0) {
      throw new InvalidPvpRequestException("scores and moves must not be negative");
    }
    final MatchRecord current = requireMatch(matchId);
    if (current.status() != MatchStatus.ACTIVE) {
      throw rejected(current, "submit_result");
    }
    if (winnerId != null && !current.isParticipant(winnerId)) {
      metrics.recordRejectedTransition("invalid_winner");
      throw new InvalidWinnerException(
          "winner_id is not a participant: match_id=" + matchId + " winner_id=" + winnerId);
    }

    final Instant finishedAt = Instant.now(clock);
    final long durationSeconds =
        current.startedAt() == null
            ? 0
            : Math.max(0, Duration.between(current.startedAt(), finishedAt).getSeconds());
    final MatchFinish finish =
        new MatchFinish(winnerId, scoreA, scoreB, movesA, movesB, durationSeconds, finishedAt);
    final MatchRecord finished =
        matchRepository
            .transitionToFinished(matchId, finish)
            .orElseThrow(() -> rejected(requireMatch(matchId), "submit_result"));

    final MatchResult result =
        lockRegistry.withLocks(
            List.of(
                rankingLockKey(finished.seasonId(), finished.playerAId()),
                rankingLockKey(finished.seasonId(), finished.playerBId())),
            () -> applyRatings(finished, finishedAt));

    metrics.recordTransition(MatchStatus.FINISHED);
    metrics.recordRatingDelta(result.playerA().change());
    metrics.recordRatingDelta(result.playerB().change());
    logger.info(
        "pvp match finished match_id={} winner_id={} duration_seconds={} player_a={}:{}->{}"
            + " player_b={}:{}->{}",
        matchId,
        winnerId,
        durationSeconds,
        result.playerA().playerId(),
        result.playerA().oldRating(),
        result.playerA().newRating(),
        result.playerB().playerId(),
        result.playerB().oldRating(),
        result.playerB().newRating());
    afterCommit(
        () -> publishSafely("match_finished", () -> eventPublisher.publishMatchFinished(result)));
    return result;
  }

  /** WAITING / ACTIVE の試合を新しい順に返す。 */
  public List<MatchRecord> activeMatches(Integer limit) {
    return matchRepository.findActive(
        resolveLimit(limit, properties.matches().activeDefaultLimit()));
  }

  public List<MatchHistoryEntry> matchHistory(String playerId, Integer limit) {
    if (playerId == null || playerId.isBlank()) {
      throw new InvalidPvpRequestException("player_id is required");
    }
    return matchRepository
        .findFinishedByPlayer(
            playerId, resolveLimit(limit, properties.matches().historyDefaultLimit()))
        .stream()
        .map(match -> MatchHistoryEntry.of(match, playerId))
        .toList();
  }

  private MatchResult applyRatings(MatchRecord finished, Instant now) {
    // 行ロックも player_id 昇順で取る
    final String seasonId = finished.seasonId();
    final boolean aFirst = finished.playerAId().compareTo(finished.playerBId()) <= 0;
    final PlayerRankingRecord first =
        loadForUpdate(aFirst ? finished.playerAId() : finished.playerBId(), seasonId, now);
    final PlayerRankingRecord second =
        loadForUpdate(aFirst ? finished.playerBId() : finished.playerAId(), seasonId, now);
    final PlayerRankingRecord rankingA = aFirst ? first : second;
    final PlayerRankingRecord rankingB = aFirst ? second : first;

    final EloRatingCalculator.ExpectedScores expected =
        ratingCalculator.expectedScore(rankingA.rating(), rankingB.rating());
    final MatchOutcome outcomeA =
        MatchOutcome.forPlayer(finished.playerAId(), finished.winnerId());
    final MatchOutcome outcomeB = outcomeA.opposite();

    final int newRatingA =
        ratingCalculator.newRating(
            rankingA.rating(),
            expected.playerA(),
            outcomeA.actualScore(),
            rankingA.matchesPlayed());
    final int newRatingB =
        ratingCalculator.newRating(
            rankingB.rating(),
            expected.playerB(),
            outcomeB.actualScore(),
            rankingB.matchesPlayed());

    rankingRepository.update(rankingA.afterMatch(newRatingA, outcomeA, now));
    rankingRepository.update(rankingB.afterMatch(newRatingB, outcomeB, now));
    return new MatchResult(
        finished,
        new RatingChange(finished.playerAId(), rankingA.rating(), newRatingA),
        new RatingChange(finished.playerBId(), rankingB.rating(), newRatingB));
  }

  private PlayerRankingRecord loadForUpdate(String playerId, String seasonId, Instant now) {
    rankingRepository.createIfAbsent(
        PlayerRankingRecord.newcomer(playerId, seasonId, properties.defaultRating(), now));
    return rankingRepository
        .findForUpdate(playerId, seasonId)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "ranking row missing after create: player_id="
                        + playerId
                        + " season_id="
                        + seasonId));
  }

  private MatchRecord requireMatch(String matchId) {
    if (matchId == null || matchId.isBlank()) {
      throw new InvalidPvpRequestException("match_id is required");
    }
    return matchRepository
        .findById(matchId)
        .orElseThrow(() -> new MatchNotFoundException("match not found: " + matchId));
  }

  private InvalidMatchStatusException rejected(MatchRecord current, String operation) {
    metrics.recordRejectedTransition(operation);
    logger.warn(
        "pvp match transition rejected match_id={} operation={} status={}",
        current.matchId(),
        operation,
        current.status().value());
    return new InvalidMatchStatusException(
        "cannot " + operation + " match in status " + current.status().value());
  }

  private int resolveLimit(Integer limit, int defaultLimit) {
    if (limit == null) {
      return defaultLimit;
    }
    if (limit <= 0) {
      throw new InvalidPvpRequestException("limit must be positive");
    }
    return limit;
  }

  private static String rankingLockKey(String seasonId, String playerId) {
    return "ranking:" + seasonId + ":" + playerId;
  }

  // トランザクション中ならコミット後に、そうでなければ即時に実行する
  private void afterCommit(Runnable action) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              action.run();
            }
          });
      return;
    }
    action.run();
  }

  private void publishSafely(String eventType, Runnable publish) {
    try {
      publish.run();
    } catch (RuntimeException ex) {
      metrics.recordPublishError(eventType);
      logger.warn("pvp event publish failed type={}", eventType, ex);
    }
  }
}
