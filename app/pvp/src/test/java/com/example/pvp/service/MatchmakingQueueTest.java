package com.example.pvp.service;

import static com.example.pvp.PvpTestFixtures.SEASON_ID;
import static com.example.pvp.PvpTestFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.example.pvp.PvpTestFixtures;
import com.example.pvp.PvpTestFixtures.MutableClock;
import com.example.pvp.api.InvalidPvpRequestException;
import com.example.pvp.api.NoActiveSeasonException;
import com.example.pvp.model.CancelQueueResult;
import com.example.pvp.model.JoinQueueResult;
import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.MatchStatus;
import com.example.pvp.model.MatchType;
import com.example.pvp.model.PlayerRankingRecord;
import com.example.pvp.model.QueuedPlayer;
import com.example.pvp.repository.InMemoryMatchRepository;
import com.example.pvp.repository.InMemoryPlayerRankingRepository;
import com.example.pvp.repository.InMemorySeasonRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MatchmakingQueueTest {

  private final MutableClock clock = new MutableClock(T0);
  private final InMemorySeasonRepository seasonRepository = new InMemorySeasonRepository();
  private final InMemoryPlayerRankingRepository rankingRepository =
      new InMemoryPlayerRankingRepository();
  private final InMemoryMatchRepository matchRepository = new InMemoryMatchRepository();
  private final PvpEventPublisher eventPublisher = mock(PvpEventPublisher.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private MatchmakingQueue queue;

  @BeforeEach
  void setUp() {
    seasonRepository.activate(PvpTestFixtures.activeSeason());
    final PvpMetrics metrics = new PvpMetrics(meterRegistry);
    final MatchLifecycleService lifecycleService =
        new MatchLifecycleService(
            matchRepository,
            rankingRepository,
            new EloRatingCalculator(),
            new KeyedLockRegistry(),
            eventPublisher,
            metrics,
            PvpTestFixtures.properties(),
            clock);
    queue =
        new MatchmakingQueue(
            new SeasonContext(seasonRepository),
            rankingRepository,
            lifecycleService,
            metrics,
            PvpTestFixtures.properties(),
            clock);
  }

  @Test
  void firstPlayerIsQueuedWithDefaultRating() {
    final JoinQueueResult result = queue.join("p1", MatchType.ARENA, null);

    assertThat(result).isInstanceOf(JoinQueueResult.Queued.class);
    final JoinQueueResult.Queued queued = (JoinQueueResult.Queued) result;
    assertThat(queued.rating()).isEqualTo(1000);
    assertThat(queued.queuePosition()).isEqualTo(1);
    assertThat(queued.estimatedWaitSeconds()).isEqualTo(5L);
    assertThat(queue.size()).isEqualTo(1);
  }

  @Test
  void joiningTwiceReportsCurrentPosition() {
    queue.join("p1", MatchType.ARENA, 0);
    queue.join("p2", MatchType.DUEL, 0);

    final JoinQueueResult result = queue.join("p2", MatchType.ARENA, 500);

    assertThat(result).isEqualTo(new JoinQueueResult.AlreadyQueued("p2", 2));
    assertThat(queue.size()).isEqualTo(2);
  }

  @Test
  void compatiblePlayersAreMatchedAndLeaveQueue() {
    queue.join("p1", MatchType.ARENA, null);

    final JoinQueueResult result = queue.join("p2", MatchType.ARENA, null);

    assertThat(result).isInstanceOf(JoinQueueResult.Matched.class);
    final MatchRecord match = ((JoinQueueResult.Matched) result).match();
    assertThat(match.playerAId()).isEqualTo("p2");
    assertThat(match.playerBId()).isEqualTo("p1");
    assertThat(match.status()).isEqualTo(MatchStatus.WAITING);
    assertThat(match.seasonId()).isEqualTo(SEASON_ID);
    assertThat(match.spectatorCount()).isZero();
    assertThat(matchRepository.findById(match.matchId())).contains(match);
    assertThat(queue.size()).isZero();
    verify(eventPublisher).publishMatchCreated(match);
  }

  @Test
  void differentMatchTypesAreNotPaired() {
    queue.join("p1", MatchType.ARENA, null);

    final JoinQueueResult result = queue.join("p2", MatchType.DUEL, null);

    assertThat(result).isInstanceOf(JoinQueueResult.Queued.class);
    assertThat(queue.size()).isEqualTo(2);
  }

  @Test
  void ratingGapOutsideRequesterRangeIsNotPaired() {
    rankingRepository.createIfAbsent(PlayerRankingRecord.newcomer("p2", SEASON_ID, 1300, T0));
    queue.join("p1", MatchType.ARENA, null);

    final JoinQueueResult result = queue.join("p2", MatchType.ARENA, 200);

    assertThat(result).isInstanceOf(JoinQueueResult.Queued.class);
    assertThat(((JoinQueueResult.Queued) result).rating()).isEqualTo(1300);
  }

  @Test
  void onlyRequesterRangeIsChecked() {
    rankingRepository.createIfAbsent(PlayerRankingRecord.newcomer("p2", SEASON_ID, 1150, T0));
    queue.join("p1", MatchType.ARENA, 0);

    final JoinQueueResult result = queue.join("p2", MatchType.ARENA, 200);

    assertThat(result).isInstanceOf(JoinQueueResult.Matched.class);
  }

  @Test
  void firstFitPrefersEarliestCompatibleEntry() {
    rankingRepository.createIfAbsent(PlayerRankingRecord.newcomer("p2", SEASON_ID, 1050, T0));
    rankingRepository.createIfAbsent(PlayerRankingRecord.newcomer("p3", SEASON_ID, 1040, T0));
    queue.join("p1", MatchType.ARENA, 0);
    queue.join("p2", MatchType.ARENA, 0);

    final JoinQueueResult result = queue.join("p3", MatchType.ARENA, 100);

    final MatchRecord match = ((JoinQueueResult.Matched) result).match();
    assertThat(match.playerBId()).isEqualTo("p1");
    assertThat(queue.snapshot())
        .extracting(player -> player.entry().playerId())
        .containsExactly("p2");
  }

  @Test
  void joinWithoutActiveSeasonIsRejected() {
    seasonRepository.deactivate();

    assertThatThrownBy(() -> queue.join("p1", MatchType.ARENA, null))
        .isInstanceOf(NoActiveSeasonException.class);
    assertThat(queue.size()).isZero();
  }

  @Test
  void negativeRangeIsRejected() {
    assertThatThrownBy(() -> queue.join("p1", MatchType.ARENA, -1))
        .isInstanceOf(InvalidPvpRequestException.class);
  }

  @Test
  void missingMatchTypeDefaultsToArena() {
    queue.join("p1", null, null);

    assertThat(queue.snapshot().get(0).entry().matchType()).isEqualTo(MatchType.ARENA);
  }

  @Test
  void cancelRemovesQueuedPlayerOnce() {
    queue.join("p1", MatchType.ARENA, null);

    assertThat(queue.cancel("p1")).isEqualTo(CancelQueueResult.CANCELLED);
    assertThat(queue.cancel("p1")).isEqualTo(CancelQueueResult.NOT_QUEUED);
    assertThat(queue.size()).isZero();
  }

  @Test
  void snapshotReportsWaitTimeInInsertionOrder() {
    queue.join("p1", MatchType.ARENA, 0);
    clock.advance(Duration.ofSeconds(4));
    rankingRepository.createIfAbsent(PlayerRankingRecord.newcomer("p2", SEASON_ID, 1500, T0));
    queue.join("p2", MatchType.ARENA, 0);
    clock.advance(Duration.ofSeconds(6));

    final List<QueuedPlayer> players = queue.snapshot();

    assertThat(players)
        .extracting(player -> player.entry().playerId())
        .containsExactly("p1", "p2");
    assertThat(players).extracting(QueuedPlayer::waitSeconds).containsExactly(10L, 6L);
    assertThat(meterRegistry.get("pvp.queue.depth").tag("match_type", "arena").gauge().value())
        .isEqualTo(2.0);
  }

  @Test
  void concurrentJoinsPairEachPlayerAtMostOnce() throws Exception {
    final int players = 20;
    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(8);
    final List<Future<JoinQueueResult>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < players; i++) {
        final String playerId = "p" + i;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return queue.join(playerId, MatchType.ARENA, null);
                }));
      }
      start.countDown();
      final Set<String> paired = new HashSet<>();
      int matches = 0;
      for (Future<JoinQueueResult> future : futures) {
        final JoinQueueResult result = future.get(10, TimeUnit.SECONDS);
        if (result instanceof JoinQueueResult.Matched matched) {
          matches++;
          assertThat(paired.add(matched.match().playerAId())).isTrue();
          assertThat(paired.add(matched.match().playerBId())).isTrue();
        }
      }
      assertThat(matches).isEqualTo(players / 2);
      assertThat(queue.size()).isZero();
      verify(eventPublisher, times(players / 2)).publishMatchCreated(any());
    } finally {
      executor.shutdownNow();
    }
  }
}
