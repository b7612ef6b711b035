package com.example.pvp.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.pvp.AbstractPostgresContainerTest;
import com.example.pvp.model.MatchFinish;
import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.MatchStatus;
import com.example.pvp.model.MatchType;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Testcontainers(disabledWithoutDocker = true)
class JdbcMatchRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private MatchRepository matchRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM pvp_spectators");
    jdbcTemplate.update("DELETE FROM pvp_matches");
  }

  @Test
  void usesJdbcImplementation() {
    assertThat(matchRepository).isInstanceOf(JdbcMatchRepository.class);
  }

  @Test
  void insertAndFindRoundTripsNullableColumns() {
    final MatchRecord match = waiting("m1", T0);
    matchRepository.insert(match);

    final MatchRecord found = matchRepository.findById("m1").orElseThrow();

    assertThat(found).isEqualTo(match);
    assertThat(found.startedAt()).isNull();
    assertThat(found.winnerId()).isNull();
  }

  @Test
  void transitionsSucceedOnlyFromExpectedStatus() {
    matchRepository.insert(waiting("m1", T0));

    assertThat(matchRepository.transitionToFinished("m1", finish("a"))).isEmpty();
    final Optional<MatchRecord> started = matchRepository.transitionToActive("m1", T0);
    assertThat(started).isPresent();
    assertThat(started.get().status()).isEqualTo(MatchStatus.ACTIVE);
    assertThat(matchRepository.transitionToActive("m1", T0.plusSeconds(1))).isEmpty();

    final Optional<MatchRecord> finished = matchRepository.transitionToFinished("m1", finish("a"));
    assertThat(finished).isPresent();
    assertThat(finished.get().winnerId()).isEqualTo("a");
    assertThat(finished.get().durationSeconds()).isEqualTo(60L);
    assertThat(matchRepository.transitionToFinished("m1", finish("b"))).isEmpty();
    assertThat(matchRepository.findById("m1").orElseThrow().winnerId()).isEqualTo("a");
  }

  @Test
  void spectatorCountNeverDropsBelowZero() {
    matchRepository.insert(waiting("m1", T0));

    assertThat(matchRepository.adjustSpectatorCount("m1", 1).orElseThrow().spectatorCount())
        .isEqualTo(1);
    matchRepository.adjustSpectatorCount("m1", -1);
    assertThat(matchRepository.adjustSpectatorCount("m1", -1).orElseThrow().spectatorCount())
        .isZero();
    assertThat(matchRepository.adjustSpectatorCount("missing", 1)).isEmpty();
  }

  @Test
  void activeAndHistoryQueriesFilterByStatus() {
    matchRepository.insert(waiting("old", T0));
    matchRepository.insert(waiting("new", T0.plusSeconds(10)));
    matchRepository.insert(waiting("done", T0.plusSeconds(20)));
    matchRepository.transitionToActive("done", T0.plusSeconds(20));
    matchRepository.transitionToFinished("done", finish(null));

    assertThat(matchRepository.findActive(10))
        .extracting(MatchRecord::matchId)
        .containsExactly("new", "old");
    assertThat(matchRepository.findActive(1)).hasSize(1);
    assertThat(matchRepository.findFinishedByPlayer("b", 10))
        .extracting(MatchRecord::matchId)
        .containsExactly("done");
    assertThat(matchRepository.findFinishedByPlayer("c", 10)).isEmpty();
  }

  private static MatchRecord waiting(String matchId, Instant createdAt) {
    return MatchRecord.waiting(matchId, MatchType.ARENA, "s1", "a", 1000, "b", 1010, createdAt);
  }

  private static MatchFinish finish(String winnerId) {
    return new MatchFinish(winnerId, 3, 1, 20, 18, 60, T0.plusSeconds(60));
  }
}
