/*
 * どこで: PVP インメモリストア
 * 何を: 試合をプロセス内 Map に保持し、状態遷移を computeIfPresent で条件付き更新する
 * なぜ: JDBC 実装と同じ「遷移は一度だけ成功する」性質を DB 無しでも保つため
 */
package com.example.pvp.repository;

import com.example.pvp.model.MatchFinish;
import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.MatchStatus;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "pvp.store", havingValue = "memory")
public class InMemoryMatchRepository implements MatchRepository {

  private final ConcurrentMap<String, MatchRecord> matches = new ConcurrentHashMap<>();

  @Override
  public void insert(MatchRecord match) {
    if (matches.putIfAbsent(match.matchId(), match) != null) {
      throw new IllegalStateException("duplicate match_id: " + match.matchId());
    }
  }

  @Override
  public Optional<MatchRecord> findById(String matchId) {
    return Optional.ofNullable(matches.get(matchId));
  }

  @Override
  public Optional<MatchRecord> transitionToActive(String matchId, Instant startedAt) {
    return updateIf(matchId, MatchStatus.WAITING, current -> current.started(startedAt));
  }

  @Override
  public Optional<MatchRecord> transitionToFinished(String matchId, MatchFinish finish) {
    return updateIf(matchId, MatchStatus.ACTIVE, current -> current.finished(finish));
  }

  @Override
  public Optional<MatchRecord> adjustSpectatorCount(String matchId, int delta) {
    return Optional.ofNullable(
        matches.computeIfPresent(
            matchId,
            (id, current) -> current.withSpectatorCount(current.spectatorCount() + delta)));
  }

  @Override
  public List<MatchRecord> findActive(int limit) {
    return matches.values().stream()
        .filter(match -> match.status() != MatchStatus.FINISHED)
        .sorted(
            Comparator.comparing(MatchRecord::createdAt)
                .reversed()
                .thenComparing(MatchRecord::matchId))
        .limit(limit)
        .toList();
  }

  @Override
  public List<MatchRecord> findFinishedByPlayer(String playerId, int limit) {
    return matches.values().stream()
        .filter(match -> match.status() == MatchStatus.FINISHED)
        .filter(match -> match.isParticipant(playerId))
        .sorted(
            Comparator.comparing(MatchRecord::finishedAt)
                .reversed()
                .thenComparing(MatchRecord::matchId))
        .limit(limit)
        .toList();
  }

  private Optional<MatchRecord> updateIf(
      String matchId, MatchStatus expected, UnaryOperator<MatchRecord> transition) {
    final AtomicReference<MatchRecord> updated = new AtomicReference<>();
    matches.computeIfPresent(
        matchId,
        (id, current) -> {
          if (current.status() != expected) {
            return current;
          }
          final MatchRecord next = transition.apply(current);
          updated.set(next);
          return next;
        });
    return Optional.ofNullable(updated.get());
  }
}
