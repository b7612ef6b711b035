package com.example.pvp.repository;

import com.example.pvp.model.SpectatorRecord;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "pvp.store", havingValue = "memory")
public class InMemorySpectatorRepository implements SpectatorRepository {

  private final ConcurrentMap<String, SpectatorRecord> spectators = new ConcurrentHashMap<>();

  @Override
  public void insert(SpectatorRecord spectator) {
    if (spectators.putIfAbsent(spectator.spectatorId(), spectator) != null) {
      throw new IllegalStateException("duplicate spectator_id: " + spectator.spectatorId());
    }
  }

  @Override
  public Optional<SpectatorRecord> findById(String spectatorId) {
    return Optional.ofNullable(spectators.get(spectatorId));
  }

  @Override
  public Optional<SpectatorRecord> findActive(String matchId, String playerId) {
    return spectators.values().stream()
        .filter(SpectatorRecord::isActive)
        .filter(spectator -> spectator.matchId().equals(matchId))
        .filter(spectator -> spectator.playerId().equals(playerId))
        .findFirst();
  }

  @Override
  public Optional<SpectatorRecord> markLeft(String spectatorId, Instant leftAt) {
    final AtomicReference<SpectatorRecord> updated = new AtomicReference<>();
    spectators.computeIfPresent(
        spectatorId,
        (id, current) -> {
          if (!current.isActive()) {
            return current;
          }
          final SpectatorRecord left = current.leave(leftAt);
          updated.set(left);
          return left;
        });
    return Optional.ofNullable(updated.get());
  }

  @Override
  public List<SpectatorRecord> findActiveByMatch(String matchId) {
    return spectators.values().stream()
        .filter(SpectatorRecord::isActive)
        .filter(spectator -> spectator.matchId().equals(matchId))
        .sorted(
            Comparator.comparing(SpectatorRecord::joinedAt)
                .thenComparing(SpectatorRecord::spectatorId))
        .toList();
  }
}
