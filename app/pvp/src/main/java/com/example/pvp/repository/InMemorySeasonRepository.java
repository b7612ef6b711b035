/*
 * どこで: PVP インメモリストア
 * 何を: 設定値から起動時のアクティブシーズンを 1 件保持する
 * なぜ: DB 無しのローカル実行とサービステストでシーズン前提を満たすため
 */
package com.example.pvp.repository;

import com.example.pvp.config.PvpProperties;
import com.example.pvp.model.SeasonRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "pvp.store", havingValue = "memory")
public class InMemorySeasonRepository implements SeasonRepository {

  private final AtomicReference<SeasonRecord> activeSeason = new AtomicReference<>();

  public InMemorySeasonRepository() {}

  @Autowired
  public InMemorySeasonRepository(PvpProperties properties, Clock clock) {
    final PvpProperties.Memory memory = properties.memory();
    if (memory == null || memory.activeSeasonId() == null || memory.activeSeasonId().isBlank()) {
      return;
    }
    final String name =
        memory.activeSeasonName() == null ? memory.activeSeasonId() : memory.activeSeasonName();
    activate(
        new SeasonRecord(
            memory.activeSeasonId(),
            name,
            memory.activeSeasonNumber(),
            true,
            Instant.now(clock),
            null));
  }

  @Override
  public Optional<SeasonRecord> findActiveSeason() {
    return Optional.ofNullable(activeSeason.get());
  }

  public void activate(SeasonRecord season) {
    activeSeason.set(season);
  }

  public void deactivate() {
    activeSeason.set(null);
  }
}
