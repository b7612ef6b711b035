package com.example.pvp.repository;

import com.example.pvp.model.PlayerRankingRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "pvp.store", havingValue = "memory")
public class InMemoryPlayerRankingRepository implements PlayerRankingRepository {

  private static final Comparator<PlayerRankingRecord> RANKING_ORDER =
      Comparator.comparingInt(PlayerRankingRecord::rating)
          .reversed()
          .thenComparing(PlayerRankingRecord::playerId);

  private final ConcurrentMap<Key, PlayerRankingRecord> rankings = new ConcurrentHashMap<>();

  @Override
  public Optional<PlayerRankingRecord> find(String playerId, String seasonId) {
    return Optional.ofNullable(rankings.get(new Key(playerId, seasonId)));
  }

  // 行ロックは無い。呼び出し側の KeyedLockRegistry で直列化する。
  @Override
  public Optional<PlayerRankingRecord> findForUpdate(String playerId, String seasonId) {
    return find(playerId, seasonId);
  }

  @Override
  public void createIfAbsent(PlayerRankingRecord initial) {
    rankings.putIfAbsent(new Key(initial.playerId(), initial.seasonId()), initial);
  }

  @Override
  public void update(PlayerRankingRecord ranking) {
    final PlayerRankingRecord previous =
        rankings.replace(new Key(ranking.playerId(), ranking.seasonId()), ranking);
    if (previous == null) {
      throw new IllegalStateException(
          "ranking row missing: player_id="
              + ranking.playerId()
              + " season_id="
              + ranking.seasonId());
    }
  }

  @Override
  public long countWithHigherRating(String seasonId, int rating) {
    return rankings.values().stream()
        .filter(ranking -> ranking.seasonId().equals(seasonId))
        .filter(ranking -> ranking.rating() > rating)
        .count();
  }

  @Override
  public List<PlayerRankingRecord> findPage(String seasonId, int limit, int offset) {
    return rankings.values().stream()
        .filter(ranking -> ranking.seasonId().equals(seasonId))
        .sorted(RANKING_ORDER)
        .skip(offset)
        .limit(limit)
        .toList();
  }

  private record Key(String playerId, String seasonId) {}
}
