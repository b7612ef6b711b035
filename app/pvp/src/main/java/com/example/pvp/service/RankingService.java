/*
 * どこで: PVP サービス層
 * 何を: シーズンランキングの個人参照と一覧を提供する
 * なぜ: 順位を保存せず、参照のたびに rating から算出するため
 */
package com.example.pvp.service;

import com.example.pvp.api.InvalidPvpRequestException;
import com.example.pvp.api.RankingNotFoundException;
import com.example.pvp.config.PvpProperties;
import com.example.pvp.model.PlayerRankingRecord;
import com.example.pvp.model.RankedPlayer;
import com.example.pvp.model.RankingPage;
import com.example.pvp.model.SeasonRecord;
import com.example.pvp.repository.PlayerRankingRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RankingService {

  private final SeasonContext seasonContext;
  private final PlayerRankingRepository rankingRepository;
  private final PvpProperties properties;

  /** 役割: シーズン内順位を返す。 動作: 自分より厳密に高いレートの人数 + 1。同率は同順位。 */
  public int rank(String playerId, String seasonId) {
    final PlayerRankingRecord ranking =
        rankingRepository
            .find(playerId, seasonId)
            .orElseThrow(() -> notFound(playerId, seasonId));
    return rankOf(ranking);
  }

  /**
   * 役割: 1 プレイヤーのランキングを返す。
   * 動作: seasonId 未指定はアクティブシーズン。行が無ければ作らずに RankingNotFoundException。
   */
  public RankedPlayer getPlayerRanking(String playerId, String seasonId) {
    if (playerId == null || playerId.isBlank()) {
      throw new InvalidPvpRequestException("player_id is required");
    }
    final String resolvedSeasonId = seasonContext.resolveSeasonId(seasonId);
    final PlayerRankingRecord ranking =
        rankingRepository
            .find(playerId, resolvedSeasonId)
            .orElseThrow(() -> notFound(playerId, resolvedSeasonId));
    return new RankedPlayer(ranking, rankOf(ranking));
  }

  /**
   * 役割: ランキング一覧を返す。
   * 動作: seasonId 未指定かつアクティブシーズン無しなら空。順位は offset + index + 1。
   */
  public RankingPage getRankingList(String seasonId, Integer limit, Integer offset) {
    final int resolvedLimit = resolveLimit(limit);
    final int resolvedOffset = offset == null ? 0 : offset;
    if (resolvedOffset < 0) {
      throw new InvalidPvpRequestException("offset must not be negative");
    }
    final Optional<String> targetSeason =
        seasonId != null && !seasonId.isBlank()
            ? Optional.of(seasonId)
            : seasonContext.activeSeason().map(SeasonRecord::seasonId);
    if (targetSeason.isEmpty()) {
      return RankingPage.empty();
    }
    final List<PlayerRankingRecord> page =
        rankingRepository.findPage(targetSeason.get(), resolvedLimit, resolvedOffset);
    final List<RankedPlayer> ranked = new ArrayList<>(page.size());
    for (int i = 0; i < page.size(); i++) {
      ranked.add(new RankedPlayer(page.get(i), resolvedOffset + i + 1));
    }
    return new RankingPage(targetSeason.get(), ranked);
  }

  private int rankOf(PlayerRankingRecord ranking) {
    return (int) rankingRepository.countWithHigherRating(ranking.seasonId(), ranking.rating()) + 1;
  }

  private int resolveLimit(Integer limit) {
    if (limit == null) {
      return properties.ranking().defaultLimit();
    }
    if (limit <= 0) {
      throw new InvalidPvpRequestException("limit must be positive");
    }
    return Math.min(limit, properties.ranking().maxLimit());
  }

  private RankingNotFoundException notFound(String playerId, String seasonId) {
    return new RankingNotFoundException(
        "ranking not found: player_id=" + playerId + " season_id=" + seasonId);
  }
}
