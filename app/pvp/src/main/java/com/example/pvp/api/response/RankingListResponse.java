package com.example.pvp.api.response;

import com.example.pvp.model.RankingPage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/** アクティブシーズンが無い場合は season_id=null の空一覧。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス生成専用であり、防御的コピーを行わないため")
public record RankingListResponse(
    String seasonId, List<PlayerRankingResponse> rankings, int total) {

  public static RankingListResponse from(RankingPage page) {
    final List<PlayerRankingResponse> rankings =
        page.rankings().stream().map(PlayerRankingResponse::from).toList();
    return new RankingListResponse(page.seasonId(), rankings, rankings.size());
  }
}
