package com.example.pvp.api;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.pvp.model.PlayerRankingRecord;
import com.example.pvp.model.RankedPlayer;
import com.example.pvp.model.RankingPage;
import com.example.pvp.service.RankingService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RankingController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class RankingControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private RankingService rankingService;

  @Test
  void playerRankingIncludesRankAndWinRate() throws Exception {
    when(rankingService.getPlayerRanking("p1", null))
        .thenReturn(
            new RankedPlayer(
                new PlayerRankingRecord("p1", "s1", 1040, 1040, 3, 2, 1, 0, 2, 2, NOW), 4));

    mockMvc
        .perform(get("/v1/pvp/rankings/p1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.season_id").value("s1"))
        .andExpect(jsonPath("$.rank").value(4))
        .andExpect(jsonPath("$.matches_won").value(2))
        .andExpect(jsonPath("$.current_streak").value(2))
        .andExpect(jsonPath("$.win_rate").value(66.67));
  }

  @Test
  void playerRankingReturns404WhenMissing() throws Exception {
    when(rankingService.getPlayerRanking("ghost", "s1"))
        .thenThrow(new RankingNotFoundException("ranking not found"));

    mockMvc
        .perform(get("/v1/pvp/rankings/ghost").param("season_id", "s1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("PVP_RANKING_NOT_FOUND"));
  }

  @Test
  void rankingListReturnsPage() throws Exception {
    when(rankingService.getRankingList(isNull(), isNull(), isNull()))
        .thenReturn(
            new RankingPage(
                "s1",
                List.of(
                    new RankedPlayer(PlayerRankingRecord.newcomer("p1", "s1", 1100, NOW), 1),
                    new RankedPlayer(PlayerRankingRecord.newcomer("p2", "s1", 1000, NOW), 2))));

    mockMvc
        .perform(get("/v1/pvp/rankings"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.season_id").value("s1"))
        .andExpect(jsonPath("$.total").value(2))
        .andExpect(jsonPath("$.rankings[1].player_id").value("p2"))
        .andExpect(jsonPath("$.rankings[1].rank").value(2));
  }

  @Test
  void rankingListWithoutSeasonIsEmpty() throws Exception {
    when(rankingService.getRankingList(isNull(), isNull(), isNull()))
        .thenReturn(RankingPage.empty());

    mockMvc
        .perform(get("/v1/pvp/rankings"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(0))
        .andExpect(jsonPath("$.rankings").isEmpty());
  }

  @Test
  void rankingListRejectsNegativeOffset() throws Exception {
    mockMvc
        .perform(get("/v1/pvp/rankings").param("offset", "-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("PVP_BAD_REQUEST"));
  }

  @Test
  void rankingListRejectsNonNumericLimit() throws Exception {
    mockMvc
        .perform(get("/v1/pvp/rankings").param("limit", "ten"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("limit is invalid"));
  }
}
