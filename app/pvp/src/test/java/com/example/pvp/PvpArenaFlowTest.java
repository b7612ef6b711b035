/*
 * どこで: PVP 結合テスト
 * 何を: キュー参加からマッチ成立・開始・結果送信・ランキング反映までを HTTP 経由で通す
 * なぜ: インメモリ構成でもサービス間の受け渡しと状態遷移が噛み合っていることを確認するため
 */
package com.example.pvp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.pvp.model.SeasonRecord;
import com.example.pvp.repository.InMemorySeasonRepository;
import com.example.pvp.service.PvpEventPublisher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PvpArenaFlowTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;
  @Autowired private InMemorySeasonRepository seasonRepository;
  @Autowired private PvpEventPublisher eventPublisher;

  @Test
  void usesNoopPublisherWhenNatsDisabled() {
    assertThat(eventPublisher.getClass().getSimpleName()).isEqualTo("NoopPvpEventPublisher");
  }

  @Test
  void matchLifecycleUpdatesRankings() throws Exception {
    mockMvc
        .perform(joinArena("flow-bob"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("queued"))
        .andExpect(jsonPath("$.rating").value(1000));

    final MvcResult matched =
        mockMvc
            .perform(joinArena("flow-alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("matched"))
            .andExpect(jsonPath("$.match.player_a_id").value("flow-alice"))
            .andExpect(jsonPath("$.match.player_b_id").value("flow-bob"))
            .andExpect(jsonPath("$.match.season_id").value("test-season-1"))
            .andReturn();
    final String matchId = readJson(matched).path("match").path("match_id").asText();

    mockMvc
        .perform(submitResult(matchId, "flow-alice"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("PVP_INVALID_STATUS"));

    mockMvc
        .perform(post("/v1/pvp/matches/{id}/start", matchId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("active"));

    mockMvc
        .perform(
            post("/v1/pvp/matches/{id}/spectators", matchId).header("X-User-Id", "flow-viewer"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("joined"))
        .andExpect(jsonPath("$.spectator_count").value(1));

    mockMvc
        .perform(submitResult(matchId, "flow-alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("finished"))
        .andExpect(jsonPath("$.winner_id").value("flow-alice"))
        .andExpect(jsonPath("$.rating_changes.player_a.new_rating").value(1020))
        .andExpect(jsonPath("$.rating_changes.player_b.new_rating").value(980));

    mockMvc
        .perform(submitResult(matchId, "flow-bob"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("PVP_INVALID_STATUS"));

    mockMvc
        .perform(get("/v1/pvp/rankings/{id}", "flow-alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rating").value(1020))
        .andExpect(jsonPath("$.matches_won").value(1))
        .andExpect(jsonPath("$.win_rate").value(100.0));

    mockMvc
        .perform(get("/v1/pvp/players/{id}/history", "flow-bob"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.matches[0].opponent_id").value("flow-alice"))
        .andExpect(jsonPath("$.matches[0].is_winner").value(false));

    mockMvc
        .perform(
            post("/v1/pvp/matches/{id}/spectators", matchId).header("X-User-Id", "flow-late"))
        .andExpect(status().isConflict());
  }

  @Test
  void nonParticipantWinnerIsRejected() throws Exception {
    mockMvc.perform(joinArena("winner-x")).andExpect(status().isOk());
    final MvcResult matched =
        mockMvc.perform(joinArena("winner-y")).andExpect(status().isOk()).andReturn();
    final String matchId = readJson(matched).path("match").path("match_id").asText();
    mockMvc.perform(post("/v1/pvp/matches/{id}/start", matchId)).andExpect(status().isOk());

    mockMvc
        .perform(submitResult(matchId, "winner-z"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("PVP_INVALID_WINNER"));
    mockMvc
        .perform(get("/v1/pvp/matches/{id}", matchId))
        .andExpect(jsonPath("$.status").value("active"));
  }

  @Test
  void queueCanBeLeftAndSeasonIsRequired() throws Exception {
    mockMvc.perform(joinDuel("cancel-1")).andExpect(jsonPath("$.status").value("queued"));
    mockMvc.perform(joinDuel("cancel-1")).andExpect(jsonPath("$.status").value("already_queued"));
    mockMvc
        .perform(delete("/v1/pvp/matchmaking").header("X-User-Id", "cancel-1"))
        .andExpect(jsonPath("$.status").value("cancelled"));

    final SeasonRecord season = seasonRepository.findActiveSeason().orElseThrow();
    seasonRepository.deactivate();
    try {
      mockMvc
          .perform(joinDuel("cancel-2"))
          .andExpect(status().isConflict())
          .andExpect(jsonPath("$.code").value("PVP_NO_ACTIVE_SEASON"));
      mockMvc
          .perform(get("/v1/pvp/rankings"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.total").value(0));
    } finally {
      seasonRepository.activate(season);
    }
  }

  private RequestBuilder joinArena(String playerId) {
    return post("/v1/pvp/matchmaking")
        .header("X-User-Id", playerId)
        .contentType(MediaType.APPLICATION_JSON)
        .content("{\"match_type\":\"arena\"}");
  }

  private RequestBuilder joinDuel(String playerId) {
    return post("/v1/pvp/matchmaking")
        .header("X-User-Id", playerId)
        .contentType(MediaType.APPLICATION_JSON)
        .content("{\"match_type\":\"duel\",\"rating_range\":0}");
  }

  private RequestBuilder submitResult(
      String matchId, String winnerId) {
    return post("/v1/pvp/matches/{id}/result", matchId)
        .contentType(MediaType.APPLICATION_JSON)
        .content("{\"winner_id\":\"" + winnerId + "\",\"score_a\":10,\"score_b\":5}");
  }

  private JsonNode readJson(MvcResult result) throws Exception {
    return objectMapper.readTree(result.getResponse().getContentAsString());
  }
}
