package com.example.pvp.api;

import com.example.pvp.api.response.PlayerRankingResponse;
import com.example.pvp.api.response.RankingListResponse;
import com.example.pvp.service.RankingService;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/pvp/rankings")
@RequiredArgsConstructor
public class RankingController {

  private final RankingService rankingService;

  @GetMapping
  public ResponseEntity<RankingListResponse> rankingList(
      @RequestParam(name = "season_id", required = false) String seasonId,
      @RequestParam(name = "limit", required = false)
          @Min(value = 1, message = "limit must be positive")
          Integer limit,
      @RequestParam(name = "offset", required = false)
          @Min(value = 0, message = "offset must not be negative")
          Integer offset) {
    return ResponseEntity.ok(
        RankingListResponse.from(rankingService.getRankingList(seasonId, limit, offset)));
  }

  @GetMapping("/{player_id}")
  public ResponseEntity<PlayerRankingResponse> playerRanking(
      @PathVariable("player_id") String playerId,
      @RequestParam(name = "season_id", required = false) String seasonId) {
    return ResponseEntity.ok(
        PlayerRankingResponse.from(rankingService.getPlayerRanking(playerId, seasonId)));
  }
}
