/*
 * どこで: PVP API
 * 何を: 試合の参照/開始/結果送信と観戦・戦績のエンドポイントを公開する
 * なぜ: 試合ライフサイクルを外部 (ゲームサーバ/クライアント) から駆動する入口を提供するため
 */
package com.example.pvp.api;

import com.example.pvp.api.request.SubmitResultRequest;
import com.example.pvp.api.response.MatchHistoryEntryResponse;
import com.example.pvp.api.response.MatchHistoryResponse;
import com.example.pvp.api.response.MatchListResponse;
import com.example.pvp.api.response.MatchResponse;
import com.example.pvp.api.response.SpectateResponse;
import com.example.pvp.api.response.SpectatorListResponse;
import com.example.pvp.api.response.SpectatorResponse;
import com.example.pvp.api.response.SubmitResultResponse;
import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.SpectatorRecord;
import com.example.pvp.service.MatchLifecycleService;
import com.example.pvp.service.SpectatorService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/pvp")
@RequiredArgsConstructor
public class MatchController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final MatchLifecycleService matchLifecycleService;
  private final SpectatorService spectatorService;

  @GetMapping("/matches/active")
  public ResponseEntity<MatchListResponse> activeMatches(
      @RequestParam(name = "limit", required = false)
          @Min(value = 1, message = "limit must be positive")
          Integer limit) {
    final List<MatchResponse> matches =
        matchLifecycleService.activeMatches(limit).stream().map(MatchResponse::from).toList();
    return ResponseEntity.ok(new MatchListResponse(matches, matches.size()));
  }

  @GetMapping("/matches/{match_id}")
  public ResponseEntity<MatchResponse> getMatch(@PathVariable("match_id") String matchId) {
    return ResponseEntity.ok(MatchResponse.from(matchLifecycleService.getMatch(matchId)));
  }

  @PostMapping("/matches/{match_id}/start")
  public ResponseEntity<MatchResponse> startMatch(@PathVariable("match_id") String matchId) {
    final MatchRecord started = matchLifecycleService.startMatch(matchId);
    return ResponseEntity.ok(MatchResponse.from(started));
  }

  @PostMapping("/matches/{match_id}/result")
  public ResponseEntity<SubmitResultResponse> submitResult(
      @PathVariable("match_id") String matchId,
      @Valid @RequestBody SubmitResultRequest request) {
    return ResponseEntity.ok(
        SubmitResultResponse.from(
            matchLifecycleService.submitResult(
                matchId,
                request.winnerId(),
                request.scoreA(),
                request.scoreB(),
                request.movesAOrZero(),
                request.movesBOrZero())));
  }

  @PostMapping("/matches/{match_id}/spectators")
  public ResponseEntity<SpectateResponse> joinSpectate(
      @PathVariable("match_id") String matchId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(SpectateResponse.from(spectatorService.joinSpectate(matchId, userId)));
  }

  @GetMapping("/matches/{match_id}/spectators")
  public ResponseEntity<SpectatorListResponse> listSpectators(
      @PathVariable("match_id") String matchId) {
    final List<SpectatorResponse> spectators =
        spectatorService.listSpectators(matchId).stream().map(SpectatorResponse::from).toList();
    return ResponseEntity.ok(new SpectatorListResponse(matchId, spectators, spectators.size()));
  }

  @DeleteMapping("/spectators/{spectator_id}")
  public ResponseEntity<SpectateResponse> leaveSpectate(
      @PathVariable("spectator_id") String spectatorId) {
    final Optional<SpectatorRecord> left = spectatorService.leaveSpectate(spectatorId);
    return ResponseEntity.ok(
        SpectateResponse.left(left.map(SpectatorRecord::matchId).orElse(null), spectatorId));
  }

  @GetMapping("/players/{player_id}/history")
  public ResponseEntity<MatchHistoryResponse> matchHistory(
      @PathVariable("player_id") String playerId,
      @RequestParam(name = "limit", required = false)
          @Min(value = 1, message = "limit must be positive")
          Integer limit) {
    final List<MatchHistoryEntryResponse> matches =
        matchLifecycleService.matchHistory(playerId, limit).stream()
            .map(MatchHistoryEntryResponse::from)
            .toList();
    return ResponseEntity.ok(new MatchHistoryResponse(playerId, matches, matches.size()));
  }
}
