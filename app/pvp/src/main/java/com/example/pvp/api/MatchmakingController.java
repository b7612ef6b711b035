/*
 * どこで: PVP API
 * 何を: マッチメイク参加/取消/待機状況のエンドポイントを公開する
 * なぜ: クライアントからのマッチメイク要求を受け付ける入口を提供するため
 */
package com.example.pvp.api;

import com.example.pvp.api.request.JoinQueueRequest;
import com.example.pvp.api.response.CancelQueueResponse;
import com.example.pvp.api.response.JoinQueueResponse;
import com.example.pvp.api.response.QueueStatusResponse;
import com.example.pvp.api.response.QueuedPlayerResponse;
import com.example.pvp.model.CancelQueueResult;
import com.example.pvp.model.MatchType;
import com.example.pvp.model.QueuedPlayer;
import com.example.pvp.service.MatchmakingQueue;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/pvp/matchmaking")
@RequiredArgsConstructor
public class MatchmakingController {

  static final String HEADER_USER_ID = "X-User-Id";
  private final MatchmakingQueue matchmakingQueue;

  @PostMapping
  public ResponseEntity<JoinQueueResponse> join(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody(required = false) JoinQueueRequest request) {
    final JoinQueueRequest body = request == null ? new JoinQueueRequest(null, null) : request;
    return ResponseEntity.ok(
        JoinQueueResponse.from(
            matchmakingQueue.join(userId, parseMatchType(body.matchType()), body.ratingRange())));
  }

  @DeleteMapping
  public ResponseEntity<CancelQueueResponse> cancel(@RequestHeader(HEADER_USER_ID) String userId) {
    final CancelQueueResult result = matchmakingQueue.cancel(userId);
    return ResponseEntity.ok(new CancelQueueResponse(result.value(), userId));
  }

  @GetMapping("/queue")
  public ResponseEntity<QueueStatusResponse> queueStatus() {
    final List<QueuedPlayer> players = matchmakingQueue.snapshot();
    return ResponseEntity.ok(
        new QueueStatusResponse(
            players.size(), players.stream().map(QueuedPlayerResponse::from).toList()));
  }

  private MatchType parseMatchType(String matchType) {
    if (matchType == null || matchType.isBlank()) {
      return null;
    }
    try {
      return MatchType.fromValue(matchType);
    } catch (IllegalArgumentException ex) {
      throw new InvalidPvpRequestException(ex.getMessage());
    }
  }
}
