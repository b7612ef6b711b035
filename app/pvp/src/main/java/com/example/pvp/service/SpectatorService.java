/*
 * どこで: PVP サービス層
 * 何を: 観戦の参加・退出・一覧を扱う
 * なぜ: 試合の観戦者数と有効な観戦レコードの整合を試合単位のロックで保つため
 */
package com.example.pvp.service;

import com.example.pvp.api.InvalidMatchStatusException;
import com.example.pvp.api.InvalidPvpRequestException;
import com.example.pvp.api.MatchNotFoundException;
import com.example.pvp.api.SpectateNotAllowedException;
import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.SpectateResult;
import com.example.pvp.model.SpectatorRecord;
import com.example.pvp.repository.MatchRepository;
import com.example.pvp.repository.SpectatorRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SpectatorService {

  private static final Logger logger = LoggerFactory.getLogger(SpectatorService.class);

  private final MatchRepository matchRepository;
  private final SpectatorRepository spectatorRepository;
  private final KeyedLockRegistry lockRegistry;
  private final Clock clock;

  /**
   * 役割: 試合の観戦を開始する。
   * 動作: 試合の存在 -> 観戦許可 -> 未終了の順に検証し、既に観戦中なら既存の spectator_id を返す。
   */
  public SpectateResult joinSpectate(String matchId, String playerId) {
    if (playerId == null || playerId.isBlank()) {
      throw new InvalidPvpRequestException("player_id is required");
    }
    final MatchRecord match = requireMatch(matchId);
    if (!match.allowSpectate()) {
      throw new SpectateNotAllowedException("spectating is not allowed: match_id=" + matchId);
    }
    final boolean open =
        switch (match.status()) {
          case WAITING, ACTIVE -> true;
          case FINISHED -> false;
        };
    if (!open) {
      throw new InvalidMatchStatusException(
          "cannot spectate match in status " + match.status().value());
    }

    return lockRegistry.withLock(
        spectateLockKey(matchId),
        () -> {
          final Optional<SpectatorRecord> existing =
              spectatorRepository.findActive(matchId, playerId);
          if (existing.isPresent()) {
            return new SpectateResult.AlreadySpectating(existing.get().spectatorId(), matchId);
          }
          final SpectatorRecord spectator =
              new SpectatorRecord(
                  UUID.randomUUID().toString(), matchId, playerId, Instant.now(clock), null);
          spectatorRepository.insert(spectator);
          final MatchRecord updated =
              matchRepository
                  .adjustSpectatorCount(matchId, 1)
                  .orElseThrow(() -> new MatchNotFoundException("match not found: " + matchId));
          logger.info(
              "pvp spectate joined match_id={} player_id={} spectator_id={} spectator_count={}",
              matchId,
              playerId,
              spectator.spectatorId(),
              updated.spectatorCount());
          return new SpectateResult.Joined(
              spectator.spectatorId(), matchId, updated.spectatorCount());
        });
  }

  /**
   * 役割: 観戦を終了する。
   * 動作: 有効なレコードだけ退出させて観戦者数を減らす。未登録・退出済みは何もしない。
   */
  public Optional<SpectatorRecord> leaveSpectate(String spectatorId) {
    if (spectatorId == null || spectatorId.isBlank()) {
      throw new InvalidPvpRequestException("spectator_id is required");
    }
    final Optional<SpectatorRecord> known = spectatorRepository.findById(spectatorId);
    if (known.isEmpty()) {
      return Optional.empty();
    }
    final String matchId = known.get().matchId();
    return lockRegistry.withLock(
        spectateLockKey(matchId),
        () -> {
          final Optional<SpectatorRecord> left =
              spectatorRepository.markLeft(spectatorId, Instant.now(clock));
          left.ifPresent(
              record -> {
                matchRepository.adjustSpectatorCount(matchId, -1);
                logger.info(
                    "pvp spectate left match_id={} spectator_id={}", matchId, spectatorId);
              });
          return left;
        });
  }

  public List<SpectatorRecord> listSpectators(String matchId) {
    requireMatch(matchId);
    return spectatorRepository.findActiveByMatch(matchId);
  }

  private MatchRecord requireMatch(String matchId) {
    if (matchId == null || matchId.isBlank()) {
      throw new InvalidPvpRequestException("match_id is required");
    }
    return matchRepository
        .findById(matchId)
        .orElseThrow(() -> new MatchNotFoundException("match not found: " + matchId));
  }

  private static String spectateLockKey(String matchId) {
    return "spectate:" + matchId;
  }
}
