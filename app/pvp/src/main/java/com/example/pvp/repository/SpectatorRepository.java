package com.example.pvp.repository;

import com.example.pvp.model.SpectatorRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SpectatorRepository {

  void insert(SpectatorRecord spectator);

  Optional<SpectatorRecord> findById(String spectatorId);

  /** (match, player) の有効な観戦レコード。 */
  Optional<SpectatorRecord> findActive(String matchId, String playerId);

  /** 有効な場合だけ left_at を設定し、更新後のレコードを返す。既に退出済み・未登録は empty。 */
  Optional<SpectatorRecord> markLeft(String spectatorId, Instant leftAt);

  List<SpectatorRecord> findActiveByMatch(String matchId);
}
