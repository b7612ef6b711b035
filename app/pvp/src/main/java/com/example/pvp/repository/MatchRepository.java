/*
 * どこで: PVP Repository 層
 * 何を: 試合の永続化と状態遷移 (CAS) を抽象化する
 * なぜ: 同時の開始/結果送信でも遷移が一度だけ成功するよう保存側で判定するため
 */
package com.example.pvp.repository;

import com.example.pvp.model.MatchFinish;
import com.example.pvp.model.MatchRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MatchRepository {

  void insert(MatchRecord match);

  Optional<MatchRecord> findById(String matchId);

  /** 役割: WAITING -> ACTIVE。 動作: 現在 WAITING の場合だけ更新し、更新後の試合を返す。それ以外は empty。 */
  Optional<MatchRecord> transitionToActive(String matchId, Instant startedAt);

  /** 役割: ACTIVE -> FINISHED。 動作: 現在 ACTIVE の場合だけ結果を書き込み、更新後の試合を返す。それ以外は empty。 */
  Optional<MatchRecord> transitionToFinished(String matchId, MatchFinish finish);

  /** 役割: 観戦者数を delta だけ増減する。 動作: 0 未満にはならない。試合が無ければ empty。 */
  Optional<MatchRecord> adjustSpectatorCount(String matchId, int delta);

  /** WAITING / ACTIVE の試合を新しい順に返す。 */
  List<MatchRecord> findActive(int limit);

  /** プレイヤーが参加した FINISHED の試合を終了時刻の新しい順に返す。 */
  List<MatchRecord> findFinishedByPlayer(String playerId, int limit);
}
