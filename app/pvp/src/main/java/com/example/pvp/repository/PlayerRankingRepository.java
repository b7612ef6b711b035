/*
 * どこで: PVP Repository 層
 * 何を: プレイヤー x シーズンのランキング行の参照・更新を抽象化する
 * なぜ: JDBC 実装とインメモリ実装を service から切り離すため
 */
package com.example.pvp.repository;

import com.example.pvp.model.PlayerRankingRecord;
import java.util.List;
import java.util.Optional;

public interface PlayerRankingRepository {

  /** 役割: ランキング行を参照する。 動作: 無ければ empty を返し、行は作らない。 */
  Optional<PlayerRankingRecord> find(String playerId, String seasonId);

  /**
   * 役割: 更新前提でランキング行を読む。 動作: JDBC 実装は行ロック (FOR UPDATE) を取る。
   * 前提: 呼び出し側がトランザクションとキー単位ロックを保持していること。
   */
  Optional<PlayerRankingRecord> findForUpdate(String playerId, String seasonId);

  /** 役割: 行が無ければ初期レートで作成する。 動作: 既存行があれば何もしない。 */
  void createIfAbsent(PlayerRankingRecord initial);

  /** 役割: レート・戦績・連勝をまとめて書き戻す。 */
  void update(PlayerRankingRecord ranking);

  /** 役割: シーズン内で rating より厳密に高いプレイヤー数を返す。 */
  long countWithHigherRating(String seasonId, int rating);

  /** 役割: rating 降順 (同率は player_id 昇順) のページを返す。 */
  List<PlayerRankingRecord> findPage(String seasonId, int limit, int offset);
}
