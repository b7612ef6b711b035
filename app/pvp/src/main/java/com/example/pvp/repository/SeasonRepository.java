/*
 * どこで: PVP Repository 層
 * 何を: アクティブシーズンの参照を抽象化する
 * なぜ: シーズン管理は外部所有で、このサービスは読むだけのため
 */
package com.example.pvp.repository;

import com.example.pvp.model.SeasonRecord;
import java.util.Optional;

public interface SeasonRepository {

  /** 役割: 現在アクティブなシーズンを返す。 動作: 無ければ empty。複数は存在しない前提。 */
  Optional<SeasonRecord> findActiveSeason();
}
