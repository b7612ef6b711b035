/*
 * どこで: PVP 設定
 * 何を: レーティング初期値・キュー・ランキング・一覧の既定値を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.example.pvp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pvp")
public record PvpProperties(
    int defaultRating,
    int defaultRatingRange,
    int estimatedWaitSecondsPerEntry,
    Ranking ranking,
    Matches matches,
    Memory memory) {

  public record Ranking(int defaultLimit, int maxLimit) {}

  public record Matches(int activeDefaultLimit, int historyDefaultLimit) {}

  /** pvp.store=memory のときだけ使う。activeSeasonId が空ならシーズン無しで起動する。 */
  public record Memory(String activeSeasonId, String activeSeasonName, int activeSeasonNumber) {}
}
