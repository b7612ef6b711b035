/*
 * どこで: PVP ドメインモデル
 * 何を: プレイヤー x シーズン単位のレーティングと戦績を表す
 * なぜ: 試合結果の反映 (レート・勝敗数・連勝) を 1 箇所で計算するため
 */
package com.example.pvp.model;

import java.time.Instant;

public record PlayerRankingRecord(
    String playerId,
    String seasonId,
    int rating,
    int maxRating,
    int matchesPlayed,
    int matchesWon,
    int matchesLost,
    int matchesDrawn,
    int currentStreak,
    int maxStreak,
    Instant updatedAt) {

  public static PlayerRankingRecord newcomer(
      String playerId, String seasonId, int initialRating, Instant now) {
    return new PlayerRankingRecord(
        playerId, seasonId, initialRating, initialRating, 0, 0, 0, 0, 0, 0, now);
  }

  /**
   * 役割: 1 試合分の結果を反映した新しいレコードを返す。
   * 動作: current_streak は符号付き。勝利で正方向へ、敗北で負方向へ伸ばし、引き分けで 0 に戻す。
   */
  public PlayerRankingRecord afterMatch(int newRating, MatchOutcome outcome, Instant now) {
    int won = matchesWon;
    int lost = matchesLost;
    int drawn = matchesDrawn;
    int streak = currentStreak;
    switch (outcome) {
      case WIN -> {
        won++;
        streak = Math.max(streak, 0) + 1;
      }
      case LOSS -> {
        lost++;
        streak = Math.min(streak, 0) - 1;
      }
      case DRAW -> {
        drawn++;
        streak = 0;
      }
    }
    return new PlayerRankingRecord(
        playerId,
        seasonId,
        newRating,
        Math.max(maxRating, newRating),
        matchesPlayed + 1,
        won,
        lost,
        drawn,
        streak,
        Math.max(maxStreak, streak),
        now);
  }

  /** 勝率 (%)。小数点以下 2 桁で丸める。未出場は 0。 */
  public double winRate() {
    if (matchesPlayed == 0) {
      return 0.0;
    }
    return Math.round(matchesWon * 10000.0 / matchesPlayed) / 100.0;
  }
}
