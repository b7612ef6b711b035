/*
 * どこで: PVP サービス層
 * 何を: Elo 方式の期待スコア・K 係数・新レートを計算する
 * なぜ: 結果確定処理からレーティング数式を切り離し、単体で検証できるようにするため
 */
package com.example.pvp.service;

import org.springframework.stereotype.Component;

@Component
public class EloRatingCalculator {

  static final int PROVISIONAL_MATCHES = 30;
  static final int MASTER_RATING = 2400;
  static final int K_PROVISIONAL = 40;
  static final int K_MASTER = 24;
  static final int K_STANDARD = 32;

  public record ExpectedScores(double playerA, double playerB) {}

  /** 役割: A/B それぞれの期待スコアを返す。 動作: 2 値の和は常に 1。 */
  public ExpectedScores expectedScore(int ratingA, int ratingB) {
    final double expectedA = 1.0 / (1.0 + Math.pow(10.0, (ratingB - ratingA) / 400.0));
    return new ExpectedScores(expectedA, 1.0 - expectedA);
  }

  /**
   * 役割: K 係数を決める。
   * 動作: 試合数 30 未満は 40、以降はレート 2400 以上で 24、それ未満で 32。
   */
  public int kFactor(int rating, int matchesPlayed) {
    if (matchesPlayed < PROVISIONAL_MATCHES) {
      return K_PROVISIONAL;
    }
    return rating >= MASTER_RATING ? K_MASTER : K_STANDARD;
  }

  /** 役割: 1 試合後のレートを返す。 動作: 四捨五入し、0 未満にはしない。 */
  public int newRating(int rating, double expected, double actual, int matchesPlayed) {
    final double next = rating + kFactor(rating, matchesPlayed) * (actual - expected);
    return (int) Math.max(0, Math.round(next));
  }
}
