/*
 * どこで: PVP API
 * 何を: シーズン内に戦績が無いプレイヤー (404) を表す例外を定義する
 * なぜ: 直接参照ではランキング行を自動作成しないため
 */
package com.example.pvp.api;

public class RankingNotFoundException extends RuntimeException {

  public RankingNotFoundException(String message) {
    super(message);
  }
}
