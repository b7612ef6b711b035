/*
 * どこで: PVP ドメインモデル
 * 何を: 試合のライフサイクル状態を定義する
 * なぜ: WAITING -> ACTIVE -> FINISHED の一方向遷移を型で表すため
 */
package com.example.pvp.model;

public enum MatchStatus {
  WAITING,
  ACTIVE,
  FINISHED;

  public String value() {
    return name().toLowerCase(java.util.Locale.ROOT);
  }
}
