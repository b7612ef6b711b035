/*
 * どこで: PVP ドメインモデル
 * 何を: サポートする試合種別を定義する
 * なぜ: match_type 入力の妥当性を列挙型で固定するため
 */
package com.example.pvp.model;

public enum MatchType {
  ARENA("arena"),
  DUEL("duel");

  private final String value;

  MatchType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: API で受け取った match_type 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  public static MatchType fromValue(String matchType) {
    for (MatchType type : values()) {
      if (type.value.equalsIgnoreCase(matchType)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unsupported match_type: " + matchType);
  }
}
