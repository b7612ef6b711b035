/*
 * どこで: PVP API
 * 何を: アクティブなシーズンが無い状態 (409) を表す例外を定義する
 * なぜ: シーズン外のマッチメイクとランキング参照を明確に拒否するため
 */
package com.example.pvp.api;

public class NoActiveSeasonException extends RuntimeException {

  public NoActiveSeasonException(String message) {
    super(message);
  }
}
