/*
 * どこで: PVP API
 * 何を: 観戦が許可されていない試合への観戦要求 (403) を表す例外を定義する
 * なぜ: 試合側の設定による拒否を他のエラーと区別するため
 */
package com.example.pvp.api;

public class SpectateNotAllowedException extends RuntimeException {

  public SpectateNotAllowedException(String message) {
    super(message);
  }
}
