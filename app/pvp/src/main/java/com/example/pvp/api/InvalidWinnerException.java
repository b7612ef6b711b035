/*
 * どこで: PVP API
 * 何を: 参加者以外を勝者に指定した結果送信 (400) を表す例外を定義する
 * なぜ: 結果送信の入力誤りを状態競合と分けて返すため
 */
package com.example.pvp.api;

public class InvalidWinnerException extends RuntimeException {

  public InvalidWinnerException(String message) {
    super(message);
  }
}
