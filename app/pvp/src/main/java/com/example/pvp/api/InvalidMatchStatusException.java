/*
 * どこで: PVP API
 * 何を: 現在の状態で許されない遷移 (409) を表す例外を定義する
 * なぜ: 二重開始や二重結果送信を競合として返すため
 */
package com.example.pvp.api;

public class InvalidMatchStatusException extends RuntimeException {

  public InvalidMatchStatusException(String message) {
    super(message);
  }
}
