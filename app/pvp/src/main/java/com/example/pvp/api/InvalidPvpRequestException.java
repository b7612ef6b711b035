/*
 * どこで: PVP API
 * 何を: API 入力の不正 (400) を表す例外を定義する
 * なぜ: Bean Validation で表せない入力チェックを共通コードで返すため
 */
package com.example.pvp.api;

public class InvalidPvpRequestException extends RuntimeException {

  public InvalidPvpRequestException(String message) {
    super(message);
  }
}
