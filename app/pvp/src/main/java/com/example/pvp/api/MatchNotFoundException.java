/*
 * どこで: PVP API
 * 何を: 存在しない試合 ID (404) を表す例外を定義する
 * なぜ: 試合参照系の API で原因を区別できるようにするため
 */
package com.example.pvp.api;

public class MatchNotFoundException extends RuntimeException {

  public MatchNotFoundException(String message) {
    super(message);
  }
}
