/*
 * どこで: PVP API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.pvp.api;

public enum ApiErrorCode {
  PVP_BAD_REQUEST,
  PVP_NO_ACTIVE_SEASON,
  PVP_MATCH_NOT_FOUND,
  PVP_INVALID_STATUS,
  PVP_INVALID_WINNER,
  PVP_SPECTATE_NOT_ALLOWED,
  PVP_RANKING_NOT_FOUND,
  PVP_INTERNAL_ERROR
}
