/*
 * どこで: PVP API リクエスト DTO
 * 何を: マッチメイク参加 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.pvp.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.PositiveOrZero;

/** 両方とも省略可。省略時は arena / 設定の既定幅。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JoinQueueRequest(
    String matchType,
    @PositiveOrZero(message = "rating_range must not be negative") Integer ratingRange) {}
