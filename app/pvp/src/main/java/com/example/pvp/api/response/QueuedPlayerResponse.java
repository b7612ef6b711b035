package com.example.pvp.api.response;

import com.example.pvp.model.QueuedPlayer;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueuedPlayerResponse(
    String playerId,
    int rating,
    String matchType,
    int ratingRange,
    String queuedAt,
    long waitSeconds) {

  public static QueuedPlayerResponse from(QueuedPlayer player) {
    return new QueuedPlayerResponse(
        player.entry().playerId(),
        player.entry().rating(),
        player.entry().matchType().value(),
        player.entry().ratingRange(),
        player.entry().queuedAt().toString(),
        player.waitSeconds());
  }
}
