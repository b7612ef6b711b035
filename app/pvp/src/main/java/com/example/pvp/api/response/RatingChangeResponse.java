package com.example.pvp.api.response;

import com.example.pvp.model.RatingChange;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RatingChangeResponse(String playerId, int oldRating, int newRating, int change) {

  public static RatingChangeResponse from(RatingChange change) {
    return new RatingChangeResponse(
        change.playerId(), change.oldRating(), change.newRating(), change.change());
  }
}
