package com.example.pvp.api.response;

import com.example.pvp.model.SpectateResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** status: joined / already_spectating / left。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpectateResponse(
    String status, String matchId, String spectatorId, Integer spectatorCount) {

  public static SpectateResponse from(SpectateResult result) {
    if (result instanceof SpectateResult.Joined joined) {
      return new SpectateResponse(
          "joined", joined.matchId(), joined.spectatorId(), joined.spectatorCount());
    }
    return new SpectateResponse(
        "already_spectating", result.matchId(), result.spectatorId(), null);
  }

  public static SpectateResponse left(String matchId, String spectatorId) {
    return new SpectateResponse("left", matchId, spectatorId, null);
  }
}
