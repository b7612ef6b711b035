package com.example.pvp.api.response;

import com.example.pvp.model.SpectatorRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SpectatorResponse(String spectatorId, String playerId, String joinedAt) {

  public static SpectatorResponse from(SpectatorRecord spectator) {
    return new SpectatorResponse(
        spectator.spectatorId(), spectator.playerId(), spectator.joinedAt().toString());
  }
}
