package com.example.pvp.model;

import java.time.Instant;

/** 観戦セッション。leftAt が null の間だけ有効。 */
public record SpectatorRecord(
    String spectatorId, String matchId, String playerId, Instant joinedAt, Instant leftAt) {

  public boolean isActive() {
    return leftAt == null;
  }

  public SpectatorRecord leave(Instant at) {
    return new SpectatorRecord(spectatorId, matchId, playerId, joinedAt, at);
  }
}
