package com.example.pvp.model;

public sealed interface SpectateResult
    permits SpectateResult.Joined, SpectateResult.AlreadySpectating {

  String spectatorId();

  String matchId();

  record Joined(String spectatorId, String matchId, int spectatorCount)
      implements SpectateResult {}

  record AlreadySpectating(String spectatorId, String matchId) implements SpectateResult {}
}
