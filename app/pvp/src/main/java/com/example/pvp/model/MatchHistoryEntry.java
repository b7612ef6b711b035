package com.example.pvp.model;

import java.time.Instant;

/** 特定プレイヤー視点に並べ替えた終了済み試合。 */
public record MatchHistoryEntry(
    String matchId,
    MatchType matchType,
    String opponentId,
    int playerScore,
    int opponentScore,
    boolean winner,
    boolean draw,
    long durationSeconds,
    Instant finishedAt) {

  public static MatchHistoryEntry of(MatchRecord match, String playerId) {
    final boolean isPlayerA = match.playerAId().equals(playerId);
    return new MatchHistoryEntry(
        match.matchId(),
        match.matchType(),
        isPlayerA ? match.playerBId() : match.playerAId(),
        isPlayerA ? match.scoreA() : match.scoreB(),
        isPlayerA ? match.scoreB() : match.scoreA(),
        playerId.equals(match.winnerId()),
        match.winnerId() == null,
        match.durationSeconds(),
        match.finishedAt());
  }
}
