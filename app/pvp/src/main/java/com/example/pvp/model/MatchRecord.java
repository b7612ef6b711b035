/*
 * どこで: PVP ドメインモデル
 * 何を: 試合 1 件の永続状態を表す
 * なぜ: 生成時点のレートとシーズンを保持し、結果確定時の計算根拠にするため
 */
package com.example.pvp.model;

import java.time.Instant;

public record MatchRecord(
    String matchId,
    MatchType matchType,
    String seasonId,
    String playerAId,
    String playerBId,
    int playerARating,
    int playerBRating,
    MatchStatus status,
    int scoreA,
    int scoreB,
    String winnerId,
    int movesA,
    int movesB,
    long durationSeconds,
    int spectatorCount,
    boolean allowSpectate,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt) {

  public static MatchRecord waiting(
      String matchId,
      MatchType matchType,
      String seasonId,
      String playerAId,
      int playerARating,
      String playerBId,
      int playerBRating,
      Instant createdAt) {
    return new MatchRecord(
        matchId,
        matchType,
        seasonId,
        playerAId,
        playerBId,
        playerARating,
        playerBRating,
        MatchStatus.WAITING,
        0,
        0,
        null,
        0,
        0,
        0,
        0,
        true,
        createdAt,
        null,
        null);
  }

  public boolean isParticipant(String playerId) {
    return playerAId.equals(playerId) || playerBId.equals(playerId);
  }

  public MatchRecord started(Instant at) {
    return new MatchRecord(
        matchId, matchType, seasonId, playerAId, playerBId, playerARating, playerBRating,
        MatchStatus.ACTIVE, scoreA, scoreB, winnerId, movesA, movesB, durationSeconds,
        spectatorCount, allowSpectate, createdAt, at, finishedAt);
  }

  public MatchRecord finished(MatchFinish finish) {
    return new MatchRecord(
        matchId, matchType, seasonId, playerAId, playerBId, playerARating, playerBRating,
        MatchStatus.FINISHED, finish.scoreA(), finish.scoreB(), finish.winnerId(),
        finish.movesA(), finish.movesB(), finish.durationSeconds(), spectatorCount,
        allowSpectate, createdAt, startedAt, finish.finishedAt());
  }

  public MatchRecord withSpectatorCount(int count) {
    return new MatchRecord(
        matchId, matchType, seasonId, playerAId, playerBId, playerARating, playerBRating,
        status, scoreA, scoreB, winnerId, movesA, movesB, durationSeconds, Math.max(0, count),
        allowSpectate, createdAt, startedAt, finishedAt);
  }

  public MatchRecord withAllowSpectate(boolean allow) {
    return new MatchRecord(
        matchId, matchType, seasonId, playerAId, playerBId, playerARating, playerBRating,
        status, scoreA, scoreB, winnerId, movesA, movesB, durationSeconds, spectatorCount,
        allow, createdAt, startedAt, finishedAt);
  }
}
