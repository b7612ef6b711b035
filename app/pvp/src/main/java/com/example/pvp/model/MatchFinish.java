package com.example.pvp.model;

import java.time.Instant;

/** ACTIVE -> FINISHED 遷移で書き込む結果一式。winnerId が null なら引き分け。 */
public record MatchFinish(
    String winnerId,
    int scoreA,
    int scoreB,
    int movesA,
    int movesB,
    long durationSeconds,
    Instant finishedAt) {}
