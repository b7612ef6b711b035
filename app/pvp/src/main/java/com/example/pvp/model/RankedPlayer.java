package com.example.pvp.model;

/** 順位付きのランキング行。rank は 1 始まり。 */
public record RankedPlayer(PlayerRankingRecord ranking, int rank) {}
