package com.example.pvp.model;

/** 結果確定後の試合と、両プレイヤーのレート変動。 */
public record MatchResult(MatchRecord match, RatingChange playerA, RatingChange playerB) {}
