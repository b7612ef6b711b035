package com.example.pvp.model;

public record RatingChange(String playerId, int oldRating, int newRating) {

  public int change() {
    return newRating - oldRating;
  }
}
