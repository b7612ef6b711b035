package com.example.pvp.model;

/** 1 プレイヤー視点の試合結果。Elo の実スコアを持つ。 */
public enum MatchOutcome {
  WIN(1.0),
  LOSS(0.0),
  DRAW(0.5);

  private final double actualScore;

  MatchOutcome(double actualScore) {
    this.actualScore = actualScore;
  }

  public double actualScore() {
    return actualScore;
  }

  public MatchOutcome opposite() {
    return switch (this) {
      case WIN -> LOSS;
      case LOSS -> WIN;
      case DRAW -> DRAW;
    };
  }

  /** winnerId が null なら引き分け。 */
  public static MatchOutcome forPlayer(String playerId, String winnerId) {
    if (winnerId == null) {
      return DRAW;
    }
    return winnerId.equals(playerId) ? WIN : LOSS;
  }
}
