package com.example.pvp.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/** winner_id が null なら引き分け。moves は省略時 0。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitResultRequest(
    String winnerId,
    @NotNull(message = "score_a is required")
        @PositiveOrZero(message = "score_a must not be negative")
        Integer scoreA,
    @NotNull(message = "score_b is required")
        @PositiveOrZero(message = "score_b must not be negative")
        Integer scoreB,
    @PositiveOrZero(message = "moves_a must not be negative") Integer movesA,
    @PositiveOrZero(message = "moves_b must not be negative") Integer movesB) {

  public int movesAOrZero() {
    return movesA == null ? 0 : movesA;
  }

  public int movesBOrZero() {
    return movesB == null ? 0 : movesB;
  }
}
