package com.example.pvp.model;

import java.util.List;

public record RankingPage(String seasonId, List<RankedPlayer> rankings) {

  public static RankingPage empty() {
    return new RankingPage(null, List.of());
  }
}
