package com.example.pvp.service;

import com.example.pvp.api.NoActiveSeasonException;
import com.example.pvp.model.SeasonRecord;
import com.example.pvp.repository.SeasonRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SeasonContext {

  private final SeasonRepository seasonRepository;

  public SeasonRecord requireActiveSeason() {
    return seasonRepository
        .findActiveSeason()
        .orElseThrow(() -> new NoActiveSeasonException("no active season"));
  }

  public Optional<SeasonRecord> activeSeason() {
    return seasonRepository.findActiveSeason();
  }

  /** 明示指定があればそれを、無ければアクティブシーズンを使う。 */
  public String resolveSeasonId(String requestedSeasonId) {
    if (requestedSeasonId != null && !requestedSeasonId.isBlank()) {
      return requestedSeasonId;
    }
    return requireActiveSeason().seasonId();
  }
}
