/*
 * どこで: PVP サービス層
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカル実行とテストで NATS なしでもサービスを起動可能にするため
 */
package com.example.pvp.service;

import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopPvpEventPublisher implements PvpEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopPvpEventPublisher.class);

  @Override
  public void publishMatchCreated(MatchRecord match) {
    logger.debug("nats disabled, skip match created event match_id={}", match.matchId());
  }

  @Override
  public void publishMatchFinished(MatchResult result) {
    logger.debug(
        "nats disabled, skip match finished event match_id={}", result.match().matchId());
  }
}
