package com.example.pvp.service;

import com.example.common.TraceIds;
import com.example.common.event.PvpMatchEventPayload;
import com.example.pvp.config.PvpNatsProperties;
import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.MatchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsPvpEventPublisher implements PvpEventPublisher {

  static final String HEADER_MSG_ID = "Nats-Msg-Id";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream は NATS 接続に紐づく共有コンポーネントで防御的コピーが不可能なため")
  private final JetStream jetStream;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final PvpNatsProperties properties;
  private final Clock clock;

  public NatsPvpEventPublisher(
      JetStream jetStream, ObjectMapper objectMapper, PvpNatsProperties properties, Clock clock) {
    this.jetStream = jetStream;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public void publishMatchCreated(MatchRecord match) {
    publish(payload(PvpMatchEventPayload.MATCH_CREATED, match, null, null));
  }

  @Override
  public void publishMatchFinished(MatchResult result) {
    publish(
        payload(
            PvpMatchEventPayload.MATCH_FINISHED,
            result.match(),
            result.playerA().change(),
            result.playerB().change()));
  }

  private PvpMatchEventPayload payload(
      String eventType, MatchRecord match, Integer deltaA, Integer deltaB) {
    return new PvpMatchEventPayload(
        UUID.randomUUID().toString(),
        eventType,
        Instant.now(clock).toString(),
        match.matchId(),
        match.matchType().value(),
        match.seasonId(),
        match.playerAId(),
        match.playerBId(),
        match.status().value(),
        match.winnerId(),
        deltaA,
        deltaB,
        TraceIds.currentOrNew());
  }

  private void publish(PvpMatchEventPayload payload) {
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize pvp event", ex);
    }
    // JetStream の重複排除キーとして event_id を使う
    final Headers headers = new Headers();
    headers.add(HEADER_MSG_ID, payload.eventId());
    try {
      jetStream.publish(properties.subject(), headers, body);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish pvp event", ex);
    }
  }
}
