package com.example.pvp.service;

import com.example.pvp.model.MatchStatus;
import com.example.pvp.model.MatchType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class PvpMetrics {

  public static final String RESULT_QUEUED = "queued";
  public static final String RESULT_MATCHED = "matched";
  public static final String RESULT_ALREADY_QUEUED = "already_queued";
  public static final String RESULT_CANCELLED = "cancelled";

  private final MeterRegistry meterRegistry;
  private final Timer timeToMatchTimer;
  private final DistributionSummary ratingDeltaSummary;
  private final ConcurrentMap<MatchType, AtomicLong> queueDepth = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> matchmakingCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<MatchStatus, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rejectedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> publishErrorCounters = new ConcurrentHashMap<>();

  public PvpMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.timeToMatchTimer =
        Timer.builder("pvp.time_to_match")
            .description("Time a paired candidate spent waiting in the queue")
            .register(meterRegistry);
    this.ratingDeltaSummary =
        DistributionSummary.builder("pvp.rating.delta")
            .description("Absolute rating change applied per player per finished match")
            .register(meterRegistry);
  }

  public void updateQueueDepth(MatchType matchType, long depth) {
    final AtomicLong value = queueDepth.computeIfAbsent(matchType, this::registerQueueDepthGauge);
    value.set(Math.max(0, depth));
  }

  public void recordMatchmakingResult(String result) {
    matchmakingCounters.computeIfAbsent(result, this::registerMatchmakingCounter).increment();
  }

  public void recordTransition(MatchStatus status) {
    transitionCounters.computeIfAbsent(status, this::registerTransitionCounter).increment();
  }

  public void recordRejectedTransition(String reason) {
    rejectedCounters.computeIfAbsent(reason, this::registerRejectedCounter).increment();
  }

  public void recordRatingDelta(int delta) {
    ratingDeltaSummary.record(Math.abs(delta));
  }

  public void recordTimeToMatchSeconds(long seconds) {
    if (seconds < 0) {
      return;
    }
    timeToMatchTimer.record(Duration.ofSeconds(seconds));
  }

  public void recordPublishError(String eventType) {
    publishErrorCounters.computeIfAbsent(eventType, this::registerPublishErrorCounter).increment();
  }

  private AtomicLong registerQueueDepthGauge(MatchType matchType) {
    final AtomicLong value = new AtomicLong(0);
    Gauge.builder("pvp.queue.depth", value, AtomicLong::get)
        .tags(Tags.of("match_type", matchType.value()))
        .register(meterRegistry);
    return value;
  }

  private Counter registerMatchmakingCounter(String result) {
    return Counter.builder("pvp.matchmaking.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerTransitionCounter(MatchStatus status) {
    return Counter.builder("pvp.match.transition.total")
        .tags(Tags.of("status", status.value()))
        .register(meterRegistry);
  }

  private Counter registerRejectedCounter(String reason) {
    return Counter.builder("pvp.match.rejected.total")
        .tags(Tags.of("reason", reason))
        .register(meterRegistry);
  }

  private Counter registerPublishErrorCounter(String eventType) {
    return Counter.builder("pvp.event.publish.error.total")
        .tags(Tags.of("type", eventType))
        .register(meterRegistry);
  }
}
