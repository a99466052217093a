package com.fivestack.matchmaking.service;

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
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

@Component
public class MatchmakingMetrics {

  private final MeterRegistry meterRegistry;
  private final AtomicLong queueDepth = new AtomicLong(0);
  private final AtomicReference<Double> oldestAge = new AtomicReference<>(0.0);
  private final Timer timeToMatchTimer;
  private final DistributionSummary ratingSpanSummary;
  private final DistributionSummary balanceScoreSummary;
  private final ConcurrentMap<String, Counter> matchResultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> internalErrorCounters = new ConcurrentHashMap<>();

  public MatchmakingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder("mm.queue.depth", queueDepth, AtomicLong::get)
        .description("Players waiting in the queue")
        .register(meterRegistry);
    Gauge.builder("mm.queue.oldest_age", oldestAge, AtomicReference::get)
        .description("Wait so far of the longest waiting player")
        .register(meterRegistry);
    this.timeToMatchTimer =
        Timer.builder("mm.time_to_match")
            .description("Time from queue entry to match formation")
            .register(meterRegistry);
    this.ratingSpanSummary =
        DistributionSummary.builder("mm.match.rating_span")
            .description("Rating span of formed matches")
            .register(meterRegistry);
    this.balanceScoreSummary =
        DistributionSummary.builder("mm.match.balance_score")
            .description("Average form difference between the two teams")
            .register(meterRegistry);
  }

  public void updateQueueDepth(long depth) {
    queueDepth.set(Math.max(0, depth));
  }

  public void updateOldestQueueAge(double ageSeconds) {
    oldestAge.set(Double.isNaN(ageSeconds) ? 0.0 : Math.max(0.0, ageSeconds));
  }

  public void recordMatchResult(String result) {
    matchResultCounters.computeIfAbsent(result, this::registerMatchResultCounter).increment();
  }

  public void recordMatchQuality(int ratingSpan, double balanceScore) {
    ratingSpanSummary.record(ratingSpan);
    balanceScoreSummary.record(balanceScore);
  }

  public void recordTimeToMatchSeconds(double seconds) {
    if (seconds < 0 || Double.isNaN(seconds)) {
      return;
    }
    timeToMatchTimer.record(Duration.ofNanos(Math.round(seconds * 1_000_000_000d)));
  }

  public void recordInternalError(String errorType) {
    internalErrorCounters
        .computeIfAbsent(errorType, this::registerInternalErrorCounter)
        .increment();
  }

  private Counter registerMatchResultCounter(String result) {
    return Counter.builder("mm.match.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerInternalErrorCounter(String errorType) {
    return Counter.builder("mm.internal.error.total")
        .tags(Tags.of("type", errorType))
        .register(meterRegistry);
  }
}
