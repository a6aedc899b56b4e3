package com.auditledger.ledger.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class LedgerMetrics {

  private static final String METRIC_CAPTURE_TOTAL = "ledger.capture.total";
  private static final String METRIC_ENRICHMENT_FAILURE_TOTAL = "ledger.enrichment.failure.total";
  private static final String METRIC_FLUSH_EVENTS_TOTAL = "ledger.flush.events.total";
  private static final String METRIC_FLUSH_FAILURE_TOTAL = "ledger.flush.failure.total";
  private static final String METRIC_QUEUE_PENDING = "ledger.queue.pending";
  private static final String METRIC_FLUSH_DURATION = "ledger.flush.duration";
  private static final String METRIC_CHECKPOINT_TOTAL = "ledger.checkpoint.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger queuePending = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> taggedCounters = new ConcurrentHashMap<>();
  private final Counter enrichmentFailureCounter;
  private final Counter flushFailureCounter;
  private final Timer flushTimer;

  public LedgerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_PENDING, queuePending, AtomicInteger::get)
        .description("Captured events waiting for the next flush")
        .register(meterRegistry);
    this.enrichmentFailureCounter =
        Counter.builder(METRIC_ENRICHMENT_FAILURE_TOTAL)
            .description("Enrichment callbacks that threw")
            .register(meterRegistry);
    this.flushFailureCounter =
        Counter.builder(METRIC_FLUSH_FAILURE_TOTAL)
            .description("Flushes where storage threw or wrote fewer events than submitted")
            .register(meterRegistry);
    this.flushTimer =
        Timer.builder(METRIC_FLUSH_DURATION)
            .description("Time spent writing one batch to storage")
            .register(meterRegistry);
  }

  /** result: accepted or duplicate. */
  public void recordCapture(String result) {
    counter(METRIC_CAPTURE_TOTAL, "Capture outcomes", result).increment();
  }

  public void recordEnrichmentFailure() {
    enrichmentFailureCounter.increment();
  }

  public void recordFlush(int written, int rejected, Duration elapsed) {
    if (written > 0) {
      counter(METRIC_FLUSH_EVENTS_TOTAL, "Events handed to storage by flush", "written")
          .increment(written);
    }
    if (rejected > 0) {
      counter(METRIC_FLUSH_EVENTS_TOTAL, "Events handed to storage by flush", "rejected")
          .increment(rejected);
    }
    flushTimer.record(elapsed);
  }

  public void recordFlushFailure() {
    flushFailureCounter.increment();
  }

  /** result: created, skipped or failed. */
  public void recordCheckpoint(String result) {
    counter(METRIC_CHECKPOINT_TOTAL, "Checkpoint worker outcomes", result).increment();
  }

  public void updateQueuePending(int pending) {
    queuePending.set(Math.max(pending, 0));
  }

  private Counter counter(String name, String description, String result) {
    return taggedCounters.computeIfAbsent(
        name + ":" + result,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of("result", result))
                .register(meterRegistry));
  }
}
