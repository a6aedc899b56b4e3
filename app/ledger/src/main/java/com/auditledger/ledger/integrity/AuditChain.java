package com.auditledger.ledger.integrity;

import com.auditledger.ledger.config.LedgerIntegrityProperties;
import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.ChainError;
import com.auditledger.ledger.model.ChainVerificationResult;
import com.auditledger.ledger.model.TamperingIndicator;
import com.auditledger.ledger.model.TamperingType;
import com.auditledger.ledger.model.VerificationStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Chain verification over a tenant's events.
 *
 * <p>Events are verified in timestamp order. The first event of the input is the anchor: its
 * link is only checked when the caller passes the hash that must precede it, since a window
 * query cannot see the event before its start.
 */
@Component
public class AuditChain {

  private static final int SEVERITY_HASH_MISMATCH = 10;
  private static final int SEVERITY_CHAIN_BREAK = 10;
  private static final int SEVERITY_DUPLICATE = 9;
  private static final int SEVERITY_ORDER_ANOMALY = 8;
  private static final int SEVERITY_FUTURE_TIMESTAMP = 7;

  private static final Comparator<AuditEvent> BY_TIMESTAMP =
      Comparator.comparing(AuditEvent::timestamp);

  private final Clock clock;
  private final Duration clockSkewTolerance;

  public AuditChain(Clock clock, LedgerIntegrityProperties properties) {
    this.clock = clock;
    this.clockSkewTolerance = properties.clockSkewTolerance();
  }

  public ChainVerificationResult verifyChain(List<AuditEvent> events) {
    return verify(events, null);
  }

  /**
   * Verifies a chain whose first event must link to {@code anchorHash}. Pass {@code ""} when the
   * input starts at the tenant's genesis event.
   */
  public ChainVerificationResult verifyChain(List<AuditEvent> events, String anchorHash) {
    return verify(events, anchorHash);
  }

  private ChainVerificationResult verify(List<AuditEvent> events, String anchorHash) {
    final Instant now = Instant.now(clock);
    if (events.isEmpty()) {
      return ChainVerificationResult.empty(now);
    }
    final List<AuditEvent> sorted = sortedByTimestamp(events);
    final List<String> brokenLinks = new ArrayList<>();
    final List<String> hashMismatches = new ArrayList<>();
    final List<ChainError> errors = new ArrayList<>();
    int invalid = 0;
    for (int i = 0; i < sorted.size(); i++) {
      final AuditEvent event = sorted.get(i);
      boolean valid = true;
      if (!event.verifyHash()) {
        hashMismatches.add(event.id());
        errors.add(
            new ChainError(
                event.id(), TamperingType.HASH_MISMATCH, event.computeHash(), event.hash()));
        valid = false;
      }
      final String expectedPrevious = expectedPreviousHash(sorted, i, anchorHash);
      if (expectedPrevious != null && !expectedPrevious.equals(event.previousHash())) {
        brokenLinks.add(event.id());
        errors.add(
            new ChainError(
                event.id(), TamperingType.CHAIN_BREAK, expectedPrevious, event.previousHash()));
        valid = false;
      }
      if (!valid) {
        invalid++;
      }
    }
    return new ChainVerificationResult(
        classify(sorted.size(), invalid),
        sorted.size(),
        sorted.size() - invalid,
        invalid,
        sorted.get(0).id(),
        sorted.get(sorted.size() - 1).id(),
        brokenLinks,
        hashMismatches,
        errors,
        now);
  }

  /**
   * Runs every tampering check over the events. One event may yield several indicators of
   * different kinds.
   */
  public List<TamperingIndicator> findTampering(List<AuditEvent> events) {
    final Instant now = Instant.now(clock);
    final List<TamperingIndicator> indicators = new ArrayList<>();
    final List<AuditEvent> sorted = sortedByTimestamp(events);

    for (int i = 0; i < sorted.size(); i++) {
      final AuditEvent event = sorted.get(i);
      if (!event.verifyHash()) {
        indicators.add(
            new TamperingIndicator(
                event.id(),
                TamperingType.HASH_MISMATCH,
                SEVERITY_HASH_MISMATCH,
                "stored hash does not match event content",
                Map.of("expected", event.computeHash(), "actual", event.hash()),
                now));
      }
      if (i > 0) {
        final AuditEvent predecessor = sorted.get(i - 1);
        if (!event.verifyChain(predecessor)) {
          indicators.add(
              new TamperingIndicator(
                  event.id(),
                  TamperingType.CHAIN_BREAK,
                  SEVERITY_CHAIN_BREAK,
                  "previous_hash does not match the preceding event",
                  Map.of(
                      "predecessor_id", String.valueOf(predecessor.id()),
                      "expected", predecessor.hash(),
                      "actual", event.previousHash()),
                  now));
        }
      }
    }

    indicators.addAll(orderAnomalies(events, now));
    for (AuditEvent event : events) {
      if (event.timestamp().isAfter(now.plus(clockSkewTolerance))) {
        indicators.add(
            new TamperingIndicator(
                event.id(),
                TamperingType.TIMESTAMP_ANOMALY,
                SEVERITY_FUTURE_TIMESTAMP,
                "timestamp is in the future beyond clock skew tolerance",
                Map.of("timestamp", event.timestamp().toString(), "now", now.toString()),
                now));
      }
    }
    indicators.addAll(duplicateIds(events, now));
    return indicators;
  }

  // Checks both the claimed predecessor and the previous event in supplied order.
  private List<TamperingIndicator> orderAnomalies(List<AuditEvent> events, Instant now) {
    final Map<String, AuditEvent> byHash = new HashMap<>();
    for (AuditEvent event : events) {
      byHash.putIfAbsent(event.hash(), event);
    }
    final List<TamperingIndicator> indicators = new ArrayList<>();
    for (int i = 0; i < events.size(); i++) {
      final AuditEvent event = events.get(i);
      final Set<AuditEvent> predecessors = new HashSet<>();
      if (!event.previousHash().isEmpty() && byHash.containsKey(event.previousHash())) {
        predecessors.add(byHash.get(event.previousHash()));
      }
      if (i > 0) {
        predecessors.add(events.get(i - 1));
      }
      for (AuditEvent predecessor : predecessors) {
        if (predecessor != event && event.timestamp().isBefore(predecessor.timestamp())) {
          indicators.add(
              new TamperingIndicator(
                  event.id(),
                  TamperingType.TIMESTAMP_ANOMALY,
                  SEVERITY_ORDER_ANOMALY,
                  "timestamp precedes its predecessor",
                  Map.of(
                      "timestamp", event.timestamp().toString(),
                      "predecessor_id", String.valueOf(predecessor.id()),
                      "predecessor_timestamp", predecessor.timestamp().toString()),
                  now));
        }
      }
    }
    return indicators;
  }

  private static List<TamperingIndicator> duplicateIds(List<AuditEvent> events, Instant now) {
    final Map<String, Integer> seen = new HashMap<>();
    final List<TamperingIndicator> indicators = new ArrayList<>();
    for (AuditEvent event : events) {
      final int count = seen.merge(event.id(), 1, Integer::sum);
      if (count == 2) {
        indicators.add(
            new TamperingIndicator(
                event.id(),
                TamperingType.DUPLICATE_EVENT,
                SEVERITY_DUPLICATE,
                "event id appears more than once",
                Map.of("event_id", String.valueOf(event.id())),
                now));
      }
    }
    return indicators;
  }

  private static String expectedPreviousHash(List<AuditEvent> sorted, int index, String anchor) {
    if (index == 0) {
      return anchor;
    }
    return sorted.get(index - 1).hash();
  }

  private static List<AuditEvent> sortedByTimestamp(List<AuditEvent> events) {
    final List<AuditEvent> sorted = new ArrayList<>(events);
    sorted.sort(BY_TIMESTAMP);
    return sorted;
  }

  private static VerificationStatus classify(int total, int invalid) {
    if (invalid == 0) {
      return VerificationStatus.VALID;
    }
    return invalid == total ? VerificationStatus.INVALID : VerificationStatus.INCOMPLETE;
  }
}
