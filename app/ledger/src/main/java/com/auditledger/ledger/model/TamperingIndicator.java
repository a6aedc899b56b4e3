package com.auditledger.ledger.model;

import java.time.Instant;
import java.util.Map;

/**
 * A single suspicious finding about one event.
 *
 * @param severity 1 (informational) to 10 (certain tampering)
 */
public record TamperingIndicator(
    String eventId,
    TamperingType kind,
    int severity,
    String description,
    Map<String, String> evidence,
    Instant detectedAt) {

  public TamperingIndicator {
    if (severity < 1 || severity > 10) {
      throw new IllegalArgumentException("severity must be within 1..10: " + severity);
    }
    evidence = Map.copyOf(evidence);
  }
}
