package com.auditledger.ledger.model;

import java.time.Instant;
import java.util.List;

public record VerificationReport(
    String tenantId,
    Instant start,
    Instant end,
    ChainVerificationResult chainResult,
    List<TamperingIndicator> tamperingIndicators,
    List<CheckpointVerificationResult> checkpointsVerified,
    VerificationStatus overallStatus,
    Instant generatedAt) {

  public VerificationReport {
    tamperingIndicators = List.copyOf(tamperingIndicators);
    checkpointsVerified = List.copyOf(checkpointsVerified);
  }
}
