package com.auditledger.ledger.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record CheckpointVerificationResult(
    VerificationStatus status,
    LocalDate checkpointDate,
    boolean checkpointHashValid,
    boolean merkleRootValid,
    boolean timestampValid,
    boolean chainValid,
    List<String> errors,
    Instant verifiedAt) {

  public CheckpointVerificationResult {
    errors = List.copyOf(errors);
  }
}
