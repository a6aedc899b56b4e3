package com.auditledger.ledger.model;

import java.time.Instant;
import java.util.List;

public record ChainVerificationResult(
    VerificationStatus status,
    int totalEvents,
    int validEvents,
    int invalidEvents,
    String firstEventId,
    String lastEventId,
    List<String> brokenLinks,
    List<String> hashMismatches,
    List<ChainError> errors,
    Instant verifiedAt) {

  public ChainVerificationResult {
    brokenLinks = List.copyOf(brokenLinks);
    hashMismatches = List.copyOf(hashMismatches);
    errors = List.copyOf(errors);
  }

  public static ChainVerificationResult empty(Instant verifiedAt) {
    return new ChainVerificationResult(
        VerificationStatus.VALID, 0, 0, 0, null, null, List.of(), List.of(), List.of(), verifiedAt);
  }

  public boolean isValid() {
    return status == VerificationStatus.VALID;
  }
}
