package com.auditledger.ledger.model;

import java.util.List;

/** Storage-level integrity summary over one tenant's time window. */
public record IntegrityReport(
    boolean valid, int totalEvents, int verifiedEvents, List<ChainError> errors) {

  public IntegrityReport {
    errors = List.copyOf(errors);
  }
}
