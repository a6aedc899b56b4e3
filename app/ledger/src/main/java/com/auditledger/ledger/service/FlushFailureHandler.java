package com.auditledger.ledger.service;

import com.auditledger.ledger.model.AuditEvent;
import java.util.List;

/**
 * Called when a flush did not persist its whole batch. Declare a bean of this type to add retry
 * or dead-lettering; the default only logs.
 */
public interface FlushFailureHandler {

  /**
   * @param batch the events handed to storage
   * @param rejected the events storage does not hold afterwards, in batch order
   * @param cause the storage exception, or {@code null} for a count discrepancy
   */
  void onFlushFailure(List<AuditEvent> batch, List<AuditEvent> rejected, Throwable cause);
}
