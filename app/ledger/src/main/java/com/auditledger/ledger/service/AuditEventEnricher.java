package com.auditledger.ledger.service;

import com.auditledger.ledger.model.AuditEvent;

/**
 * Post-capture hook. Return the event unchanged, a modified copy built with {@code toBuilder()},
 * or {@code null} to keep the input. Returned copies are re-sealed by the capture service.
 */
@FunctionalInterface
public interface AuditEventEnricher {

  AuditEvent enrich(AuditEvent event);
}
