package com.auditledger.ledger.repository;

import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.AuditEventFilter;
import com.auditledger.ledger.model.ChainError;
import com.auditledger.ledger.model.IntegrityReport;
import com.auditledger.ledger.model.TamperingType;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface AuditStorage {

  int INTEGRITY_PAGE_SIZE = 1000;

  /**
   * Writes the event once. Returns {@code false} when its id is already stored or the write fails.
   */
  boolean writeEvent(AuditEvent event);

  /** Best-effort batch write; returns how many events were actually stored. */
  int writeBatch(List<AuditEvent> events);

  Optional<AuditEvent> readEvent(String eventId);

  /** Matching events, newest first, paged by the filter's offset and limit. */
  List<AuditEvent> query(AuditEventFilter filter);

  /**
   * Every event of the tenant in {@code [start, end)}, oldest first.
   *
   * <p>Pages by moving the exclusive upper bound down to the oldest timestamp seen, so events
   * written during the scan cannot shift later pages. Events sharing that boundary timestamp are
   * read in a separate pass and merged by id.
   */
  default List<AuditEvent> findAll(String tenantId, Instant start, Instant end) {
    final Map<String, AuditEvent> byId = new LinkedHashMap<>();
    Instant upper = end;
    while (true) {
      final List<AuditEvent> page =
          query(AuditEventFilter.forTenant(tenantId, start, upper, INTEGRITY_PAGE_SIZE));
      page.forEach(event -> byId.putIfAbsent(event.id(), event));
      if (page.size() < INTEGRITY_PAGE_SIZE) {
        break;
      }
      final Instant boundary = page.get(page.size() - 1).timestamp();
      final AuditEventFilter tied =
          AuditEventFilter.forTenant(
              tenantId, boundary, boundary.plus(1, ChronoUnit.MICROS), INTEGRITY_PAGE_SIZE);
      int offset = 0;
      while (true) {
        final List<AuditEvent> ties = query(tied.page(offset, INTEGRITY_PAGE_SIZE));
        ties.forEach(event -> byId.putIfAbsent(event.id(), event));
        if (ties.size() < INTEGRITY_PAGE_SIZE) {
          break;
        }
        offset += ties.size();
      }
      upper = boundary;
    }
    final List<AuditEvent> events = new ArrayList<>(byId.values());
    events.sort(Comparator.comparing(AuditEvent::timestamp).thenComparing(AuditEvent::id));
    return events;
  }

  /**
   * Recomputes hashes and links over the tenant's window. The first event of the window is not
   * link-checked because its predecessor lies outside the window.
   */
  default IntegrityReport verifyIntegrity(String tenantId, Instant start, Instant end) {
    final List<AuditEvent> events = findAll(tenantId, start, end);
    final List<ChainError> errors = new ArrayList<>();
    int verified = 0;
    for (int i = 0; i < events.size(); i++) {
      final AuditEvent event = events.get(i);
      boolean ok = true;
      if (!event.verifyHash()) {
        errors.add(
            new ChainError(
                event.id(), TamperingType.HASH_MISMATCH, event.computeHash(), event.hash()));
        ok = false;
      }
      if (i > 0 && !event.verifyChain(events.get(i - 1))) {
        errors.add(
            new ChainError(
                event.id(),
                TamperingType.CHAIN_BREAK,
                events.get(i - 1).hash(),
                event.previousHash()));
        ok = false;
      }
      if (ok) {
        verified++;
      }
    }
    return new IntegrityReport(errors.isEmpty(), events.size(), verified, errors);
  }
}
