package com.auditledger.ledger.model;

import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record AuditEventFilter(
    String tenantId,
    String projectId,
    ActorType actorType,
    String actorId,
    String actorEmail,
    EventCategory category,
    String eventType,
    Severity severity,
    String resourceType,
    String resourceId,
    Action action,
    Instant start,
    Instant end,
    Integer limit,
    Integer offset) {

  public static final int DEFAULT_LIMIT = 100;

  public AuditEventFilter {
    limit = limit == null ? DEFAULT_LIMIT : limit;
    offset = offset == null ? 0 : offset;
    if (limit < 0 || offset < 0) {
      throw new IllegalArgumentException("limit and offset must not be negative");
    }
  }

  public static AuditEventFilter forTenant(String tenantId, Instant start, Instant end, int limit) {
    return AuditEventFilter.builder().tenantId(tenantId).start(start).end(end).limit(limit).build();
  }

  public AuditEventFilter page(int pageOffset, int pageLimit) {
    return toBuilder().offset(pageOffset).limit(pageLimit).build();
  }

  public boolean matches(AuditEvent event) {
    return equalsIfSet(tenantId, event.tenantId())
        && equalsIfSet(projectId, event.projectId())
        && equalsIfSet(actorType, event.actorType())
        && equalsIfSet(actorId, event.actorId())
        && equalsIfSet(actorEmail, event.actorEmail())
        && equalsIfSet(category, event.category())
        && equalsIfSet(eventType, event.eventType())
        && equalsIfSet(severity, event.severity())
        && equalsIfSet(resourceType, event.resourceType())
        && equalsIfSet(resourceId, event.resourceId())
        && equalsIfSet(action, event.action())
        && (start == null || !event.timestamp().isBefore(start))
        && (end == null || event.timestamp().isBefore(end));
  }

  private static boolean equalsIfSet(Object expected, Object actual) {
    return expected == null || expected.equals(actual);
  }
}
