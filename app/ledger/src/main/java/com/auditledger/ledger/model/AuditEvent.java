package com.auditledger.ledger.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * An audit event as captured and persisted by the ledger.
 *
 * <p>{@code hash} is never part of its own input. Use {@link #seal()} after building or changing
 * an event so the stored hash matches the content; an unsealed or edited copy fails {@link
 * #verifyHash()}.
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEvent(
    String id,
    Instant timestamp,
    String tenantId,
    String projectId,
    ActorType actorType,
    String actorId,
    String actorEmail,
    String actorIp,
    String actorUserAgent,
    EventCategory category,
    String eventType,
    Severity severity,
    String resourceType,
    String resourceId,
    String resourceName,
    Action action,
    Map<String, Object> previousState,
    Map<String, Object> newState,
    String requestId,
    String sessionId,
    String hash,
    String previousHash) {

  public AuditEvent {
    previousState = readOnlyCopy(previousState);
    newState = readOnlyCopy(newState);
    hash = hash == null ? "" : hash;
    previousHash = previousHash == null ? "" : previousHash;
  }

  /** Recomputes the canonical SHA-256 of every field except {@code hash}. */
  public String computeHash() {
    return EventHashing.hash(this);
  }

  /** Returns a copy whose {@code hash} is recomputed from the current content. */
  public AuditEvent seal() {
    return toBuilder().hash(computeHash()).build();
  }

  public boolean verifyHash() {
    return hash.equals(computeHash());
  }

  /**
   * Checks the link to the predecessor. A missing predecessor means this must be the tenant's
   * first event.
   */
  public boolean verifyChain(AuditEvent predecessor) {
    if (predecessor == null) {
      return previousHash.isEmpty();
    }
    return previousHash.equals(predecessor.hash());
  }

  /** Events with the same key inside the dedup window are one logical event. */
  public String deduplicationKey() {
    return tenantId + ":" + eventType + ":" + resourceType + ":" + resourceId + ":" + action.tag();
  }

  private static Map<String, Object> readOnlyCopy(Map<String, Object> source) {
    if (source == null) {
      return null;
    }
    // LinkedHashMap tolerates null values, which JSON payloads may carry.
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
