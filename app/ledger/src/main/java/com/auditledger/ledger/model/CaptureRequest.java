package com.auditledger.ledger.model;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;

@Builder(toBuilder = true)
public record CaptureRequest(
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
    boolean customEventType,
    Severity severity,
    String resourceType,
    String resourceId,
    String resourceName,
    Action action,
    Map<String, Object> previousState,
    Map<String, Object> newState,
    String requestId,
    String sessionId) {

  public CaptureRequest {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId is required");
    }
    if (category == null) {
      throw new IllegalArgumentException("category is required");
    }
    category.requireRegistered(eventType, customEventType);
    if (resourceType == null || resourceType.isBlank()) {
      throw new IllegalArgumentException("resourceType is required");
    }
    if (resourceId == null) {
      throw new IllegalArgumentException("resourceId is required");
    }
    if (action == null) {
      throw new IllegalArgumentException("action is required");
    }
    actorType = actorType == null ? ActorType.SYSTEM : actorType;
    actorId = actorId == null || actorId.isBlank() ? "system" : actorId;
    severity = severity == null ? Severity.INFO : severity;
  }

  /** Copies actor, tenant and correlation fields from the caller's context onto a builder. */
  public static CaptureRequestBuilder from(RequestContext context) {
    return CaptureRequest.builder()
        .tenantId(context.tenantId())
        .actorType(context.actorType())
        .actorId(context.actorId())
        .actorEmail(context.actorEmail())
        .actorIp(context.actorIp())
        .actorUserAgent(context.actorUserAgent())
        .requestId(context.requestId())
        .sessionId(context.sessionId());
  }
}
