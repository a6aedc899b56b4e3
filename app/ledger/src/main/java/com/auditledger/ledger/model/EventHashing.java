package com.auditledger.ledger.model;

import com.auditledger.common.Sha256;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Map;
import java.util.TreeMap;

public final class EventHashing {

  // Own mapper so application-level Jackson settings can never change the hashed form.
  private static final ObjectMapper CANONICAL_MAPPER =
      JsonMapper.builder().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).build();

  private EventHashing() {}

  public static String hash(AuditEvent event) {
    return Sha256.hex(canonicalJson(event));
  }

  /**
   * Serializes every field except {@code hash} as JSON with keys sorted at every nesting level.
   * Timestamps are ISO-8601 UTC and enumerations are their string tags.
   */
  public static String canonicalJson(AuditEvent event) {
    final Map<String, Object> canonical = new TreeMap<>();
    canonical.put("id", event.id());
    canonical.put("timestamp", event.timestamp() == null ? null : event.timestamp().toString());
    canonical.put("tenant_id", event.tenantId());
    canonical.put("project_id", event.projectId());
    canonical.put("actor_type", event.actorType() == null ? null : event.actorType().tag());
    canonical.put("actor_id", event.actorId());
    canonical.put("actor_email", event.actorEmail());
    canonical.put("actor_ip", event.actorIp());
    canonical.put("actor_user_agent", event.actorUserAgent());
    canonical.put("category", event.category() == null ? null : event.category().tag());
    canonical.put("event_type", event.eventType());
    canonical.put("severity", event.severity() == null ? null : event.severity().tag());
    canonical.put("resource_type", event.resourceType());
    canonical.put("resource_id", event.resourceId());
    canonical.put("resource_name", event.resourceName());
    canonical.put("action", event.action() == null ? null : event.action().tag());
    canonical.put("previous_state", event.previousState());
    canonical.put("new_state", event.newState());
    canonical.put("request_id", event.requestId());
    canonical.put("session_id", event.sessionId());
    canonical.put("previous_hash", event.previousHash());
    try {
      return CANONICAL_MAPPER.writeValueAsString(canonical);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException(
          "audit event payload is not JSON-compatible id=" + event.id(), ex);
    }
  }
}
