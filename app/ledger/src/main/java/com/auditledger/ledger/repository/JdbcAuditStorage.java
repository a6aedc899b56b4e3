package com.auditledger.ledger.repository;

import static com.auditledger.common.JdbcTimestampUtils.toInstant;
import static com.auditledger.common.JdbcTimestampUtils.toTimestamp;

import com.auditledger.ledger.model.Action;
import com.auditledger.ledger.model.ActorType;
import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.AuditEventFilter;
import com.auditledger.ledger.model.EventCategory;
import com.auditledger.ledger.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@RequiredArgsConstructor
public class JdbcAuditStorage implements AuditStorage {

  private static final Logger logger = LoggerFactory.getLogger(JdbcAuditStorage.class);
  private static final TypeReference<Map<String, Object>> STATE_TYPE = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT id, occurred_at, tenant_id, project_id, actor_type, actor_id, actor_email, actor_ip,
             actor_user_agent, category, event_type, severity, resource_type, resource_id,
             resource_name, action, previous_state, new_state, request_id, session_id,
             hash, previous_hash
      FROM audit_events
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @Override
  public boolean writeEvent(AuditEvent event) {
    final String sql =
        """
        INSERT INTO audit_events (
          id, occurred_at, tenant_id, project_id, actor_type, actor_id, actor_email, actor_ip,
          actor_user_agent, category, event_type, severity, resource_type, resource_id,
          resource_name, action, previous_state, new_state, request_id, session_id,
          hash, previous_hash
        ) VALUES (
          :id, :occurredAt, :tenantId, :projectId, :actorType, :actorId, :actorEmail, :actorIp,
          :actorUserAgent, :category, :eventType, :severity, :resourceType, :resourceId,
          :resourceName, :action, :previousState, :newState, :requestId, :sessionId,
          :hash, :previousHash
        )
        ON CONFLICT (id) DO NOTHING
        """;
    try {
      return jdbcTemplate.update(sql, toParams(event)) > 0;
    } catch (DataAccessException | IllegalArgumentException ex) {
      logger.error("audit event insert failed id={} tenantId={}", event.id(), event.tenantId(), ex);
      return false;
    }
  }

  @Override
  public int writeBatch(List<AuditEvent> events) {
    int written = 0;
    for (AuditEvent event : events) {
      if (writeEvent(event)) {
        written++;
      }
    }
    return written;
  }

  @Override
  public Optional<AuditEvent> readEvent(String eventId) {
    final String sql = SELECT_COLUMNS + "WHERE id = :id";
    try {
      return jdbcTemplate
          .query(sql, new MapSqlParameterSource().addValue("id", eventId), this::mapRow)
          .stream()
          .findFirst();
    } catch (DataAccessException ex) {
      throw new AuditStorageException("audit event read failed id=" + eventId, ex);
    }
  }

  @Override
  public List<AuditEvent> query(AuditEventFilter filter) {
    final StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE 1 = 1\n");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    appendEquals(sql, params, "tenant_id", "tenantId", filter.tenantId());
    appendEquals(sql, params, "project_id", "projectId", filter.projectId());
    if (filter.actorType() != null) {
      appendEquals(sql, params, "actor_type", "actorType", filter.actorType().tag());
    }
    appendEquals(sql, params, "actor_id", "actorId", filter.actorId());
    appendEquals(sql, params, "actor_email", "actorEmail", filter.actorEmail());
    if (filter.category() != null) {
      appendEquals(sql, params, "category", "category", filter.category().tag());
    }
    appendEquals(sql, params, "event_type", "eventType", filter.eventType());
    if (filter.severity() != null) {
      appendEquals(sql, params, "severity", "severity", filter.severity().tag());
    }
    appendEquals(sql, params, "resource_type", "resourceType", filter.resourceType());
    appendEquals(sql, params, "resource_id", "resourceId", filter.resourceId());
    if (filter.action() != null) {
      appendEquals(sql, params, "action", "action", filter.action().tag());
    }
    if (filter.start() != null) {
      sql.append("AND occurred_at >= :start\n");
      params.addValue("start", toTimestamp(filter.start()));
    }
    if (filter.end() != null) {
      sql.append("AND occurred_at < :end\n");
      params.addValue("end", toTimestamp(filter.end()));
    }
    sql.append("ORDER BY occurred_at DESC, id DESC\nLIMIT :limit OFFSET :offset");
    params.addValue("limit", filter.limit()).addValue("offset", filter.offset());
    try {
      return jdbcTemplate.query(sql.toString(), params, this::mapRow);
    } catch (DataAccessException ex) {
      throw new AuditStorageException("audit event query failed tenantId=" + filter.tenantId(), ex);
    }
  }

  private static void appendEquals(
      StringBuilder sql, MapSqlParameterSource params, String column, String name, Object value) {
    if (value != null) {
      sql.append("AND ").append(column).append(" = :").append(name).append('\n');
      params.addValue(name, value);
    }
  }

  private MapSqlParameterSource toParams(AuditEvent event) {
    return new MapSqlParameterSource()
        .addValue("id", event.id())
        .addValue("occurredAt", toTimestamp(event.timestamp()))
        .addValue("tenantId", event.tenantId())
        .addValue("projectId", event.projectId())
        .addValue("actorType", event.actorType().tag())
        .addValue("actorId", event.actorId())
        .addValue("actorEmail", event.actorEmail())
        .addValue("actorIp", event.actorIp())
        .addValue("actorUserAgent", event.actorUserAgent())
        .addValue("category", event.category().tag())
        .addValue("eventType", event.eventType())
        .addValue("severity", event.severity().tag())
        .addValue("resourceType", event.resourceType())
        .addValue("resourceId", event.resourceId())
        .addValue("resourceName", event.resourceName())
        .addValue("action", event.action().tag())
        .addValue("previousState", writeState(event.previousState()))
        .addValue("newState", writeState(event.newState()))
        .addValue("requestId", event.requestId())
        .addValue("sessionId", event.sessionId())
        .addValue("hash", event.hash())
        .addValue("previousHash", event.previousHash());
  }

  private String writeState(Map<String, Object> state) {
    if (state == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(state);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("state payload is not JSON-compatible", ex);
    }
  }

  private Map<String, Object> readState(String json, String eventId) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readValue(json, STATE_TYPE);
    } catch (JsonProcessingException ex) {
      throw new AuditStorageException("stored state is not valid JSON id=" + eventId, ex);
    }
  }

  private AuditEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String id = rs.getString("id");
    return AuditEvent.builder()
        .id(id)
        .timestamp(toInstant(rs.getTimestamp("occurred_at")))
        .tenantId(rs.getString("tenant_id"))
        .projectId(rs.getString("project_id"))
        .actorType(ActorType.fromTag(rs.getString("actor_type")))
        .actorId(rs.getString("actor_id"))
        .actorEmail(rs.getString("actor_email"))
        .actorIp(rs.getString("actor_ip"))
        .actorUserAgent(rs.getString("actor_user_agent"))
        .category(EventCategory.fromTag(rs.getString("category")))
        .eventType(rs.getString("event_type"))
        .severity(Severity.fromTag(rs.getString("severity")))
        .resourceType(rs.getString("resource_type"))
        .resourceId(rs.getString("resource_id"))
        .resourceName(rs.getString("resource_name"))
        .action(Action.fromTag(rs.getString("action")))
        .previousState(readState(rs.getString("previous_state"), id))
        .newState(readState(rs.getString("new_state"), id))
        .requestId(rs.getString("request_id"))
        .sessionId(rs.getString("session_id"))
        .hash(rs.getString("hash"))
        .previousHash(rs.getString("previous_hash"))
        .build();
  }
}
