package com.auditledger.ledger.repository;

import static com.auditledger.common.JdbcTimestampUtils.toInstant;
import static com.auditledger.common.JdbcTimestampUtils.toTimestamp;

import com.auditledger.ledger.model.Checkpoint;
import com.auditledger.ledger.model.TimestampToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@RequiredArgsConstructor
public class JdbcCheckpointStore implements CheckpointStore {

  private static final String SELECT_COLUMNS =
      """
      SELECT tenant_id, checkpoint_date, merkle_root, event_count, first_event_hash,
             last_event_hash, timestamp_token, previous_checkpoint_hash, checkpoint_hash,
             created_at
      FROM ledger_checkpoints
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @Override
  public boolean save(Checkpoint checkpoint) {
    final String sql =
        """
        INSERT INTO ledger_checkpoints (
          tenant_id, checkpoint_date, merkle_root, event_count, first_event_hash,
          last_event_hash, timestamp_token, previous_checkpoint_hash, checkpoint_hash, created_at
        ) VALUES (
          :tenantId, :checkpointDate, :merkleRoot, :eventCount, :firstEventHash,
          :lastEventHash, :timestampToken, :previousCheckpointHash, :checkpointHash, :createdAt
        )
        ON CONFLICT (tenant_id, checkpoint_date) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", checkpoint.tenantId())
            .addValue("checkpointDate", Date.valueOf(checkpoint.checkpointDate()))
            .addValue("merkleRoot", checkpoint.merkleRoot())
            .addValue("eventCount", checkpoint.eventCount())
            .addValue("firstEventHash", checkpoint.firstEventHash())
            .addValue("lastEventHash", checkpoint.lastEventHash())
            .addValue("timestampToken", writeToken(checkpoint.timestampToken()))
            .addValue("previousCheckpointHash", checkpoint.previousCheckpointHash())
            .addValue("checkpointHash", checkpoint.checkpointHash())
            .addValue("createdAt", toTimestamp(checkpoint.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  @Override
  public Optional<Checkpoint> find(String tenantId, LocalDate date) {
    final String sql =
        SELECT_COLUMNS + "WHERE tenant_id = :tenantId AND checkpoint_date = :checkpointDate";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("checkpointDate", Date.valueOf(date));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<Checkpoint> findLatestBefore(String tenantId, LocalDate date) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE tenant_id = :tenantId AND checkpoint_date < :checkpointDate
            ORDER BY checkpoint_date DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("checkpointDate", Date.valueOf(date));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<Checkpoint> findRange(String tenantId, LocalDate from, LocalDate to) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE tenant_id = :tenantId AND checkpoint_date BETWEEN :from AND :to
            ORDER BY checkpoint_date
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("from", Date.valueOf(from))
            .addValue("to", Date.valueOf(to));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private String writeToken(TimestampToken token) {
    if (token == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(token);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("timestamp token is not serializable", ex);
    }
  }

  private TimestampToken readToken(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readValue(json, TimestampToken.class);
    } catch (JsonProcessingException ex) {
      throw new AuditStorageException("stored timestamp token is not valid JSON", ex);
    }
  }

  private Checkpoint mapRow(ResultSet rs, int rowNum) throws SQLException {
    return Checkpoint.builder()
        .tenantId(rs.getString("tenant_id"))
        .checkpointDate(rs.getDate("checkpoint_date").toLocalDate())
        .merkleRoot(rs.getString("merkle_root"))
        .eventCount(rs.getInt("event_count"))
        .firstEventHash(rs.getString("first_event_hash"))
        .lastEventHash(rs.getString("last_event_hash"))
        .timestampToken(readToken(rs.getString("timestamp_token")))
        .previousCheckpointHash(rs.getString("previous_checkpoint_hash"))
        .checkpointHash(rs.getString("checkpoint_hash"))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .build();
  }
}
