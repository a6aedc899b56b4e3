package com.auditledger.ledger.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Checkpoint(
    LocalDate checkpointDate,
    String tenantId,
    String merkleRoot,
    int eventCount,
    String firstEventHash,
    String lastEventHash,
    TimestampToken timestampToken,
    String previousCheckpointHash,
    String checkpointHash,
    Instant createdAt) {

  public Checkpoint {
    previousCheckpointHash = previousCheckpointHash == null ? "" : previousCheckpointHash;
    checkpointHash = checkpointHash == null ? "" : checkpointHash;
  }

  public String computeHash() {
    return CheckpointHashing.hash(this);
  }

  public Checkpoint seal() {
    return toBuilder().checkpointHash(computeHash()).build();
  }

  public boolean verifyHash() {
    return checkpointHash.equals(computeHash());
  }
}
