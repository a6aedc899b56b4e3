package com.auditledger.ledger.repository;

import com.auditledger.ledger.model.Checkpoint;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/** Write-once persistence of daily checkpoints, one per tenant and date. */
public interface CheckpointStore {

  /** Returns {@code false} when a checkpoint for the same tenant and date already exists. */
  boolean save(Checkpoint checkpoint);

  Optional<Checkpoint> find(String tenantId, LocalDate date);

  /** Most recent checkpoint dated strictly before {@code date}. */
  Optional<Checkpoint> findLatestBefore(String tenantId, LocalDate date);

  /** Checkpoints in {@code [from, to]}, oldest first. */
  List<Checkpoint> findRange(String tenantId, LocalDate from, LocalDate to);
}
