/*
 * Where: ledger integrity layer
 * What: creates, verifies and exports daily per-tenant checkpoints
 * Why: each checkpoint anchors one day of events and links to the previous stored checkpoint
 */
package com.auditledger.ledger.integrity;

import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.Checkpoint;
import com.auditledger.ledger.model.CheckpointVerificationResult;
import com.auditledger.ledger.model.MerkleRoot;
import com.auditledger.ledger.model.VerificationStatus;
import com.auditledger.ledger.repository.AuditStorage;
import com.auditledger.ledger.repository.CheckpointStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CheckpointService {

  private static final Logger logger = LoggerFactory.getLogger(CheckpointService.class);
  static final String EXPORT_VERSION = "1.0";

  private final AuditStorage storage;
  private final CheckpointStore checkpointStore;
  private final MerkleTreeBuilder merkleTreeBuilder;
  private final TimestampAuthority timestampAuthority;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Creates the checkpoint for one UTC day. Returns the stored checkpoint if the day already has
   * one and empty if the tenant has no events that day.
   */
  public Optional<Checkpoint> createCheckpoint(String tenantId, LocalDate date) {
    final Optional<Checkpoint> existing = checkpointStore.find(tenantId, date);
    if (existing.isPresent()) {
      logger.debug("checkpoint already stored tenantId={} date={}", tenantId, date);
      return existing;
    }
    final List<AuditEvent> events = eventsOf(tenantId, date);
    if (events.isEmpty()) {
      logger.info("no events for checkpoint tenantId={} date={}", tenantId, date);
      return Optional.empty();
    }
    final MerkleRoot root = merkleTreeBuilder.buildTree(events);
    final String previousHash =
        checkpointStore
            .findLatestBefore(tenantId, date)
            .map(Checkpoint::checkpointHash)
            .orElse("");
    final Checkpoint checkpoint =
        Checkpoint.builder()
            .checkpointDate(date)
            .tenantId(tenantId)
            .merkleRoot(root.hash())
            .eventCount(events.size())
            .firstEventHash(events.get(0).hash())
            .lastEventHash(events.get(events.size() - 1).hash())
            .timestampToken(timestampAuthority.getToken(root.hash()))
            .previousCheckpointHash(previousHash)
            .createdAt(Instant.now(clock))
            .build()
            .seal();
    if (!checkpointStore.save(checkpoint)) {
      // another node stored the day first
      return checkpointStore.find(tenantId, date);
    }
    logger.info(
        "checkpoint created tenantId={} date={} events={} merkleRoot={}",
        tenantId,
        date,
        checkpoint.eventCount(),
        checkpoint.merkleRoot());
    return Optional.of(checkpoint);
  }

  /** Verifies against the events currently stored for the checkpoint's day. */
  public CheckpointVerificationResult verifyCheckpoint(Checkpoint checkpoint) {
    return verifyCheckpoint(
        checkpoint, eventsOf(checkpoint.tenantId(), checkpoint.checkpointDate()));
  }

  public CheckpointVerificationResult verifyCheckpoint(
      Checkpoint checkpoint, List<AuditEvent> events) {
    final List<String> errors = new ArrayList<>();

    final boolean hashValid = checkpoint.verifyHash();
    if (!hashValid) {
      errors.add("checkpoint hash does not match its fields");
    }

    final List<AuditEvent> ordered = new ArrayList<>(events);
    ordered.sort(Comparator.comparing(AuditEvent::timestamp));
    final boolean rootValid =
        merkleTreeBuilder.buildTree(ordered).hash().equals(checkpoint.merkleRoot());
    if (ordered.isEmpty()) {
      errors.add("no events found for verification");
    } else if (!rootValid) {
      errors.add("merkle root does not match the stored events");
    }
    if (ordered.size() != checkpoint.eventCount()) {
      errors.add(
          "event count mismatch expected=" + checkpoint.eventCount() + " actual=" + ordered.size());
    }

    final boolean timestampValid;
    if (checkpoint.timestampToken() == null) {
      errors.add("no timestamp token present");
      timestampValid = false;
    } else {
      timestampValid =
          timestampAuthority.verifyToken(checkpoint.timestampToken(), checkpoint.merkleRoot());
      if (!timestampValid) {
        errors.add("timestamp token does not attest the merkle root");
      }
    }

    final boolean chainValid = linksToPrevious(checkpoint);
    if (!chainValid) {
      errors.add("previous checkpoint hash does not match the stored predecessor");
    }

    return new CheckpointVerificationResult(
        status(hashValid, rootValid),
        checkpoint.checkpointDate(),
        hashValid,
        rootValid,
        timestampValid,
        chainValid,
        errors,
        Instant.now(clock));
  }

  /** Re-verifies every stored checkpoint of the tenant in {@code [from, to]}. */
  public List<CheckpointVerificationResult> verifyCheckpointChain(
      String tenantId, LocalDate from, LocalDate to) {
    final List<CheckpointVerificationResult> results = new ArrayList<>();
    for (Checkpoint checkpoint : checkpointStore.findRange(tenantId, from, to)) {
      results.add(verifyCheckpoint(checkpoint));
    }
    return results;
  }

  /** Portable JSON document for storing a checkpoint outside the ledger. */
  public byte[] exportCheckpoint(Checkpoint checkpoint) {
    final Map<String, Object> document = new LinkedHashMap<>();
    document.put("version", EXPORT_VERSION);
    document.put("checkpoint", checkpoint);
    document.put("exported_at", Instant.now(clock).toString());
    try {
      return objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValueAsString(document)
          .getBytes(StandardCharsets.UTF_8);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "checkpoint export failed date=" + checkpoint.checkpointDate(), ex);
    }
  }

  private boolean linksToPrevious(Checkpoint checkpoint) {
    return checkpointStore
        .findLatestBefore(checkpoint.tenantId(), checkpoint.checkpointDate())
        .map(previous -> previous.checkpointHash().equals(checkpoint.previousCheckpointHash()))
        .orElse(checkpoint.previousCheckpointHash().isEmpty());
  }

  private List<AuditEvent> eventsOf(String tenantId, LocalDate date) {
    final Instant start = date.atStartOfDay(ZoneOffset.UTC).toInstant();
    final Instant end = date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    return storage.findAll(tenantId, start, end);
  }

  private static VerificationStatus status(boolean hashValid, boolean rootValid) {
    if (hashValid && rootValid) {
      return VerificationStatus.VALID;
    }
    return hashValid || rootValid ? VerificationStatus.INCOMPLETE : VerificationStatus.INVALID;
  }
}
