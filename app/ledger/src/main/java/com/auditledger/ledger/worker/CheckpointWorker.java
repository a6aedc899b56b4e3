/*
 * Where: ledger checkpoint worker
 * What: creates yesterday's checkpoint for each configured tenant on a cron schedule
 * Why: one tenant failing must not stop the others from being anchored
 */
package com.auditledger.ledger.worker;

import com.auditledger.ledger.config.LedgerCheckpointProperties;
import com.auditledger.ledger.integrity.CheckpointService;
import com.auditledger.ledger.model.Checkpoint;
import com.auditledger.ledger.service.LedgerMetrics;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ledger.checkpoint.enabled", havingValue = "true")
public class CheckpointWorker {

  private static final Logger logger = LoggerFactory.getLogger(CheckpointWorker.class);

  private final CheckpointService checkpointService;
  private final LedgerCheckpointProperties properties;
  private final LedgerMetrics metrics;
  private final Clock clock;

  @Scheduled(cron = "${ledger.checkpoint.cron}", zone = "UTC")
  public void run() {
    final LocalDate yesterday = LocalDate.now(clock).minusDays(1);
    for (String tenantId : properties.tenants()) {
      try {
        final Optional<Checkpoint> checkpoint =
            checkpointService.createCheckpoint(tenantId, yesterday);
        metrics.recordCheckpoint(checkpoint.isPresent() ? "created" : "skipped");
      } catch (RuntimeException ex) {
        metrics.recordCheckpoint("failed");
        logger.error("checkpoint creation failed tenantId={} date={}", tenantId, yesterday, ex);
      }
    }
  }
}
