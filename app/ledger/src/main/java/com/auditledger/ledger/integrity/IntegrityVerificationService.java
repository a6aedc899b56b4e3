package com.auditledger.ledger.integrity;

import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.ChainVerificationResult;
import com.auditledger.ledger.model.CheckpointVerificationResult;
import com.auditledger.ledger.model.TamperingIndicator;
import com.auditledger.ledger.model.VerificationReport;
import com.auditledger.ledger.model.VerificationStatus;
import com.auditledger.ledger.repository.AuditStorage;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IntegrityVerificationService {

  private static final Logger logger = LoggerFactory.getLogger(IntegrityVerificationService.class);

  private final AuditStorage storage;
  private final AuditChain auditChain;
  private final CheckpointService checkpointService;
  private final Clock clock;

  /**
   * Verifies the tenant's events in {@code [start, end)} and every stored checkpoint whose day
   * overlaps the window.
   */
  public VerificationReport generateReport(String tenantId, Instant start, Instant end) {
    final List<AuditEvent> events = storage.findAll(tenantId, start, end);
    final ChainVerificationResult chainResult = auditChain.verifyChain(events);
    final List<TamperingIndicator> indicators = auditChain.findTampering(events);
    final LocalDate from = start.atZone(ZoneOffset.UTC).toLocalDate();
    final LocalDate to = end.minusNanos(1).atZone(ZoneOffset.UTC).toLocalDate();
    final List<CheckpointVerificationResult> checkpoints =
        checkpointService.verifyCheckpointChain(tenantId, from, to);

    final VerificationStatus overall = overallStatus(chainResult, indicators, checkpoints);
    if (overall != VerificationStatus.VALID) {
      logger.warn(
          "integrity report not valid tenantId={} status={} invalidEvents={} indicators={}",
          tenantId,
          overall,
          chainResult.invalidEvents(),
          indicators.size());
    }
    return new VerificationReport(
        tenantId, start, end, chainResult, indicators, checkpoints, overall, Instant.now(clock));
  }

  private static VerificationStatus overallStatus(
      ChainVerificationResult chainResult,
      List<TamperingIndicator> indicators,
      List<CheckpointVerificationResult> checkpoints) {
    if (chainResult.status() == VerificationStatus.INVALID) {
      return VerificationStatus.INVALID;
    }
    final boolean checkpointsValid =
        checkpoints.stream()
            .allMatch(
                result -> result.status() == VerificationStatus.VALID && result.chainValid());
    if (chainResult.isValid() && indicators.isEmpty() && checkpointsValid) {
      return VerificationStatus.VALID;
    }
    return VerificationStatus.INCOMPLETE;
  }
}
