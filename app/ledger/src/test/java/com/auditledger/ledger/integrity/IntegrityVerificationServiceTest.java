package com.auditledger.ledger.integrity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.auditledger.ledger.config.LedgerIntegrityProperties;
import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.CheckpointVerificationResult;
import com.auditledger.ledger.model.TamperingIndicator;
import com.auditledger.ledger.model.TamperingType;
import com.auditledger.ledger.model.VerificationReport;
import com.auditledger.ledger.model.VerificationStatus;
import com.auditledger.ledger.support.InMemoryAuditStorage;
import com.auditledger.ledger.support.TestEvents;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IntegrityVerificationServiceTest {

  private static final String TENANT = "t1";
  private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
  private static final Instant END = Instant.parse("2026-03-03T00:00:00Z");
  private static final Instant NOW = Instant.parse("2026-03-05T00:00:00Z");

  @Mock private CheckpointService checkpointService;

  private final InMemoryAuditStorage storage = new InMemoryAuditStorage();
  private IntegrityVerificationService service;

  @BeforeEach
  void setUp() {
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final AuditChain auditChain =
        new AuditChain(
            clock,
            new LedgerIntegrityProperties(
                Duration.ofMinutes(5), Duration.ofMinutes(5), "test-tsa"));
    service = new IntegrityVerificationService(storage, auditChain, checkpointService, clock);
  }

  @Test
  void intactWindowWithValidCheckpointsIsValid() {
    storage.writeBatch(TestEvents.chain(TENANT, 4, START.plusSeconds(60)));
    when(checkpointService.verifyCheckpointChain(anyString(), any(), any()))
        .thenReturn(List.of(checkpointResult(VerificationStatus.VALID, true)));

    final VerificationReport report = service.generateReport(TENANT, START, END);

    assertThat(report.overallStatus()).isEqualTo(VerificationStatus.VALID);
    assertThat(report.chainResult().totalEvents()).isEqualTo(4);
    assertThat(report.tamperingIndicators()).isEmpty();
    assertThat(report.checkpointsVerified()).hasSize(1);
    assertThat(report.generatedAt()).isEqualTo(NOW);
  }

  @Test
  void checkpointDaysCoverTheWindowEndExclusive() {
    when(checkpointService.verifyCheckpointChain(anyString(), any(), any())).thenReturn(List.of());

    service.generateReport(TENANT, START, END);

    verify(checkpointService)
        .verifyCheckpointChain(TENANT, LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 2));
  }

  @Test
  void editedEventMakesReportIncomplete() {
    final List<AuditEvent> events = TestEvents.chain(TENANT, 4, START.plusSeconds(60));
    storage.writeBatch(
        List.of(
            events.get(0),
            events.get(1).toBuilder().actorId("someone-else").build(),
            events.get(2),
            events.get(3)));
    when(checkpointService.verifyCheckpointChain(anyString(), any(), any())).thenReturn(List.of());

    final VerificationReport report = service.generateReport(TENANT, START, END);

    assertThat(report.overallStatus()).isEqualTo(VerificationStatus.INCOMPLETE);
    assertThat(report.chainResult().hashMismatches()).containsExactly(events.get(1).id());
    assertThat(report.tamperingIndicators())
        .extracting(TamperingIndicator::kind)
        .contains(TamperingType.HASH_MISMATCH);
  }

  @Test
  void fullyCorruptedWindowIsInvalid() {
    final AuditEvent only = TestEvents.chain(TENANT, 1, START.plusSeconds(60)).get(0);
    storage.writeEvent(only.toBuilder().resourceId("forged").build());
    when(checkpointService.verifyCheckpointChain(anyString(), any(), any())).thenReturn(List.of());

    final VerificationReport report = service.generateReport(TENANT, START, END);

    assertThat(report.overallStatus()).isEqualTo(VerificationStatus.INVALID);
  }

  @Test
  void brokenCheckpointLinkDowngradesValidChain() {
    storage.writeBatch(TestEvents.chain(TENANT, 2, START.plusSeconds(60)));
    when(checkpointService.verifyCheckpointChain(anyString(), any(), any()))
        .thenReturn(List.of(checkpointResult(VerificationStatus.VALID, false)));

    final VerificationReport report = service.generateReport(TENANT, START, END);

    assertThat(report.chainResult().isValid()).isTrue();
    assertThat(report.overallStatus()).isEqualTo(VerificationStatus.INCOMPLETE);
  }

  @Test
  void emptyWindowIsValid() {
    when(checkpointService.verifyCheckpointChain(anyString(), any(), any())).thenReturn(List.of());

    final VerificationReport report = service.generateReport("nobody", START, END);

    assertThat(report.chainResult().totalEvents()).isZero();
    assertThat(report.overallStatus()).isEqualTo(VerificationStatus.VALID);
  }

  private static CheckpointVerificationResult checkpointResult(
      VerificationStatus status, boolean chainValid) {
    return new CheckpointVerificationResult(
        status, LocalDate.of(2026, 3, 1), true, true, true, chainValid, List.of(), NOW);
  }
}
