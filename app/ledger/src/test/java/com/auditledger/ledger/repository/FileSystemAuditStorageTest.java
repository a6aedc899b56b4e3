package com.auditledger.ledger.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.AuditEventFilter;
import com.auditledger.ledger.model.Checkpoint;
import com.auditledger.ledger.model.IntegrityReport;
import com.auditledger.ledger.model.TamperingType;
import com.auditledger.ledger.support.TestEvents;
import com.auditledger.ledger.support.TestJson;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemAuditStorageTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T10:00:00Z");

  @TempDir Path basePath;

  private FileSystemAuditStorage storage;

  @BeforeEach
  void setUp() {
    storage = new FileSystemAuditStorage(basePath, TestJson.mapper());
  }

  @Test
  void writesOneReadOnlyFilePerEventUnderTenantAndDay() throws Exception {
    final AuditEvent event = TestEvents.event("t1", "evt-1", BASE_TIME).build().seal();

    assertThat(storage.writeEvent(event)).isTrue();

    final Path file = basePath.resolve("t1/2026/03/01/evt-1.json");
    assertThat(file).isRegularFile();
    assertThat(Files.getPosixFilePermissions(file))
        .doesNotContain(
            PosixFilePermission.OWNER_WRITE,
            PosixFilePermission.GROUP_WRITE,
            PosixFilePermission.OTHERS_WRITE);
  }

  @Test
  void storedEventIsNeverOverwritten() {
    final AuditEvent original = TestEvents.event("t1", "evt-1", BASE_TIME).build().seal();
    final AuditEvent rewrite = original.toBuilder().actorId("intruder").build().seal();

    assertThat(storage.writeEvent(original)).isTrue();
    assertThat(storage.writeEvent(rewrite)).isFalse();

    final AuditEvent stored = storage.readEvent("evt-1").orElseThrow();
    assertThat(stored.actorId()).isEqualTo("user-1");
    assertThat(stored.hash()).isEqualTo(original.hash());
  }

  @Test
  void idAlreadyStoredOnAnotherDayOrTenantIsRejected() {
    final AuditEvent original = TestEvents.event("t1", "evt-1", BASE_TIME).build().seal();
    final AuditEvent nextDay =
        TestEvents.event("t1", "evt-1", BASE_TIME.plusSeconds(86_400)).build().seal();
    final AuditEvent otherTenant = TestEvents.event("t2", "evt-1", BASE_TIME).build().seal();

    assertThat(storage.writeEvent(original)).isTrue();
    assertThat(storage.writeEvent(nextDay)).isFalse();
    assertThat(storage.writeEvent(otherTenant)).isFalse();

    assertThat(basePath.resolve("t1/2026/03/02/evt-1.json")).doesNotExist();
    assertThat(storage.readEvent("evt-1").orElseThrow().hash()).isEqualTo(original.hash());
    assertThat(storage.query(AuditEventFilter.builder().build())).hasSize(1);
  }

  @Test
  void indexDirectoryCannotBeUsedAsTenant() {
    final AuditEvent event =
        TestEvents.event(FileSystemAuditStorage.INDEX_DIRECTORY, "evt-1", BASE_TIME)
            .build()
            .seal();

    assertThat(storage.writeEvent(event)).isFalse();
    assertThat(storage.readEvent("evt-1")).isEmpty();
  }

  @Test
  void readBackEventStillMatchesItsHash() {
    final AuditEvent event =
        TestEvents.event("t1", "evt-1", BASE_TIME.plusNanos(123_000)).build().seal();
    storage.writeEvent(event);

    final AuditEvent stored = storage.readEvent("evt-1").orElseThrow();

    assertThat(stored.timestamp()).isEqualTo(event.timestamp());
    assertThat(stored.verifyHash()).isTrue();
    assertThat(storage.readEvent("missing")).isEmpty();
  }

  @Test
  void batchReportsOnlyNewlyStoredEvents() {
    final List<AuditEvent> chain = TestEvents.chain("t1", 3, BASE_TIME);
    storage.writeEvent(chain.get(1));

    assertThat(storage.writeBatch(chain)).isEqualTo(2);
  }

  @Test
  void rejectsIdentifiersThatEscapeTheBaseDirectory() {
    final AuditEvent traversal = TestEvents.event("..", "evt-1", BASE_TIME).build().seal();
    final AuditEvent nested = TestEvents.event("t1", "a/b", BASE_TIME).build().seal();

    assertThat(storage.writeEvent(traversal)).isFalse();
    assertThat(storage.writeEvent(nested)).isFalse();
  }

  @Test
  void queryReturnsNewestFirstWithPaging() {
    storage.writeBatch(TestEvents.chain("t1", 5, BASE_TIME));
    storage.writeBatch(TestEvents.chain("t2", 2, BASE_TIME));

    final AuditEventFilter filter =
        AuditEventFilter.forTenant("t1", BASE_TIME, BASE_TIME.plusSeconds(60), 2);

    assertThat(storage.query(filter))
        .extracting(AuditEvent::id)
        .containsExactly("t1-evt-4", "t1-evt-3");
    assertThat(storage.query(filter.page(2, 2)))
        .extracting(AuditEvent::id)
        .containsExactly("t1-evt-2", "t1-evt-1");
    assertThat(storage.query(filter.page(4, 2)))
        .extracting(AuditEvent::id)
        .containsExactly("t1-evt-0");
  }

  @Test
  void queryAppliesFieldFiltersAndHalfOpenWindow() {
    storage.writeBatch(TestEvents.chain("t1", 3, BASE_TIME));
    storage.writeEvent(
        TestEvents.event("t1", "other-actor", BASE_TIME.plusSeconds(1))
            .actorId("user-2")
            .build()
            .seal());

    final AuditEventFilter byActor =
        AuditEventFilter.builder().tenantId("t1").actorId("user-2").build();
    final AuditEventFilter window =
        AuditEventFilter.forTenant("t1", BASE_TIME, BASE_TIME.plusSeconds(2), 10);

    assertThat(storage.query(byActor)).extracting(AuditEvent::id).containsExactly("other-actor");
    assertThat(storage.query(window))
        .extracting(AuditEvent::id)
        .containsExactlyInAnyOrder("t1-evt-0", "t1-evt-1", "other-actor");
  }

  @Test
  void globalQueryIgnoresCheckpointFiles() {
    storage.writeBatch(TestEvents.chain("t1", 2, BASE_TIME));
    new FileSystemCheckpointStore(basePath, TestJson.mapper())
        .save(
            Checkpoint.builder()
                .checkpointDate(LocalDate.of(2026, 3, 1))
                .tenantId("t1")
                .merkleRoot("a".repeat(64))
                .eventCount(2)
                .createdAt(BASE_TIME)
                .build()
                .seal());

    assertThat(storage.query(AuditEventFilter.builder().build())).hasSize(2);
    assertThat(storage.query(AuditEventFilter.builder().tenantId("t1").build())).hasSize(2);
  }

  @Test
  void intactChainPassesIntegrityCheck() {
    storage.writeBatch(TestEvents.chain("t1", 4, BASE_TIME));

    final IntegrityReport report =
        storage.verifyIntegrity("t1", BASE_TIME, BASE_TIME.plusSeconds(60));

    assertThat(report.valid()).isTrue();
    assertThat(report.totalEvents()).isEqualTo(4);
    assertThat(report.verifiedEvents()).isEqualTo(4);
  }

  @Test
  void windowStartingMidChainIsNotReportedBroken() {
    storage.writeBatch(TestEvents.chain("t1", 4, BASE_TIME));

    final IntegrityReport report =
        storage.verifyIntegrity("t1", BASE_TIME.plusSeconds(2), BASE_TIME.plusSeconds(60));

    assertThat(report.valid()).isTrue();
    assertThat(report.totalEvents()).isEqualTo(2);
  }

  @Test
  void relinkedEventIsReportedAsChainBreak() {
    final List<AuditEvent> chain = TestEvents.chain("t1", 3, BASE_TIME);
    final AuditEvent relinked =
        chain.get(2).toBuilder().previousHash("f".repeat(64)).build().seal();
    storage.writeBatch(List.of(chain.get(0), chain.get(1), relinked));

    final IntegrityReport report =
        storage.verifyIntegrity("t1", BASE_TIME, BASE_TIME.plusSeconds(60));

    assertThat(report.valid()).isFalse();
    assertThat(report.verifiedEvents()).isEqualTo(2);
    assertThat(report.errors())
        .singleElement()
        .satisfies(
            error -> {
              assertThat(error.eventId()).isEqualTo(relinked.id());
              assertThat(error.type()).isEqualTo(TamperingType.CHAIN_BREAK);
              assertThat(error.expected()).isEqualTo(chain.get(1).hash());
            });
  }
}
