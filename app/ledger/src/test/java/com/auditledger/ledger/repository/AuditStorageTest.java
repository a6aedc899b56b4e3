package com.auditledger.ledger.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.AuditEventFilter;
import com.auditledger.ledger.model.IntegrityReport;
import com.auditledger.ledger.support.InMemoryAuditStorage;
import com.auditledger.ledger.support.TestEvents;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class AuditStorageTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");
  private static final Instant WINDOW_END = BASE_TIME.plusSeconds(86_400);

  @Test
  void eventWrittenWhilePagingDoesNotRepeatEarlierEvents() {
    final List<AuditEvent> chain =
        TestEvents.chain("t1", AuditStorage.INTEGRITY_PAGE_SIZE + 200, BASE_TIME);
    final AuditEvent late =
        TestEvents.event("t1", "late", BASE_TIME.plusSeconds(3_600))
            .previousHash(chain.get(chain.size() - 1).hash())
            .build()
            .seal();
    final InsertingStorage storage = new InsertingStorage(late);
    storage.writeBatch(chain);

    final List<AuditEvent> events = storage.findAll("t1", BASE_TIME, WINDOW_END);

    assertThat(events).extracting(AuditEvent::id).doesNotHaveDuplicates();
    assertThat(events).extracting(AuditEvent::id).containsAll(ids(chain));
    assertThat(events).extracting(AuditEvent::timestamp).isSorted();
    final IntegrityReport report = storage.verifyIntegrity("t1", BASE_TIME, WINDOW_END);
    assertThat(report.valid()).isTrue();
    assertThat(report.errors()).isEmpty();
  }

  @Test
  void eventsSharingTheBoundaryTimestampAreAllReturned() {
    final InMemoryAuditStorage storage = new InMemoryAuditStorage();
    final List<AuditEvent> tied = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      tied.add(TestEvents.event("t1", "tie-" + i, BASE_TIME).build().seal());
    }
    storage.writeBatch(tied);
    final int distinct = AuditStorage.INTEGRITY_PAGE_SIZE - 2;
    for (int i = 0; i < distinct; i++) {
      storage.writeEvent(
          TestEvents.event("t1", "evt-" + i, BASE_TIME.plusSeconds(i + 1)).build().seal());
    }

    final List<AuditEvent> events = storage.findAll("t1", BASE_TIME, WINDOW_END);

    assertThat(events).hasSize(distinct + tied.size());
    assertThat(events).extracting(AuditEvent::id).doesNotHaveDuplicates();
    assertThat(events.subList(0, tied.size()))
        .extracting(AuditEvent::id)
        .containsExactlyInAnyOrderElementsOf(ids(tied));
  }

  private static List<String> ids(List<AuditEvent> events) {
    final List<String> ids = new ArrayList<>();
    events.forEach(event -> ids.add(event.id()));
    return ids;
  }

  /** Stores one extra event right after the first page has been served. */
  private static final class InsertingStorage extends InMemoryAuditStorage {

    private final AuditEvent late;
    private final AtomicBoolean inserted = new AtomicBoolean(false);

    private InsertingStorage(AuditEvent late) {
      this.late = late;
    }

    @Override
    public synchronized List<AuditEvent> query(AuditEventFilter filter) {
      final List<AuditEvent> page = super.query(filter);
      if (inserted.compareAndSet(false, true)) {
        writeEvent(late);
      }
      return page;
    }
  }
}
