package com.auditledger.ledger.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auditledger.ledger.support.TestEvents;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AuditEventFilterTest {

  private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
  private static final Instant END = Instant.parse("2026-03-02T00:00:00Z");

  @Test
  void windowIncludesStartAndExcludesEnd() {
    final AuditEventFilter filter = AuditEventFilter.forTenant("t1", START, END, 10);

    assertThat(filter.matches(TestEvents.event("t1", "a", START).build())).isTrue();
    assertThat(filter.matches(TestEvents.event("t1", "b", END).build())).isFalse();
    assertThat(filter.matches(TestEvents.event("t1", "c", START.minusNanos(1000)).build()))
        .isFalse();
  }

  @Test
  void presentFieldsAreAnded() {
    final AuditEventFilter filter =
        AuditEventFilter.builder().tenantId("t1").action(Action.READ).resourceId("r-1").build();

    assertThat(filter.matches(TestEvents.event("t1", "a", START).resourceId("r-1").build()))
        .isTrue();
    assertThat(filter.matches(TestEvents.event("t2", "a", START).resourceId("r-1").build()))
        .isFalse();
    assertThat(filter.matches(TestEvents.event("t1", "a", START).resourceId("r-2").build()))
        .isFalse();
  }

  @Test
  void defaultsPaginationAndRejectsNegativeValues() {
    final AuditEventFilter filter = AuditEventFilter.builder().build();

    assertThat(filter.limit()).isEqualTo(AuditEventFilter.DEFAULT_LIMIT);
    assertThat(filter.offset()).isZero();
    assertThatThrownBy(() -> AuditEventFilter.builder().offset(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
