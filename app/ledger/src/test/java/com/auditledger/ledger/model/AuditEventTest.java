package com.auditledger.ledger.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.auditledger.ledger.support.TestEvents;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuditEventTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T10:00:00Z");

  @Test
  void identicalFieldsHashIdentically() {
    final AuditEvent first = TestEvents.event("t1", "evt-1", BASE_TIME).build();
    final AuditEvent second = TestEvents.event("t1", "evt-1", BASE_TIME).build();

    assertThat(first.computeHash()).isEqualTo(second.computeHash()).hasSize(64);
  }

  @Test
  void stateKeyOrderDoesNotChangeHash() {
    final Map<String, Object> ascending = new LinkedHashMap<>();
    ascending.put("a", 1);
    ascending.put("b", Map.of("y", 2, "x", 1));
    final Map<String, Object> descending = new LinkedHashMap<>();
    descending.put("b", Map.of("x", 1, "y", 2));
    descending.put("a", 1);

    final AuditEvent first =
        TestEvents.event("t1", "evt-1", BASE_TIME).newState(ascending).build();
    final AuditEvent second =
        TestEvents.event("t1", "evt-1", BASE_TIME).newState(descending).build();

    assertThat(first.computeHash()).isEqualTo(second.computeHash());
  }

  @Test
  void changingAnyFieldBreaksVerifyHash() {
    final AuditEvent sealed = TestEvents.event("t1", "evt-1", BASE_TIME).build().seal();
    assertThat(sealed.verifyHash()).isTrue();

    final List<AuditEvent> tampered =
        List.of(
            sealed.toBuilder().resourceId("other").build(),
            sealed.toBuilder().timestamp(BASE_TIME.plusNanos(1000)).build(),
            sealed.toBuilder().severity(Severity.CRITICAL).build(),
            sealed.toBuilder().newState(Map.of("status", "changed")).build(),
            sealed.toBuilder().previousHash("abc").build(),
            sealed.toBuilder().actorEmail(null).build());

    for (AuditEvent event : tampered) {
      assertThat(event.verifyHash()).isFalse();
      assertThat(event.computeHash()).isNotEqualTo(sealed.hash());
    }
  }

  @Test
  void hashIsNotPartOfItsOwnInput() {
    final AuditEvent sealed = TestEvents.event("t1", "evt-1", BASE_TIME).build().seal();

    assertThat(sealed.toBuilder().hash("ignored").build().computeHash()).isEqualTo(sealed.hash());
    assertThat(EventHashing.canonicalJson(sealed)).doesNotContain("\"hash\"");
    assertThat(EventHashing.canonicalJson(sealed)).contains("\"previous_hash\":\"\"");
  }

  @Test
  void canonicalJsonUsesTagsAndIsoTimestamps() {
    final AuditEvent event = TestEvents.event("t1", "evt-1", BASE_TIME).build();

    final String json = EventHashing.canonicalJson(event);

    assertThat(json)
        .contains("\"action\":\"read\"")
        .contains("\"category\":\"data\"")
        .contains("\"timestamp\":\"2026-03-01T10:00:00Z\"")
        .startsWith("{\"action\"");
  }

  @Test
  void genesisEventVerifiesWithoutPredecessor() {
    final AuditEvent genesis = TestEvents.chain("t1", 1, BASE_TIME).get(0);

    assertThat(genesis.previousHash()).isEmpty();
    assertThat(genesis.verifyChain(null)).isTrue();
    assertThat(genesis.toBuilder().previousHash("x").build().verifyChain(null)).isFalse();
  }

  @Test
  void chainLinksMatchPredecessorHashes() {
    final List<AuditEvent> events = TestEvents.chain("t1", 4, BASE_TIME);

    for (int i = 1; i < events.size(); i++) {
      assertThat(events.get(i).previousHash()).isEqualTo(events.get(i - 1).hash());
      assertThat(events.get(i).verifyChain(events.get(i - 1))).isTrue();
    }
    assertThat(events.get(3).verifyChain(events.get(1))).isFalse();
  }

  @Test
  void deduplicationKeyIgnoresIdAndTimestamp() {
    final AuditEvent first = TestEvents.event("t1", "evt-1", BASE_TIME).resourceId("r").build();
    final AuditEvent second =
        TestEvents.event("t1", "evt-2", BASE_TIME.plusSeconds(5)).resourceId("r").build();

    assertThat(first.deduplicationKey())
        .isEqualTo(second.deduplicationKey())
        .isEqualTo("t1:trace.viewed:trace:r:read");
  }
}
