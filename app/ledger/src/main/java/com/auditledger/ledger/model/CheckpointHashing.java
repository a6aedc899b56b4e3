package com.auditledger.ledger.model;

import com.auditledger.common.Sha256;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Map;
import java.util.TreeMap;

public final class CheckpointHashing {

  private static final ObjectMapper CANONICAL_MAPPER =
      JsonMapper.builder().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).build();

  private CheckpointHashing() {}

  public static String hash(Checkpoint checkpoint) {
    final Map<String, Object> canonical = new TreeMap<>();
    canonical.put("checkpoint_date", checkpoint.checkpointDate().toString());
    canonical.put("tenant_id", checkpoint.tenantId());
    canonical.put("merkle_root", checkpoint.merkleRoot());
    canonical.put("event_count", checkpoint.eventCount());
    canonical.put("first_event_hash", checkpoint.firstEventHash());
    canonical.put("last_event_hash", checkpoint.lastEventHash());
    canonical.put("previous_checkpoint_hash", checkpoint.previousCheckpointHash());
    try {
      return Sha256.hex(CANONICAL_MAPPER.writeValueAsString(canonical));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("checkpoint fields are not serializable", ex);
    }
  }
}
