package com.auditledger.ledger.model;

public enum TamperingType {
  HASH_MISMATCH,
  CHAIN_BREAK,
  TIMESTAMP_ANOMALY,
  DUPLICATE_EVENT
}
