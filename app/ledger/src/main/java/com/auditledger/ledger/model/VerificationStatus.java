package com.auditledger.ledger.model;

public enum VerificationStatus {
  VALID,
  INVALID,
  INCOMPLETE,
  UNKNOWN
}
