package com.auditledger.ledger.repository;

/** A read from audit storage could not be completed. */
public class AuditStorageException extends RuntimeException {

  public AuditStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
