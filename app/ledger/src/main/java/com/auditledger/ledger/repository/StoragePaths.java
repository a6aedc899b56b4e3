package com.auditledger.ledger.repository;

final class StoragePaths {

  private StoragePaths() {}

  /** Validates a value used as a single path segment. */
  static String segment(String value, String label) {
    if (value == null
        || value.isBlank()
        || value.equals(".")
        || value.equals("..")
        || value.contains("/")
        || value.contains("\\")) {
      throw new IllegalArgumentException(label + " is not a valid path segment: " + value);
    }
    return value;
  }
}
