package com.auditledger.ledger.model;

/** One failed check in a chain verification, with the hash that was expected and found. */
public record ChainError(String eventId, TamperingType type, String expected, String actual) {}
