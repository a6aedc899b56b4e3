package com.auditledger.ledger.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/** Root of a built tree. {@code tree} is kept for proof generation and is not exported. */
public record MerkleRoot(
    String hash, int leafCount, Instant createdAt, @JsonIgnore MerkleNode tree) {}
