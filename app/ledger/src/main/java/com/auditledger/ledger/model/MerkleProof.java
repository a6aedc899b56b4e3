package com.auditledger.ledger.model;

import java.util.List;

public record MerkleProof(
    String eventId,
    String eventHash,
    List<String> siblingHashes,
    List<ProofDirection> directions,
    String rootHash) {

  public MerkleProof {
    siblingHashes = List.copyOf(siblingHashes);
    directions = List.copyOf(directions);
    if (siblingHashes.size() != directions.size()) {
      throw new IllegalArgumentException("each sibling hash needs exactly one direction");
    }
  }
}
