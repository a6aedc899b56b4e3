package com.auditledger.ledger.model;

/**
 * Node of a Merkle tree. Leaves carry the event id and have no children; a padded level reuses
 * the same node object as both children of its parent.
 */
public record MerkleNode(String hash, MerkleNode left, MerkleNode right, String leafEventId) {

  public static MerkleNode leaf(String hash, String eventId) {
    return new MerkleNode(hash, null, null, eventId);
  }

  public boolean isLeaf() {
    return left == null && right == null;
  }
}
