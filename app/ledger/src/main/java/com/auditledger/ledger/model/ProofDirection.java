package com.auditledger.ledger.model;

/** Side on which a proof's sibling hash sits relative to the node being folded. */
public enum ProofDirection {
  LEFT,
  RIGHT
}
