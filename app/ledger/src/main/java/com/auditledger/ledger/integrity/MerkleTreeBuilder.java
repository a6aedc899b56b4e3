package com.auditledger.ledger.integrity;

import com.auditledger.common.Sha256;
import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.MerkleNode;
import com.auditledger.ledger.model.MerkleProof;
import com.auditledger.ledger.model.MerkleRoot;
import com.auditledger.ledger.model.ProofDirection;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MerkleTreeBuilder {

  static final String EMPTY_TREE_HASH = Sha256.hex("");

  private final Clock clock;

  /**
   * Builds a tree whose leaves are the events' hashes in the given order. A level with an odd
   * node count pairs its last node with itself.
   */
  public MerkleRoot buildTree(List<AuditEvent> events) {
    final Instant now = Instant.now(clock);
    if (events.isEmpty()) {
      return new MerkleRoot(EMPTY_TREE_HASH, 0, now, null);
    }
    List<MerkleNode> level = new ArrayList<>(events.size());
    for (AuditEvent event : events) {
      level.add(MerkleNode.leaf(event.hash(), event.id()));
    }
    while (level.size() > 1) {
      if (level.size() % 2 == 1) {
        level.add(level.get(level.size() - 1));
      }
      final List<MerkleNode> parents = new ArrayList<>(level.size() / 2);
      for (int i = 0; i < level.size(); i += 2) {
        final MerkleNode left = level.get(i);
        final MerkleNode right = level.get(i + 1);
        parents.add(new MerkleNode(hashPair(left.hash(), right.hash()), left, right, null));
      }
      level = parents;
    }
    final MerkleNode root = level.get(0);
    return new MerkleRoot(root.hash(), events.size(), now, root);
  }

  /** Returns the inclusion proof for the event, or {@code null} if its hash is not a leaf. */
  public MerkleProof generateProof(AuditEvent event, MerkleRoot root) {
    if (root.tree() == null) {
      return null;
    }
    final List<String> siblings = new ArrayList<>();
    final List<ProofDirection> directions = new ArrayList<>();
    if (!collectPath(root.tree(), event.hash(), siblings, directions)) {
      return null;
    }
    // collected root to leaf, proofs fold leaf to root
    Collections.reverse(siblings);
    Collections.reverse(directions);
    return new MerkleProof(event.id(), event.hash(), siblings, directions, root.hash());
  }

  public boolean verifyProof(AuditEvent event, MerkleProof proof, MerkleRoot root) {
    if (!event.hash().equals(proof.eventHash()) || !root.hash().equals(proof.rootHash())) {
      return false;
    }
    String current = event.hash();
    for (int i = 0; i < proof.siblingHashes().size(); i++) {
      final String sibling = proof.siblingHashes().get(i);
      current =
          proof.directions().get(i) == ProofDirection.LEFT
              ? hashPair(sibling, current)
              : hashPair(current, sibling);
    }
    return current.equals(root.hash());
  }

  static String hashPair(String left, String right) {
    return Sha256.hex(left + right);
  }

  private static boolean collectPath(
      MerkleNode node, String leafHash, List<String> siblings, List<ProofDirection> directions) {
    if (node.isLeaf()) {
      return node.hash().equals(leafHash);
    }
    siblings.add(node.right().hash());
    directions.add(ProofDirection.RIGHT);
    if (collectPath(node.left(), leafHash, siblings, directions)) {
      return true;
    }
    siblings.set(siblings.size() - 1, node.left().hash());
    directions.set(directions.size() - 1, ProofDirection.LEFT);
    if (collectPath(node.right(), leafHash, siblings, directions)) {
      return true;
    }
    siblings.remove(siblings.size() - 1);
    directions.remove(directions.size() - 1);
    return false;
  }
}
