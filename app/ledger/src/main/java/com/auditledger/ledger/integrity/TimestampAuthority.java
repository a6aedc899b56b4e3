package com.auditledger.ledger.integrity;

import com.auditledger.ledger.model.TimestampToken;

/**
 * Boundary to a time-stamping authority. Implementations backed by an RFC 3161 service return
 * attested tokens; {@link LocalTimestampAuthority} does not.
 */
public interface TimestampAuthority {

  TimestampToken getToken(String hash);

  /**
   * True iff the token attests {@code hash} and its time is not beyond the allowed future
   * tolerance.
   */
  boolean verifyToken(TimestampToken token, String hash);
}
