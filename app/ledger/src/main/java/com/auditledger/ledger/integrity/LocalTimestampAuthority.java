package com.auditledger.ledger.integrity;

import com.auditledger.common.Sha256;
import com.auditledger.ledger.config.LedgerIntegrityProperties;
import com.auditledger.ledger.model.TimestampToken;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class LocalTimestampAuthority implements TimestampAuthority {

  static final String HASH_ALGORITHM = "sha256";
  private static final int SERIAL_BITS = 64;

  private final Clock clock;
  private final LedgerIntegrityProperties properties;
  private final SecureRandom random = new SecureRandom();

  @Override
  public TimestampToken getToken(String hash) {
    final Instant now = Instant.now(clock);
    final String serial = new BigInteger(SERIAL_BITS, random).toString(16);
    final String sealInput =
        String.join("|", properties.authorityName(), hash, now.toString(), serial);
    return new TimestampToken(
        HASH_ALGORITHM,
        hash,
        now,
        properties.authorityName(),
        serial,
        Sha256.digest(sealInput.getBytes(StandardCharsets.UTF_8)),
        List.of(),
        null,
        false);
  }

  @Override
  public boolean verifyToken(TimestampToken token, String hash) {
    if (token == null || hash == null || !hash.equals(token.messageImprint())) {
      return false;
    }
    final Instant latestAllowed = Instant.now(clock).plus(properties.timestampTolerance());
    return !token.timestamp().isAfter(latestAllowed);
  }
}
