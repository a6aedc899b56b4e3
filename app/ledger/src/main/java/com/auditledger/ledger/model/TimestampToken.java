package com.auditledger.ledger.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TimestampToken(
    String hashAlgorithm,
    String messageImprint,
    Instant timestamp,
    String authority,
    String serialNumber,
    byte[] signature,
    List<byte[]> certificateChain,
    String policyOid,
    boolean attested) {

  public TimestampToken {
    signature = signature == null ? new byte[0] : signature.clone();
    certificateChain = certificateChain == null ? List.of() : List.copyOf(certificateChain);
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }
}
