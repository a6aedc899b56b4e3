package com.auditledger.ledger.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ledger.capture")
public record LedgerCaptureProperties(
    @DefaultValue("100") int batchSize,
    @DefaultValue("5s") Duration batchInterval,
    @DefaultValue("true") boolean deduplicationEnabled,
    @DefaultValue("60s") Duration deduplicationWindow,
    @DefaultValue("10s") Duration shutdownTimeout,
    List<String> recoverTenants) {

  public LedgerCaptureProperties {
    if (batchSize < 1) {
      throw new IllegalArgumentException("ledger.capture.batch-size must be positive");
    }
    recoverTenants = recoverTenants == null ? List.of() : List.copyOf(recoverTenants);
  }
}
