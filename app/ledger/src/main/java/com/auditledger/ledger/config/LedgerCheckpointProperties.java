/*
 * Where: ledger configuration binding
 * What: daily checkpoint schedule and the tenants it covers
 */
package com.auditledger.ledger.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ledger.checkpoint")
public record LedgerCheckpointProperties(
    boolean enabled, @DefaultValue("0 15 0 * * *") String cron, List<String> tenants) {

  public LedgerCheckpointProperties {
    tenants = tenants == null ? List.of() : List.copyOf(tenants);
  }
}
