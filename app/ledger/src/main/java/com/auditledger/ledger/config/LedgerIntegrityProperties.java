package com.auditledger.ledger.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ledger.integrity")
public record LedgerIntegrityProperties(
    @DefaultValue("5m") Duration clockSkewTolerance,
    @DefaultValue("5m") Duration timestampTolerance,
    @DefaultValue("local-ledger-tsa") String authorityName) {}
