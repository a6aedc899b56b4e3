package com.auditledger.ledger.config;

import com.auditledger.ledger.integrity.LocalTimestampAuthority;
import com.auditledger.ledger.integrity.TimestampAuthority;
import com.auditledger.ledger.repository.AuditStorage;
import com.auditledger.ledger.service.AuditCaptureService;
import com.auditledger.ledger.service.AuditEventEnricher;
import com.auditledger.ledger.service.FlushFailureHandler;
import com.auditledger.ledger.service.LedgerMetrics;
import com.auditledger.ledger.service.LoggingFlushFailureHandler;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class LedgerCaptureConfig {

  @Bean
  @ConditionalOnMissingBean
  FlushFailureHandler flushFailureHandler() {
    return new LoggingFlushFailureHandler();
  }

  @Bean
  @ConditionalOnMissingBean
  TimestampAuthority timestampAuthority(Clock clock, LedgerIntegrityProperties properties) {
    return new LocalTimestampAuthority(clock, properties);
  }

  @Bean
  AuditCaptureService auditCaptureService(
      AuditStorage storage,
      LedgerCaptureProperties properties,
      LedgerMetrics metrics,
      FlushFailureHandler flushFailureHandler,
      Clock clock,
      ObjectProvider<AuditEventEnricher> enrichers) {
    final AuditCaptureService service =
        new AuditCaptureService(storage, properties, metrics, flushFailureHandler, clock);
    enrichers.orderedStream().forEach(service::addEnricher);
    return service;
  }
}
