/*
 * Where: shared ledger configuration
 * What: exposes the UTC clock used for capture times, checkpoint dates and token checks
 * Why: tests replace one bean instead of freezing time in every service
 */
package com.auditledger.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  public Clock ledgerClock() {
    return Clock.systemUTC();
  }
}
