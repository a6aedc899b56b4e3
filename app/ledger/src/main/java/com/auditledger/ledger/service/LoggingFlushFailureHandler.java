package com.auditledger.ledger.service;

import com.auditledger.ledger.model.AuditEvent;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingFlushFailureHandler implements FlushFailureHandler {

  private static final Logger logger = LoggerFactory.getLogger(LoggingFlushFailureHandler.class);

  @Override
  public void onFlushFailure(List<AuditEvent> batch, List<AuditEvent> rejected, Throwable cause) {
    // rejected events are never retried, so each tenant listed here has a gap in its stored chain
    final Map<String, List<String>> rejectedByTenant =
        rejected.stream()
            .collect(
                Collectors.groupingBy(
                    AuditEvent::tenantId,
                    TreeMap::new,
                    Collectors.mapping(AuditEvent::id, Collectors.toList())));
    if (cause != null) {
      logger.error(
          "audit flush failed submitted={} rejected={} rejectedEventIds={}",
          batch.size(),
          rejected.size(),
          rejectedByTenant,
          cause);
      return;
    }
    logger.error(
        "audit flush wrote fewer events than submitted submitted={} rejected={}"
            + " rejectedEventIds={}",
        batch.size(),
        rejected.size(),
        rejectedByTenant);
  }
}
