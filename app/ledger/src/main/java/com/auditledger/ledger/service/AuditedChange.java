package com.auditledger.ledger.service;

import com.auditledger.ledger.model.CaptureRequest;
import java.util.Map;

public final class AuditedChange implements AutoCloseable {

  private final AuditCaptureService captureService;
  private final CaptureRequest request;
  private Map<String, Object> before;
  private Map<String, Object> after;
  private String eventId;

  AuditedChange(AuditCaptureService captureService, CaptureRequest request) {
    this.captureService = captureService;
    this.request = request;
  }

  public AuditedChange before(Map<String, Object> state) {
    this.before = state;
    return this;
  }

  public AuditedChange after(Map<String, Object> state) {
    this.after = state;
    return this;
  }

  /** Id of the captured event, or {@code null} while the scope is open. */
  public String eventId() {
    return eventId;
  }

  @Override
  public void close() {
    if (eventId != null) {
      return;
    }
    eventId =
        captureService.capture(request.toBuilder().previousState(before).newState(after).build());
  }
}
