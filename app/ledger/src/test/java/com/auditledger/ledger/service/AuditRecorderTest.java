package com.auditledger.ledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.auditledger.ledger.model.Action;
import com.auditledger.ledger.model.ActorType;
import com.auditledger.ledger.model.CaptureRequest;
import com.auditledger.ledger.model.EventCategory;
import com.auditledger.ledger.model.EventTypes;
import com.auditledger.ledger.model.RequestContext;
import com.auditledger.ledger.model.Severity;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuditRecorderTest {

  private static final RequestContext CONTEXT =
      new RequestContext(
          "tenant-1",
          ActorType.USER,
          "user-1",
          "user-1@example.com",
          "10.0.0.8",
          "Mozilla/5.0",
          "req-1",
          "sess-1");

  @Mock private AuditCaptureService captureService;
  @Captor private ArgumentCaptor<CaptureRequest> requestCaptor;

  private AuditRecorder recorder;

  @BeforeEach
  void setUp() {
    recorder = new AuditRecorder(captureService);
  }

  @Test
  void failedLoginIsRecordedAsWarning() {
    when(captureService.capture(any())).thenReturn("evt-1");

    assertThat(recorder.userLogin(CONTEXT, "user-1", "user-1@example.com", false))
        .isEqualTo("evt-1");

    verify(captureService).capture(requestCaptor.capture());
    final CaptureRequest request = requestCaptor.getValue();
    assertThat(request.eventType()).isEqualTo(EventTypes.Auth.USER_LOGIN_FAILED);
    assertThat(request.severity()).isEqualTo(Severity.WARNING);
    assertThat(request.tenantId()).isEqualTo("tenant-1");
    assertThat(request.actorIp()).isEqualTo("10.0.0.8");
    assertThat(request.requestId()).isEqualTo("req-1");
    assertThat(request.sessionId()).isEqualTo("sess-1");
  }

  @Test
  void roleChangeCarriesBeforeAndAfterState() {
    recorder.userRoleChanged(CONTEXT, "user-2", "user-2@example.com", "viewer", "admin");

    verify(captureService).capture(requestCaptor.capture());
    final CaptureRequest request = requestCaptor.getValue();
    assertThat(request.category()).isEqualTo(EventCategory.ADMIN);
    assertThat(request.action()).isEqualTo(Action.UPDATE);
    assertThat(request.previousState()).containsEntry("role", "viewer");
    assertThat(request.newState()).containsEntry("role", "admin");
    assertThat(request.resourceId()).isEqualTo("user-2");
  }

  @Test
  void traceExportRecordsFormatAtWarning() {
    recorder.traceExported(CONTEXT, "proj-1", "trace-9", "csv");

    verify(captureService).capture(requestCaptor.capture());
    final CaptureRequest request = requestCaptor.getValue();
    assertThat(request.projectId()).isEqualTo("proj-1");
    assertThat(request.action()).isEqualTo(Action.EXPORT);
    assertThat(request.severity()).isEqualTo(Severity.WARNING);
    assertThat(request.newState()).containsEntry("export_format", "csv");
  }

  @Test
  void changeScopeCapturesOnceOnCloseEvenWhenTheBodyThrows() {
    when(captureService.capture(any())).thenReturn("evt-7");

    assertThatThrownBy(
            () -> {
              try (AuditedChange change =
                  recorder.openChange(
                      CONTEXT,
                      EventCategory.CONFIG,
                      EventTypes.Config.PROJECT_UPDATED,
                      "project",
                      "proj-1",
                      Action.UPDATE)) {
                change.before(Map.of("name", "old"));
                change.after(Map.of("name", "new"));
                throw new IllegalStateException("update failed");
              }
            })
        .isInstanceOf(IllegalStateException.class);

    verify(captureService, times(1)).capture(requestCaptor.capture());
    final CaptureRequest request = requestCaptor.getValue();
    assertThat(request.previousState()).containsEntry("name", "old");
    assertThat(request.newState()).containsEntry("name", "new");
  }

  @Test
  void changeScopeRejectsInvalidTypeBeforeTheOperationRuns() {
    assertThatThrownBy(
            () ->
                recorder.openChange(
                    CONTEXT,
                    EventCategory.CONFIG,
                    EventTypes.Auth.USER_LOGIN,
                    "project",
                    "proj-1",
                    Action.UPDATE))
        .isInstanceOf(IllegalArgumentException.class);
    verify(captureService, never()).capture(any());
  }

  @Test
  void closingTwiceCapturesOnce() {
    when(captureService.capture(any())).thenReturn("evt-8");
    final AuditedChange change =
        recorder.openChange(
            CONTEXT,
            EventCategory.CONFIG,
            EventTypes.Config.PROJECT_UPDATED,
            "project",
            "proj-1",
            Action.UPDATE);

    assertThat(change.eventId()).isNull();
    change.close();
    change.close();

    assertThat(change.eventId()).isEqualTo("evt-8");
    verify(captureService, times(1)).capture(any());
  }
}
