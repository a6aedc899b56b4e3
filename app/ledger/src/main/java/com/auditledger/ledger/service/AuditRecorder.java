package com.auditledger.ledger.service;

import com.auditledger.ledger.model.Action;
import com.auditledger.ledger.model.CaptureRequest;
import com.auditledger.ledger.model.EventCategory;
import com.auditledger.ledger.model.EventTypes;
import com.auditledger.ledger.model.RequestContext;
import com.auditledger.ledger.model.Severity;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditRecorder {

  private final AuditCaptureService captureService;

  public String userLogin(RequestContext context, String userId, String email, boolean success) {
    return captureService.capture(
        CaptureRequest.from(context)
            .category(EventCategory.AUTH)
            .eventType(success ? EventTypes.Auth.USER_LOGIN : EventTypes.Auth.USER_LOGIN_FAILED)
            .resourceType("user")
            .resourceId(userId)
            .resourceName(email)
            .action(Action.READ)
            .severity(success ? Severity.INFO : Severity.WARNING)
            .build());
  }

  public String userLogout(RequestContext context, String userId, String email) {
    return captureService.capture(
        CaptureRequest.from(context)
            .category(EventCategory.AUTH)
            .eventType(EventTypes.Auth.USER_LOGOUT)
            .resourceType("user")
            .resourceId(userId)
            .resourceName(email)
            .action(Action.READ)
            .build());
  }

  public String apiKeyCreated(RequestContext context, String keyId, String keyName) {
    return captureService.capture(
        CaptureRequest.from(context)
            .category(EventCategory.AUTH)
            .eventType(EventTypes.Auth.API_KEY_CREATED)
            .resourceType("api_key")
            .resourceId(keyId)
            .resourceName(keyName)
            .action(Action.CREATE)
            .build());
  }

  public String apiKeyRevoked(RequestContext context, String keyId, String keyName) {
    return captureService.capture(
        CaptureRequest.from(context)
            .category(EventCategory.AUTH)
            .eventType(EventTypes.Auth.API_KEY_REVOKED)
            .resourceType("api_key")
            .resourceId(keyId)
            .resourceName(keyName)
            .action(Action.DELETE)
            .severity(Severity.WARNING)
            .build());
  }

  public String traceViewed(RequestContext context, String projectId, String traceId) {
    return captureService.capture(
        CaptureRequest.from(context)
            .projectId(projectId)
            .category(EventCategory.DATA)
            .eventType(EventTypes.Data.TRACE_VIEWED)
            .resourceType("trace")
            .resourceId(traceId)
            .action(Action.READ)
            .build());
  }

  /** Exports are recorded at WARNING since they move data out of the system. */
  public String traceExported(
      RequestContext context, String projectId, String traceId, String exportFormat) {
    return captureService.capture(
        CaptureRequest.from(context)
            .projectId(projectId)
            .category(EventCategory.DATA)
            .eventType(EventTypes.Data.TRACE_EXPORTED)
            .resourceType("trace")
            .resourceId(traceId)
            .action(Action.EXPORT)
            .severity(Severity.WARNING)
            .newState(Map.of("export_format", exportFormat))
            .build());
  }

  public String traceDeleted(
      RequestContext context, String projectId, String traceId, Map<String, Object> traceData) {
    return captureService.capture(
        CaptureRequest.from(context)
            .projectId(projectId)
            .category(EventCategory.DATA)
            .eventType(EventTypes.Data.TRACE_DELETED)
            .resourceType("trace")
            .resourceId(traceId)
            .action(Action.DELETE)
            .severity(Severity.WARNING)
            .previousState(traceData)
            .build());
  }

  public String projectUpdated(
      RequestContext context,
      String projectId,
      String projectName,
      Map<String, Object> before,
      Map<String, Object> after) {
    return captureService.capture(
        CaptureRequest.from(context)
            .projectId(projectId)
            .category(EventCategory.CONFIG)
            .eventType(EventTypes.Config.PROJECT_UPDATED)
            .resourceType("project")
            .resourceId(projectId)
            .resourceName(projectName)
            .action(Action.UPDATE)
            .previousState(before)
            .newState(after)
            .build());
  }

  public String userRoleChanged(
      RequestContext context, String userId, String email, String oldRole, String newRole) {
    return captureService.capture(
        CaptureRequest.from(context)
            .category(EventCategory.ADMIN)
            .eventType(EventTypes.Admin.USER_ROLE_CHANGED)
            .resourceType("user")
            .resourceId(userId)
            .resourceName(email)
            .action(Action.UPDATE)
            .severity(Severity.WARNING)
            .previousState(Map.of("role", oldRole))
            .newState(Map.of("role", newRole))
            .build());
  }

  public String evaluationCompleted(
      RequestContext context,
      String projectId,
      String evaluationId,
      String evaluatorName,
      Map<String, Object> results) {
    return captureService.capture(
        CaptureRequest.from(context)
            .projectId(projectId)
            .category(EventCategory.EVAL)
            .eventType(EventTypes.Eval.EVALUATION_COMPLETED)
            .resourceType("evaluation")
            .resourceId(evaluationId)
            .resourceName(evaluatorName)
            .action(Action.UPDATE)
            .newState(results)
            .build());
  }

  public String evaluationFailed(
      RequestContext context,
      String projectId,
      String evaluationId,
      String evaluatorName,
      String error) {
    return captureService.capture(
        CaptureRequest.from(context)
            .projectId(projectId)
            .category(EventCategory.EVAL)
            .eventType(EventTypes.Eval.EVALUATION_FAILED)
            .resourceType("evaluation")
            .resourceId(evaluationId)
            .resourceName(evaluatorName)
            .action(Action.UPDATE)
            .severity(Severity.WARNING)
            .newState(Map.of("error", error))
            .build());
  }

  /**
   * Opens a change scope. Set {@code before}/{@code after} while the operation runs; the event is
   * captured when the scope closes.
   */
  public AuditedChange openChange(
      RequestContext context,
      EventCategory category,
      String eventType,
      String resourceType,
      String resourceId,
      Action action) {
    return new AuditedChange(
        captureService,
        CaptureRequest.from(context)
            .category(category)
            .eventType(eventType)
            .resourceType(resourceType)
            .resourceId(resourceId)
            .action(action)
            .build());
  }
}
