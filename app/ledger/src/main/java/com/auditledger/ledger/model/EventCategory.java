package com.auditledger.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Set;

public enum EventCategory {
  AUTH(
      "auth",
      Set.of(
          EventTypes.Auth.USER_LOGIN,
          EventTypes.Auth.USER_LOGOUT,
          EventTypes.Auth.USER_LOGIN_FAILED,
          EventTypes.Auth.API_KEY_CREATED,
          EventTypes.Auth.API_KEY_REVOKED,
          EventTypes.Auth.SSO_INITIATED,
          EventTypes.Auth.SSO_COMPLETED,
          EventTypes.Auth.SSO_FAILED,
          EventTypes.Auth.TOKEN_REFRESHED,
          EventTypes.Auth.PASSWORD_CHANGED,
          EventTypes.Auth.PASSWORD_RESET)),
  DATA(
      "data",
      Set.of(
          EventTypes.Data.TRACE_CREATED,
          EventTypes.Data.TRACE_VIEWED,
          EventTypes.Data.TRACE_EXPORTED,
          EventTypes.Data.TRACE_DELETED,
          EventTypes.Data.TRACE_SHARED,
          EventTypes.Data.EVALUATION_CREATED,
          EventTypes.Data.EVALUATION_VIEWED,
          EventTypes.Data.EVALUATION_DELETED,
          EventTypes.Data.DATASET_CREATED,
          EventTypes.Data.DATASET_UPDATED,
          EventTypes.Data.DATASET_DELETED)),
  CONFIG(
      "config",
      Set.of(
          EventTypes.Config.PROJECT_CREATED,
          EventTypes.Config.PROJECT_UPDATED,
          EventTypes.Config.PROJECT_DELETED,
          EventTypes.Config.RETENTION_POLICY_UPDATED,
          EventTypes.Config.EVALUATOR_CREATED,
          EventTypes.Config.EVALUATOR_UPDATED,
          EventTypes.Config.EVALUATOR_DELETED,
          EventTypes.Config.TEST_SUITE_CREATED,
          EventTypes.Config.TEST_SUITE_UPDATED,
          EventTypes.Config.TEST_SUITE_DELETED,
          EventTypes.Config.ALERT_RULE_CREATED,
          EventTypes.Config.ALERT_RULE_UPDATED,
          EventTypes.Config.ALERT_RULE_DELETED)),
  ADMIN(
      "admin",
      Set.of(
          EventTypes.Admin.USER_INVITED,
          EventTypes.Admin.USER_ROLE_CHANGED,
          EventTypes.Admin.USER_REMOVED,
          EventTypes.Admin.USER_SUSPENDED,
          EventTypes.Admin.USER_REACTIVATED,
          EventTypes.Admin.ORGANIZATION_SETTINGS_UPDATED,
          EventTypes.Admin.BILLING_PLAN_CHANGED,
          EventTypes.Admin.COMPLIANCE_EXPORT_REQUESTED,
          EventTypes.Admin.AUDIT_LOG_VIEWED,
          EventTypes.Admin.AUDIT_LOG_EXPORTED)),
  EVAL(
      "eval",
      Set.of(
          EventTypes.Eval.EVALUATION_STARTED,
          EventTypes.Eval.EVALUATION_COMPLETED,
          EventTypes.Eval.EVALUATION_FAILED,
          EventTypes.Eval.BASELINE_UPDATED,
          EventTypes.Eval.BENCHMARK_STARTED,
          EventTypes.Eval.BENCHMARK_COMPLETED));

  private final String tag;
  private final Set<String> registeredTypes;

  EventCategory(String tag, Set<String> registeredTypes) {
    this.tag = tag;
    this.registeredTypes = registeredTypes;
  }

  @JsonValue
  public String tag() {
    return tag;
  }

  public Set<String> registeredTypes() {
    return registeredTypes;
  }

  public boolean isRegistered(String eventType) {
    return registeredTypes.contains(eventType);
  }

  /**
   * Rejects an event type that is not registered for this category.
   *
   * @param allowCustom when true any non-blank type is accepted
   */
  public void requireRegistered(String eventType, boolean allowCustom) {
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("eventType is required");
    }
    if (!allowCustom && !isRegistered(eventType)) {
      throw new IllegalArgumentException(
          "event type " + eventType + " is not registered for category " + tag
              + "; set customEventType to record it anyway");
    }
  }

  @JsonCreator
  public static EventCategory fromTag(String tag) {
    for (EventCategory value : values()) {
      if (value.tag.equals(tag)) {
        return value;
      }
    }
    throw new IllegalArgumentException("unknown event category: " + tag);
  }
}
