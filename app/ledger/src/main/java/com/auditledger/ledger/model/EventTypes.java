package com.auditledger.ledger.model;

public final class EventTypes {
  private EventTypes() {}

  public static final class Auth {
    public static final String USER_LOGIN = "user.login";
    public static final String USER_LOGOUT = "user.logout";
    public static final String USER_LOGIN_FAILED = "user.login_failed";
    public static final String API_KEY_CREATED = "api_key.created";
    public static final String API_KEY_REVOKED = "api_key.revoked";
    public static final String SSO_INITIATED = "sso.initiated";
    public static final String SSO_COMPLETED = "sso.completed";
    public static final String SSO_FAILED = "sso.failed";
    public static final String TOKEN_REFRESHED = "token.refreshed";
    public static final String PASSWORD_CHANGED = "password.changed";
    public static final String PASSWORD_RESET = "password.reset";

    private Auth() {}
  }

  public static final class Data {
    public static final String TRACE_CREATED = "trace.created";
    public static final String TRACE_VIEWED = "trace.viewed";
    public static final String TRACE_EXPORTED = "trace.exported";
    public static final String TRACE_DELETED = "trace.deleted";
    public static final String TRACE_SHARED = "trace.shared";
    public static final String EVALUATION_CREATED = "evaluation.created";
    public static final String EVALUATION_VIEWED = "evaluation.viewed";
    public static final String EVALUATION_DELETED = "evaluation.deleted";
    public static final String DATASET_CREATED = "dataset.created";
    public static final String DATASET_UPDATED = "dataset.updated";
    public static final String DATASET_DELETED = "dataset.deleted";

    private Data() {}
  }

  public static final class Config {
    public static final String PROJECT_CREATED = "project.created";
    public static final String PROJECT_UPDATED = "project.updated";
    public static final String PROJECT_DELETED = "project.deleted";
    public static final String RETENTION_POLICY_UPDATED = "retention_policy.updated";
    public static final String EVALUATOR_CREATED = "evaluator.created";
    public static final String EVALUATOR_UPDATED = "evaluator.updated";
    public static final String EVALUATOR_DELETED = "evaluator.deleted";
    public static final String TEST_SUITE_CREATED = "test_suite.created";
    public static final String TEST_SUITE_UPDATED = "test_suite.updated";
    public static final String TEST_SUITE_DELETED = "test_suite.deleted";
    public static final String ALERT_RULE_CREATED = "alert_rule.created";
    public static final String ALERT_RULE_UPDATED = "alert_rule.updated";
    public static final String ALERT_RULE_DELETED = "alert_rule.deleted";

    private Config() {}
  }

  public static final class Admin {
    public static final String USER_INVITED = "user.invited";
    public static final String USER_ROLE_CHANGED = "user.role_changed";
    public static final String USER_REMOVED = "user.removed";
    public static final String USER_SUSPENDED = "user.suspended";
    public static final String USER_REACTIVATED = "user.reactivated";
    public static final String ORGANIZATION_SETTINGS_UPDATED = "organization.settings_updated";
    public static final String BILLING_PLAN_CHANGED = "billing.plan_changed";
    public static final String COMPLIANCE_EXPORT_REQUESTED = "compliance.export_requested";
    public static final String AUDIT_LOG_VIEWED = "audit_log.viewed";
    public static final String AUDIT_LOG_EXPORTED = "audit_log.exported";

    private Admin() {}
  }

  public static final class Eval {
    public static final String EVALUATION_STARTED = "evaluation.started";
    public static final String EVALUATION_COMPLETED = "evaluation.completed";
    public static final String EVALUATION_FAILED = "evaluation.failed";
    public static final String BASELINE_UPDATED = "baseline.updated";
    public static final String BENCHMARK_STARTED = "benchmark.started";
    public static final String BENCHMARK_COMPLETED = "benchmark.completed";

    private Eval() {}
  }
}
