package com.codeheadsystems.warden.server.model;

/**
 * Security-relevant outcomes recorded in the audit trail.
 */
public enum AuditEventKind {
  LOGIN_SUCCESS("login_success"),
  LOGIN_FAILURE("login_failure"),
  LOGOUT("logout"),
  PASSWORD_CHANGED("password_changed"),
  PASSWORD_CHANGE_FAILED_MISSING_FIELDS("password_change_failed_missing_fields"),
  PASSWORD_CHANGE_FAILED_MISMATCH("password_change_failed_mismatch"),
  PASSWORD_CHANGE_FAILED_TOO_SHORT("password_change_failed_too_short"),
  PASSWORD_CHANGE_FAILED_COMPLEXITY("password_change_failed_complexity"),
  PASSWORD_CHANGE_FAILED_PIN("password_change_failed_pin");

  private final String eventName;

  AuditEventKind(String eventName) {
    this.eventName = eventName;
  }

  /**
   * The persisted event name.
   *
   * @return the event name
   */
  public String eventName() {
    return eventName;
  }
}
