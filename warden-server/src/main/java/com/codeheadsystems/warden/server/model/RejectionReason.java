package com.codeheadsystems.warden.server.model;

/**
 * Why a change-secret attempt was rejected. Each reason has its own audit event.
 */
public enum RejectionReason {
  MISSING_FIELDS("missing_fields", "All fields are required.",
      AuditEventKind.PASSWORD_CHANGE_FAILED_MISSING_FIELDS),
  MISMATCH("mismatch", "New password and confirmation do not match.",
      AuditEventKind.PASSWORD_CHANGE_FAILED_MISMATCH),
  TOO_SHORT("too_short", "Password must be at least %d characters.",
      AuditEventKind.PASSWORD_CHANGE_FAILED_TOO_SHORT),
  COMPLEXITY("complexity", "Password must include upper, lower and a number.",
      AuditEventKind.PASSWORD_CHANGE_FAILED_COMPLEXITY),
  PIN("pin", "Old PIN is incorrect.",
      AuditEventKind.PASSWORD_CHANGE_FAILED_PIN);

  private final String code;
  private final String message;
  private final AuditEventKind auditEventKind;

  RejectionReason(String code, String message, AuditEventKind auditEventKind) {
    this.code = code;
    this.message = message;
    this.auditEventKind = auditEventKind;
  }

  public String code() {
    return code;
  }

  public String message() {
    return message;
  }

  public AuditEventKind auditEventKind() {
    return auditEventKind;
  }
}
