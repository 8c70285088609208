package com.codeheadsystems.warden.server.model;

import java.time.Instant;

/**
 * Immutable audit record. Never mutated or deleted once appended.
 *
 * @param principalId principal the event concerns
 * @param eventName   event name, see {@link AuditEventKind#eventName()}
 * @param origin      caller network origin
 * @param userAgent   caller user agent, may be null
 * @param createdAt   when the event happened
 */
public record AuditEvent(
    String principalId,
    String eventName,
    String origin,
    String userAgent,
    Instant createdAt) {

  /**
   * Creates an event from a kind and the request it came from.
   *
   * @param principalId the principal
   * @param kind        the event kind
   * @param context     the request context
   * @param createdAt   the event time
   * @return the event
   */
  public static AuditEvent of(String principalId, AuditEventKind kind, RequestContext context,
                              Instant createdAt) {
    return new AuditEvent(principalId, kind.eventName(), context.origin(), context.userAgent(), createdAt);
  }
}
