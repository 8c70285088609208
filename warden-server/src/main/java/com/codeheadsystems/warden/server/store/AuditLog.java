package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.AuditEvent;
import java.util.List;

/**
 * Append-only audit trail. Events are never mutated or deleted.
 * <p>
 * Implementations must be thread-safe. A failed append surfaces as
 * {@link com.codeheadsystems.warden.server.exception.StoreFailureException}; it is never
 * silently dropped.
 */
public interface AuditLog {

  /**
   * Appends an event.
   *
   * @param event the event
   */
  void append(AuditEvent event);

  /**
   * Reads back the events for a principal, oldest first.
   *
   * @param principalId principal identity
   * @return the events in insertion order
   */
  List<AuditEvent> eventsFor(String principalId);
}
