package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.AuditEvent;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AuditLog}. Suitable for development and testing only.
 */
public class InMemoryAuditLog implements AuditLog {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAuditLog.class);

  private final ConcurrentLinkedQueue<AuditEvent> events = new ConcurrentLinkedQueue<>();

  public InMemoryAuditLog() {
    log.warn("Using InMemoryAuditLog - the audit trail will NOT survive restarts.");
  }

  @Override
  public void append(AuditEvent event) {
    events.add(event);
    log.debug("Audit {} for {}", event.eventName(), event.principalId());
  }

  @Override
  public List<AuditEvent> eventsFor(String principalId) {
    return events.stream()
        .filter(e -> principalId.equals(e.principalId()))
        .collect(Collectors.toList());
  }
}
