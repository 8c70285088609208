package com.codeheadsystems.warden.jdbc;

import com.codeheadsystems.warden.server.model.AuditEvent;
import com.codeheadsystems.warden.server.store.AuditLog;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link AuditLog} on the {@code audit_events} table. Rows are only ever inserted.
 */
public class JdbcAuditLog implements AuditLog {

  private static final String INSERT = "INSERT INTO audit_events "
      + "(principal_id, event_kind, origin, user_agent, created_at) VALUES (?, ?, ?, ?, ?)";
  private static final String SELECT = "SELECT event_kind, origin, user_agent, created_at "
      + "FROM audit_events WHERE principal_id = ? ORDER BY id";

  private final JdbcTransactor transactor;

  public JdbcAuditLog(JdbcTransactor transactor) {
    this.transactor = transactor;
  }

  @Override
  public void append(AuditEvent event) {
    transactor.execute("audit append", connection -> {
      try (PreparedStatement ps = transactor.prepare(connection, INSERT)) {
        ps.setString(1, event.principalId());
        ps.setString(2, event.eventName());
        ps.setString(3, event.origin());
        ps.setString(4, event.userAgent());
        ps.setLong(5, event.createdAt().toEpochMilli());
        return ps.executeUpdate();
      }
    });
  }

  @Override
  public List<AuditEvent> eventsFor(String principalId) {
    return transactor.execute("audit read", connection -> {
      try (PreparedStatement ps = transactor.prepare(connection, SELECT)) {
        ps.setString(1, principalId);
        List<AuditEvent> events = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            events.add(new AuditEvent(principalId, rs.getString("event_kind"), rs.getString("origin"),
                rs.getString("user_agent"), Instant.ofEpochMilli(rs.getLong("created_at"))));
          }
        }
        return events;
      }
    });
  }
}
