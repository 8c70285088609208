package com.codeheadsystems.warden.jdbc;

import com.codeheadsystems.warden.server.model.FailedAttempt;
import com.codeheadsystems.warden.server.store.FailedAttemptStore;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Types;
import java.time.Instant;

/**
 * {@link FailedAttemptStore} on the {@code failed_attempts} table. One row per attempt serves
 * both the origin and the principal count.
 */
public class JdbcFailedAttemptStore implements FailedAttemptStore {

  private static final String INSERT =
      "INSERT INTO failed_attempts (principal_id, origin, created_at) VALUES (?, ?, ?)";
  private static final String COUNT_BY_ORIGIN =
      "SELECT COUNT(*) FROM failed_attempts WHERE origin = ? AND created_at > ?";
  private static final String COUNT_BY_PRINCIPAL =
      "SELECT COUNT(*) FROM failed_attempts WHERE principal_id = ? AND created_at > ?";
  private static final String DELETE_BY_PRINCIPAL =
      "DELETE FROM failed_attempts WHERE principal_id = ?";
  private static final String PURGE =
      "DELETE FROM failed_attempts WHERE created_at <= ?";

  private final JdbcTransactor transactor;

  public JdbcFailedAttemptStore(JdbcTransactor transactor) {
    this.transactor = transactor;
  }

  @Override
  public void record(FailedAttempt attempt) {
    transactor.execute("failed attempt insert", connection -> {
      try (PreparedStatement ps = transactor.prepare(connection, INSERT)) {
        if (attempt.principalId() == null) {
          ps.setNull(1, Types.VARCHAR);
        } else {
          ps.setString(1, attempt.principalId());
        }
        ps.setString(2, attempt.origin());
        ps.setLong(3, attempt.createdAt().toEpochMilli());
        return ps.executeUpdate();
      }
    });
  }

  @Override
  public long countByOrigin(String origin, Instant since) {
    return count(COUNT_BY_ORIGIN, origin, since);
  }

  @Override
  public long countByPrincipal(String principalId, Instant since) {
    return count(COUNT_BY_PRINCIPAL, principalId, since);
  }

  @Override
  public int deleteByPrincipal(String principalId) {
    return transactor.execute("failed attempt reset", connection -> {
      try (PreparedStatement ps = transactor.prepare(connection, DELETE_BY_PRINCIPAL)) {
        ps.setString(1, principalId);
        return ps.executeUpdate();
      }
    });
  }

  @Override
  public int purgeOlderThan(Instant cutoff) {
    return transactor.execute("failed attempt purge", connection -> {
      try (PreparedStatement ps = transactor.prepare(connection, PURGE)) {
        ps.setLong(1, cutoff.toEpochMilli());
        return ps.executeUpdate();
      }
    });
  }

  private long count(String sql, String key, Instant since) {
    return transactor.execute("failed attempt count", connection -> {
      try (PreparedStatement ps = transactor.prepare(connection, sql)) {
        ps.setString(1, key);
        ps.setLong(2, since.toEpochMilli());
        try (ResultSet rs = ps.executeQuery()) {
          rs.next();
          return rs.getLong(1);
        }
      }
    });
  }
}
