package com.codeheadsystems.warden.jdbc;

import com.codeheadsystems.warden.server.model.CredentialKind;
import com.codeheadsystems.warden.server.model.CredentialRecord;
import com.codeheadsystems.warden.server.store.CredentialStore;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link CredentialStore} on the {@code credentials} table.
 */
public class JdbcCredentialStore implements CredentialStore {

  private static final String SELECT =
      "SELECT secret_hash, updated_at FROM credentials WHERE principal_id = ? AND kind = ?";
  private static final String UPDATE =
      "UPDATE credentials SET secret_hash = ?, updated_at = ? WHERE principal_id = ? AND kind = ?";
  private static final String INSERT =
      "INSERT INTO credentials (principal_id, kind, secret_hash, updated_at) VALUES (?, ?, ?, ?)";

  private final JdbcTransactor transactor;

  public JdbcCredentialStore(JdbcTransactor transactor) {
    this.transactor = transactor;
  }

  @Override
  public void store(CredentialRecord record) {
    transactor.runInTransaction(() -> {
      if (!update(record.principalId(), record.kind(), record.secretHash(), record.updatedAt())) {
        transactor.execute("credential insert", connection -> {
          try (PreparedStatement ps = transactor.prepare(connection, INSERT)) {
            ps.setString(1, record.principalId());
            ps.setString(2, record.kind().columnValue());
            ps.setString(3, record.secretHash());
            ps.setLong(4, record.updatedAt().toEpochMilli());
            return ps.executeUpdate();
          }
        });
      }
    });
  }

  @Override
  public Optional<CredentialRecord> load(String principalId, CredentialKind kind) {
    return transactor.execute("credential load", connection -> {
      try (PreparedStatement ps = transactor.prepare(connection, SELECT)) {
        ps.setString(1, principalId);
        ps.setString(2, kind.columnValue());
        try (ResultSet rs = ps.executeQuery()) {
          if (!rs.next()) {
            return Optional.empty();
          }
          return Optional.of(new CredentialRecord(principalId, kind, rs.getString("secret_hash"),
              Instant.ofEpochMilli(rs.getLong("updated_at"))));
        }
      }
    });
  }

  @Override
  public boolean update(String principalId, CredentialKind kind, String secretHash,
                        Instant updatedAt) {
    return transactor.execute("credential update", connection -> {
      try (PreparedStatement ps = transactor.prepare(connection, UPDATE)) {
        ps.setString(1, secretHash);
        ps.setLong(2, updatedAt.toEpochMilli());
        ps.setString(3, principalId);
        ps.setString(4, kind.columnValue());
        return ps.executeUpdate() > 0;
      }
    });
  }
}
