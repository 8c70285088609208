package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.CredentialKind;
import com.codeheadsystems.warden.server.model.CredentialRecord;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage abstraction for hashed credentials, one row per principal and credential kind.
 * <p>
 * Implementations must be thread-safe. Failures surface as
 * {@link com.codeheadsystems.warden.server.exception.StoreFailureException}.
 */
public interface CredentialStore {

  /**
   * Stores or replaces a credential row.
   *
   * @param record the credential
   */
  void store(CredentialRecord record);

  /**
   * Loads the credential of the given kind for a principal.
   *
   * @param principalId principal identity
   * @param kind        credential kind
   * @return the stored credential, or empty if none exists
   */
  Optional<CredentialRecord> load(String principalId, CredentialKind kind);

  /**
   * Overwrites the hash of an existing credential row.
   *
   * @param principalId principal identity
   * @param kind        credential kind
   * @param secretHash  the new encoded hash
   * @param updatedAt   the write time
   * @return true if a row was updated, false if the principal has no row of that kind
   */
  boolean update(String principalId, CredentialKind kind, String secretHash, Instant updatedAt);
}
