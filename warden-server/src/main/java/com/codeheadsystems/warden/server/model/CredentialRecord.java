package com.codeheadsystems.warden.server.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored credential: one hashed secret of one kind for one principal.
 *
 * @param principalId principal identity
 * @param kind        which of the principal's secrets this is
 * @param secretHash  encoded one-way hash, including the salt and algorithm parameters
 * @param updatedAt   when the hash was last written
 */
public record CredentialRecord(
    String principalId,
    CredentialKind kind,
    String secretHash,
    Instant updatedAt) {

  public CredentialRecord {
    Objects.requireNonNull(principalId, "principalId");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(secretHash, "secretHash");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }
}
