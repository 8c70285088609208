package com.codeheadsystems.warden.server.manager;

import com.codeheadsystems.warden.server.exception.PrincipalNotFoundException;
import com.codeheadsystems.warden.server.hash.SecretHasher;
import com.codeheadsystems.warden.server.model.CredentialKind;
import com.codeheadsystems.warden.server.model.CredentialRecord;
import com.codeheadsystems.warden.server.store.CredentialStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hashing and verification on top of a {@link CredentialStore}.
 * <p>
 * Verification of an unknown principal runs the same hash work against a dummy hash, so the
 * response time does not reveal whether the principal exists.
 */
@Singleton
public class CredentialManager {

  private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

  private final CredentialStore credentialStore;
  private final SecretHasher hasher;
  private final Clock clock;
  private final String dummyHash;

  @Inject
  public CredentialManager(CredentialStore credentialStore, SecretHasher hasher, Clock clock) {
    this.credentialStore = credentialStore;
    this.hasher = hasher;
    this.clock = clock;
    this.dummyHash = hasher.hash(UUID.randomUUID().toString());
  }

  /**
   * Checks a candidate secret against the stored credential. Never throws on a wrong secret.
   *
   * @param principalId principal identity
   * @param kind        credential kind
   * @param candidate   the raw candidate secret
   * @return true only if the principal has a credential of that kind and the candidate matches
   */
  public boolean verify(String principalId, CredentialKind kind, String candidate) {
    Optional<CredentialRecord> record = credentialStore.load(principalId, kind);
    if (record.isEmpty()) {
      hasher.verify(candidate, dummyHash);
      log.debug("No {} credential for {}", kind, principalId);
      return false;
    }
    return hasher.verify(candidate, record.get().secretHash());
  }

  /**
   * Whether the principal has a credential of the given kind.
   *
   * @param principalId principal identity
   * @param kind        credential kind
   * @return true if a row exists
   */
  public boolean exists(String principalId, CredentialKind kind) {
    return credentialStore.load(principalId, kind).isPresent();
  }

  /**
   * Hashes a new secret and overwrites the existing credential.
   *
   * @param principalId principal identity
   * @param kind        credential kind
   * @param newSecret   the raw new secret
   * @return the write time
   * @throws PrincipalNotFoundException if the principal has no credential of that kind
   */
  public Instant replace(String principalId, CredentialKind kind, String newSecret) {
    String encoded = hasher.hash(newSecret);
    Instant now = clock.instant();
    if (!credentialStore.update(principalId, kind, encoded, now)) {
      throw new PrincipalNotFoundException("User not found.");
    }
    log.info("Replaced {} credential for {}", kind, principalId);
    return now;
  }

  /**
   * Creates or overwrites a credential. Used for seeding principals.
   *
   * @param principalId principal identity
   * @param kind        credential kind
   * @param secret      the raw secret
   */
  public void enroll(String principalId, CredentialKind kind, String secret) {
    credentialStore.store(new CredentialRecord(principalId, kind, hasher.hash(secret), clock.instant()));
    log.info("Enrolled {} credential for {}", kind, principalId);
  }
}
