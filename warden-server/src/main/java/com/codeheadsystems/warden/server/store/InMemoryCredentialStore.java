package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.CredentialKind;
import com.codeheadsystems.warden.server.model.CredentialRecord;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All credentials are lost on server restart. Suitable for development and
 * integration testing only.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private record Key(String principalId, CredentialKind kind) {
  }

  private final ConcurrentHashMap<Key, CredentialRecord> store = new ConcurrentHashMap<>();

  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore - credentials will NOT survive restarts. "
        + "Replace with a persistent CredentialStore for production.");
  }

  @Override
  public void store(CredentialRecord record) {
    store.put(new Key(record.principalId(), record.kind()), record);
    log.debug("Stored {} credential for {}", record.kind(), record.principalId());
  }

  @Override
  public Optional<CredentialRecord> load(String principalId, CredentialKind kind) {
    return Optional.ofNullable(store.get(new Key(principalId, kind)));
  }

  @Override
  public boolean update(String principalId, CredentialKind kind, String secretHash,
                        Instant updatedAt) {
    CredentialRecord updated = store.computeIfPresent(new Key(principalId, kind),
        (key, existing) -> new CredentialRecord(principalId, kind, secretHash, updatedAt));
    return updated != null;
  }
}
