package com.codeheadsystems.warden.server.store;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are lazily evicted on {@link #load}. All sessions are lost on
 * server restart. Suitable for development and integration testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, SessionData> store = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void store(String jti, SessionData sessionData) {
    store.put(jti, sessionData);
    log.debug("Stored session jti={}", jti);
  }

  @Override
  public Optional<SessionData> load(String jti) {
    SessionData data = store.get(jti);
    if (data == null) {
      return Optional.empty();
    }
    if (!data.expiresAt().isAfter(clock.instant())) {
      store.remove(jti, data);
      return Optional.empty();
    }
    return Optional.of(data);
  }

  @Override
  public Optional<SessionData> revoke(String jti) {
    SessionData data = store.remove(jti);
    log.debug("Revoked session jti={}", jti);
    return Optional.ofNullable(data)
        .filter(d -> d.expiresAt().isAfter(clock.instant()));
  }
}
