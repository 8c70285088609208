package com.codeheadsystems.warden.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.warden.server.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySessionStoreTest {

  private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");

  private MutableClock clock;
  private InMemorySessionStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemorySessionStore(clock);
  }

  @Test
  void storeAndLoad_roundTrip() {
    SessionData data = new SessionData("demo", "10.0.0.1", START, START.plusSeconds(3600));
    store.store("jti-1", data);

    Optional<SessionData> loaded = store.load("jti-1");
    assertThat(loaded).isPresent().contains(data);
  }

  @Test
  void load_notFound_returnsEmpty() {
    assertThat(store.load("nonexistent")).isEmpty();
  }

  @Test
  void load_expired_returnsEmptyAndEvicts() {
    store.store("jti-expired", new SessionData("demo", "10.0.0.1", START, START.plusSeconds(60)));
    clock.advance(Duration.ofSeconds(60));

    assertThat(store.load("jti-expired")).isEmpty();
    assertThat(store.revoke("jti-expired")).isEmpty();
  }

  @Test
  void revoke_removesSessionAndReturnsIt() {
    SessionData data = new SessionData("demo", "10.0.0.1", START, START.plusSeconds(3600));
    store.store("jti-revoke", data);

    assertThat(store.revoke("jti-revoke")).contains(data);
    assertThat(store.load("jti-revoke")).isEmpty();
  }

  @Test
  void revoke_unknown_returnsEmpty() {
    assertThat(store.revoke("nonexistent")).isEmpty();
  }
}
