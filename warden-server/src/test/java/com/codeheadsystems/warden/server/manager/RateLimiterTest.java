package com.codeheadsystems.warden.server.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.warden.server.MutableClock;
import com.codeheadsystems.warden.server.config.RateLimitPolicy;
import com.codeheadsystems.warden.server.store.InMemoryFailedAttemptStore;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RateLimiterTest {

  private static final String ORIGIN = "10.0.0.1";

  private MutableClock clock;
  private InMemoryFailedAttemptStore store;
  private RateLimiter rateLimiter;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    store = new InMemoryFailedAttemptStore();
    rateLimiter = new RateLimiter(store, RateLimitPolicy.DEFAULT, clock);
  }

  @Test
  void blocksOnceOriginReachesLimit() {
    for (int i = 0; i < 4; i++) {
      rateLimiter.recordFailure(ORIGIN, "user" + i);
    }
    assertThat(rateLimiter.isBlocked(ORIGIN, "someone")).isFalse();

    rateLimiter.recordFailure(ORIGIN, "user4");
    assertThat(rateLimiter.isBlocked(ORIGIN, "someone")).isTrue();
    assertThat(rateLimiter.isBlocked("10.0.0.2", "someone")).isFalse();
  }

  @Test
  void blocksOncePrincipalReachesLimitAcrossOrigins() {
    for (int i = 0; i < 5; i++) {
      rateLimiter.recordFailure("10.0.0." + i, "demo");
    }
    assertThat(rateLimiter.isBlocked("10.9.9.9", "demo")).isTrue();
    assertThat(rateLimiter.isBlocked("10.9.9.9", "other")).isFalse();
    assertThat(rateLimiter.isBlocked("10.9.9.9", null)).isFalse();
  }

  @Test
  void windowSlides() {
    for (int i = 0; i < 5; i++) {
      rateLimiter.recordFailure(ORIGIN, "demo");
    }
    clock.advance(Duration.ofMinutes(15).minusSeconds(1));
    assertThat(rateLimiter.isBlocked(ORIGIN, "demo")).isTrue();

    clock.advance(Duration.ofSeconds(1));
    assertThat(rateLimiter.isBlocked(ORIGIN, "demo")).isFalse();
  }

  @Test
  void unknownOrigins_shareOneBucket() {
    rateLimiter.recordFailure(null, null);
    rateLimiter.recordFailure("", null);
    rateLimiter.recordFailure("   ", null);
    rateLimiter.recordFailure("not an address", null);
    rateLimiter.recordFailure(null, null);

    assertThat(rateLimiter.isBlocked(null, null)).isTrue();
    assertThat(rateLimiter.isBlocked("unknown", null)).isTrue();
  }

  @Test
  void reset_clearsPrincipalFailures() {
    for (int i = 0; i < 5; i++) {
      rateLimiter.recordFailure(ORIGIN, "demo");
    }
    rateLimiter.reset("demo");

    assertThat(rateLimiter.isBlocked(ORIGIN, "demo")).isFalse();
  }

  @Test
  void recordFailure_purgesExpiredEntriesLazily() {
    rateLimiter.recordFailure(ORIGIN, "demo");
    clock.advance(Duration.ofMinutes(16));

    rateLimiter.recordFailure("10.0.0.2", "other");

    assertThat(store.countByOrigin(ORIGIN, Instant.EPOCH)).isZero();
    assertThat(store.countByPrincipal("demo", Instant.EPOCH)).isZero();
    assertThat(store.countByOrigin("10.0.0.2", Instant.EPOCH)).isEqualTo(1);
  }
}
