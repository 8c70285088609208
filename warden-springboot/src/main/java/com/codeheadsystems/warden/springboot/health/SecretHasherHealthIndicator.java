package com.codeheadsystems.warden.springboot.health;

import com.codeheadsystems.warden.server.hash.SecretHasher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports DOWN when a hash and verify round-trip through the configured hasher fails.
 */
public class SecretHasherHealthIndicator implements HealthIndicator {

  private final SecretHasher hasher;

  public SecretHasherHealthIndicator(SecretHasher hasher) {
    this.hasher = hasher;
  }

  @Override
  public Health health() {
    long start = System.nanoTime();
    if (!hasher.selfTest()) {
      return Health.down().withDetail("reason", "Secret hasher round-trip failed").build();
    }
    return Health.up().withDetail("roundTripMillis", (System.nanoTime() - start) / 1_000_000).build();
  }
}
