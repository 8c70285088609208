package com.codeheadsystems.warden.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.warden.server.hash.SecretHasher;

/**
 * Health check that runs a hash and verify round-trip through the configured hasher.
 */
public class SecretHasherHealthCheck extends HealthCheck {

  private final SecretHasher hasher;

  public SecretHasherHealthCheck(SecretHasher hasher) {
    this.hasher = hasher;
  }

  @Override
  protected Result check() {
    long start = System.nanoTime();
    if (!hasher.selfTest()) {
      return Result.unhealthy("Secret hasher round-trip failed");
    }
    return Result.healthy("round-trip took %d ms", (System.nanoTime() - start) / 1_000_000);
  }
}
