package com.codeheadsystems.warden.server.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Sliding-window throttling policy. A key is blocked once it has {@code maxAttempts} failures
 * newer than {@code now - window}.
 *
 * @param maxAttempts failures allowed inside the window
 * @param window      length of the sliding window
 */
public record RateLimitPolicy(int maxAttempts, Duration window) {

  /**
   * Five failures per fifteen minutes.
   */
  public static final RateLimitPolicy DEFAULT = new RateLimitPolicy(5, Duration.ofMinutes(15));

  public RateLimitPolicy {
    Objects.requireNonNull(window, "window");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive: " + window);
    }
  }
}
