package com.codeheadsystems.warden.server.manager;

import com.codeheadsystems.warden.server.exception.StoreFailureException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of striped locks serialising credential writes per principal. Two principals may
 * share a stripe; a principal always maps to the same one.
 */
public class PrincipalLocks {

  public static final int DEFAULT_STRIPES = 64;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private final ReentrantLock[] stripes;
  private final long timeoutMillis;

  public PrincipalLocks() {
    this(DEFAULT_STRIPES, DEFAULT_TIMEOUT);
  }

  public PrincipalLocks(int stripeCount, Duration timeout) {
    if (stripeCount < 1) {
      throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
    }
    this.stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
    this.timeoutMillis = timeout.toMillis();
  }

  /**
   * Runs work while holding the principal's lock.
   *
   * @param principalId the principal
   * @param work        the work
   * @param <T>         result type
   * @return the work's result
   * @throws StoreFailureException if the lock is not acquired within the timeout
   */
  public <T> T withLock(String principalId, Supplier<T> work) {
    ReentrantLock lock = stripes[Math.floorMod(principalId.hashCode(), stripes.length)];
    try {
      if (!lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS)) {
        throw new StoreFailureException("Timed out waiting for credential lock");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreFailureException("Interrupted waiting for credential lock", e);
    }
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }
}
