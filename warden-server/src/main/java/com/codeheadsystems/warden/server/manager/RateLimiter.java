package com.codeheadsystems.warden.server.manager;

import com.codeheadsystems.warden.server.config.RateLimitPolicy;
import com.codeheadsystems.warden.server.model.FailedAttempt;
import com.codeheadsystems.warden.server.model.RequestContext;
import com.codeheadsystems.warden.server.store.FailedAttemptStore;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window throttle over failed attempts, keyed by origin and by principal.
 * <p>
 * A caller is blocked once either its origin or the targeted principal has
 * {@link RateLimitPolicy#maxAttempts()} failures strictly newer than {@code now - window}.
 * Only failures are counted. Entries older than the window are purged at most once per window,
 * on the write path.
 */
@Singleton
public class RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

  private final FailedAttemptStore store;
  private final RateLimitPolicy policy;
  private final Clock clock;
  private final AtomicReference<Instant> nextPurge;

  @Inject
  public RateLimiter(FailedAttemptStore store, RateLimitPolicy policy, Clock clock) {
    this.store = store;
    this.policy = policy;
    this.clock = clock;
    this.nextPurge = new AtomicReference<>(clock.instant().plus(policy.window()));
  }

  /**
   * Whether the caller is currently throttled.
   *
   * @param origin      the caller origin, normalised if needed
   * @param principalId the targeted principal, may be null
   * @return true if the origin or the principal has reached the limit
   */
  public boolean isBlocked(String origin, String principalId) {
    Instant since = clock.instant().minus(policy.window());
    String bucket = RequestContext.normalizeOrigin(origin);
    if (store.countByOrigin(bucket, since) >= policy.maxAttempts()) {
      log.debug("Origin {} is throttled", bucket);
      return true;
    }
    if (principalId != null && store.countByPrincipal(principalId, since) >= policy.maxAttempts()) {
      log.debug("Principal {} is throttled", principalId);
      return true;
    }
    return false;
  }

  /**
   * Records one failure. Does not evaluate the policy.
   *
   * @param origin      the caller origin
   * @param principalId the targeted principal, may be null
   */
  public void recordFailure(String origin, String principalId) {
    Instant now = clock.instant();
    store.record(new FailedAttempt(principalId, RequestContext.normalizeOrigin(origin), now));
    purgeIfDue(now);
  }

  /**
   * Clears every failure recorded against the principal, across all origins.
   *
   * @param principalId the principal
   */
  public void reset(String principalId) {
    store.deleteByPrincipal(principalId);
  }

  private void purgeIfDue(Instant now) {
    Instant due = nextPurge.get();
    if (now.isBefore(due) || !nextPurge.compareAndSet(due, now.plus(policy.window()))) {
      return;
    }
    int purged = store.purgeOlderThan(now.minus(policy.window()));
    if (purged > 0) {
      log.debug("Purged {} expired failed attempt(s)", purged);
    }
  }
}
