package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.FailedAttempt;
import java.time.Instant;

/**
 * Storage for failed verification attempts, counted by origin and by principal.
 * <p>
 * Implementations must be thread-safe and must make each {@link #record} atomic per key.
 * Counts include only entries strictly newer than {@code since}.
 */
public interface FailedAttemptStore {

  void record(FailedAttempt attempt);

  long countByOrigin(String origin, Instant since);

  long countByPrincipal(String principalId, Instant since);

  /**
   * Deletes every attempt that targeted the principal, whatever its origin.
   *
   * @param principalId principal identity
   * @return the number of attempts removed
   */
  int deleteByPrincipal(String principalId);

  /**
   * Deletes attempts at or before the cutoff.
   *
   * @param cutoff the cutoff
   * @return the number of attempts removed
   */
  int purgeOlderThan(Instant cutoff);
}
