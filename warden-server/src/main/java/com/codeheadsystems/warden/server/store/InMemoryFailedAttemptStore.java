package com.codeheadsystems.warden.server.store;

import com.codeheadsystems.warden.server.model.FailedAttempt;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link FailedAttemptStore}.
 * <p>
 * Attempts are kept in one deque per origin and one per principal. Each deque is only read or
 * mutated inside {@link ConcurrentHashMap#compute}, so every key is updated atomically.
 */
public class InMemoryFailedAttemptStore implements FailedAttemptStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryFailedAttemptStore.class);

  private final ConcurrentHashMap<String, Deque<FailedAttempt>> byOrigin = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Deque<FailedAttempt>> byPrincipal = new ConcurrentHashMap<>();

  public InMemoryFailedAttemptStore() {
    log.warn("Using InMemoryFailedAttemptStore - throttling state will NOT survive restarts.");
  }

  @Override
  public void record(FailedAttempt attempt) {
    byOrigin.compute(attempt.origin(), (k, deque) -> append(deque, attempt));
    if (attempt.principalId() != null) {
      byPrincipal.compute(attempt.principalId(), (k, deque) -> append(deque, attempt));
    }
  }

  @Override
  public long countByOrigin(String origin, Instant since) {
    return count(byOrigin, origin, since);
  }

  @Override
  public long countByPrincipal(String principalId, Instant since) {
    return count(byPrincipal, principalId, since);
  }

  @Override
  public int deleteByPrincipal(String principalId) {
    Deque<FailedAttempt> removed = byPrincipal.remove(principalId);
    for (String origin : byOrigin.keySet()) {
      byOrigin.computeIfPresent(origin, (k, deque) -> {
        deque.removeIf(a -> Objects.equals(principalId, a.principalId()));
        return deque.isEmpty() ? null : deque;
      });
    }
    int count = removed == null ? 0 : removed.size();
    log.debug("Cleared {} failed attempt(s) for {}", count, principalId);
    return count;
  }

  @Override
  public int purgeOlderThan(Instant cutoff) {
    AtomicInteger purged = new AtomicInteger();
    purge(byOrigin, cutoff, purged);
    purge(byPrincipal, cutoff, new AtomicInteger());
    return purged.get();
  }

  private static Deque<FailedAttempt> append(Deque<FailedAttempt> deque, FailedAttempt attempt) {
    Deque<FailedAttempt> result = deque == null ? new ArrayDeque<>() : deque;
    result.addLast(attempt);
    return result;
  }

  private static long count(ConcurrentHashMap<String, Deque<FailedAttempt>> map, String key,
                            Instant since) {
    long[] count = new long[1];
    map.computeIfPresent(key, (k, deque) -> {
      count[0] = deque.stream().filter(a -> a.createdAt().isAfter(since)).count();
      return deque;
    });
    return count[0];
  }

  private static void purge(ConcurrentHashMap<String, Deque<FailedAttempt>> map, Instant cutoff,
                            AtomicInteger purged) {
    for (String key : map.keySet()) {
      map.computeIfPresent(key, (k, deque) -> {
        int before = deque.size();
        deque.removeIf(a -> !a.createdAt().isAfter(cutoff));
        purged.addAndGet(before - deque.size());
        return deque.isEmpty() ? null : deque;
      });
    }
  }
}
