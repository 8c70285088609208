package com.codeheadsystems.warden.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.warden.server.model.FailedAttempt;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.Test;

class InMemoryFailedAttemptStoreTest {

  private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

  private final InMemoryFailedAttemptStore store = new InMemoryFailedAttemptStore();

  @Test
  void counts_areKeptPerOriginAndPerPrincipal() {
    store.record(new FailedAttempt("demo", "10.0.0.1", T0));
    store.record(new FailedAttempt("demo", "10.0.0.2", T0));
    store.record(new FailedAttempt(null, "10.0.0.1", T0));

    Instant since = T0.minusSeconds(1);
    assertThat(store.countByOrigin("10.0.0.1", since)).isEqualTo(2);
    assertThat(store.countByOrigin("10.0.0.2", since)).isEqualTo(1);
    assertThat(store.countByPrincipal("demo", since)).isEqualTo(2);
    assertThat(store.countByPrincipal("other", since)).isZero();
  }

  @Test
  void counts_excludeEntriesAtOrBeforeSince() {
    store.record(new FailedAttempt("demo", "10.0.0.1", T0));
    store.record(new FailedAttempt("demo", "10.0.0.1", T0.plusSeconds(10)));

    assertThat(store.countByOrigin("10.0.0.1", T0)).isEqualTo(1);
    assertThat(store.countByPrincipal("demo", T0)).isEqualTo(1);
  }

  @Test
  void deleteByPrincipal_clearsPrincipalFromEveryBucket() {
    store.record(new FailedAttempt("demo", "10.0.0.1", T0));
    store.record(new FailedAttempt("demo", "10.0.0.2", T0));
    store.record(new FailedAttempt("other", "10.0.0.1", T0));

    assertThat(store.deleteByPrincipal("demo")).isEqualTo(2);

    Instant since = T0.minusSeconds(1);
    assertThat(store.countByPrincipal("demo", since)).isZero();
    assertThat(store.countByOrigin("10.0.0.1", since)).isEqualTo(1);
    assertThat(store.countByOrigin("10.0.0.2", since)).isZero();
    assertThat(store.countByPrincipal("other", since)).isEqualTo(1);
  }

  @Test
  void purgeOlderThan_removesOnlyExpiredEntries() {
    store.record(new FailedAttempt("demo", "10.0.0.1", T0));
    store.record(new FailedAttempt("demo", "10.0.0.1", T0.plusSeconds(100)));

    assertThat(store.purgeOlderThan(T0.plusSeconds(50))).isEqualTo(1);
    assertThat(store.countByOrigin("10.0.0.1", Instant.EPOCH)).isEqualTo(1);
    assertThat(store.countByPrincipal("demo", Instant.EPOCH)).isEqualTo(1);
  }

  @Test
  void record_concurrentWritersLoseNothing() throws InterruptedException {
    int threads = 8;
    int perThread = 250;
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> workers = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      Thread worker = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int j = 0; j < perThread; j++) {
          store.record(new FailedAttempt("demo", "10.0.0.1", T0));
        }
      });
      worker.start();
      workers.add(worker);
    }
    start.countDown();
    for (Thread worker : workers) {
      worker.join();
    }

    assertThat(store.countByOrigin("10.0.0.1", Instant.EPOCH)).isEqualTo((long) threads * perThread);
    assertThat(store.countByPrincipal("demo", Instant.EPOCH)).isEqualTo((long) threads * perThread);
  }
}
