package com.codeheadsystems.warden.server.store;

import java.util.function.Supplier;

/**
 * Runs a unit of work: the store writes for one outcome, committed together or not at all.
 * <p>
 * Transactional implementations bind the unit of work to the calling thread so that stores
 * sharing the transactor join it. Nested calls join the outer unit of work.
 */
public interface StoreTransactor {

  <T> T inTransaction(Supplier<T> work);

  default void runInTransaction(Runnable work) {
    inTransaction(() -> {
      work.run();
      return null;
    });
  }
}
