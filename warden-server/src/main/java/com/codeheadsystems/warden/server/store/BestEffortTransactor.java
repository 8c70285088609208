package com.codeheadsystems.warden.server.store;

import java.util.function.Supplier;

/**
 * Pass-through {@link StoreTransactor} for the in-memory stores. Writes apply immediately and
 * are not rolled back if a later write in the same unit of work fails.
 */
public class BestEffortTransactor implements StoreTransactor {

  @Override
  public <T> T inTransaction(Supplier<T> work) {
    return work.get();
  }
}
