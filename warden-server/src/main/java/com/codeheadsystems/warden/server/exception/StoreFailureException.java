package com.codeheadsystems.warden.server.exception;

/**
 * A durable store was unavailable, timed out, or failed mid-write. Maps to HTTP 503.
 */
public class StoreFailureException extends IllegalStateException {

  public StoreFailureException(String message) {
    super(message);
  }

  public StoreFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
