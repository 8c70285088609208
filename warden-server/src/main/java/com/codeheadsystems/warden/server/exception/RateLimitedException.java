package com.codeheadsystems.warden.server.exception;

/**
 * The caller's origin or the targeted principal has too many recent failures. Maps to HTTP 429.
 */
public class RateLimitedException extends SecurityException {

  public RateLimitedException(String message) {
    super(message);
  }
}
