package com.codeheadsystems.warden.server.exception;

/**
 * The supplied secret did not verify. Maps to HTTP 401.
 */
public class InvalidCredentialsException extends SecurityException {

  public InvalidCredentialsException(String message) {
    super(message);
  }
}
