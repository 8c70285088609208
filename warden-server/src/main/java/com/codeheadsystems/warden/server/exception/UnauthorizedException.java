package com.codeheadsystems.warden.server.exception;

/**
 * No live session backs the request. Maps to HTTP 401.
 */
public class UnauthorizedException extends SecurityException {

  public UnauthorizedException(String message) {
    super(message);
  }
}
