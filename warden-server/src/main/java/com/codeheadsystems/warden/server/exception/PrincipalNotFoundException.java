package com.codeheadsystems.warden.server.exception;

/**
 * A session refers to a principal that has no credential row. Maps to HTTP 404.
 */
public class PrincipalNotFoundException extends RuntimeException {

  public PrincipalNotFoundException(String message) {
    super(message);
  }
}
