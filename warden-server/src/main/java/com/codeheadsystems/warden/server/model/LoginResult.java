package com.codeheadsystems.warden.server.model;

import java.time.Instant;

/**
 * Outcome of a successful login.
 *
 * @param token       bearer session token
 * @param principalId the authenticated principal
 * @param expiresAt   when the session expires unless ended earlier
 */
public record LoginResult(String token, String principalId, Instant expiresAt) {

  @Override
  public String toString() {
    return "LoginResult[principalId=" + principalId + ", expiresAt=" + expiresAt + "]";
  }
}
