package com.codeheadsystems.warden.model.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a login attempt.
 * <p>
 * The caller proves possession of the principal's short login secret (the PIN). On success
 * the server answers with an {@link ActionResponse} carrying a bearer session token; every
 * failed attempt counts against the sliding-window throttle for both the caller's origin and
 * the targeted identity.
 * <p>
 * Used by: {@code POST /credentials/login}
 *
 * @param identity the principal identity (the original form field is {@code username})
 * @param secret   the raw login secret; never logged or persisted by the server
 */
public record LoginRequest(
    @JsonProperty("username") String identity,
    @JsonProperty("pin") String secret) {

  @Override
  public String toString() {
    return "LoginRequest[identity=" + identity + "]";
  }
}
