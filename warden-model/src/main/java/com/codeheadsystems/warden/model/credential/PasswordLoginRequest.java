package com.codeheadsystems.warden.model.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a login with the principal's password, the secret that rotation replaces.
 * <p>
 * Used by: {@code POST /credentials/login/password}
 *
 * @param identity the principal identity
 * @param secret   the raw password; never logged or persisted by the server
 */
public record PasswordLoginRequest(
    @JsonProperty("username") String identity,
    @JsonProperty("password") String secret) {

  @Override
  public String toString() {
    return "PasswordLoginRequest[identity=" + identity + "]";
  }
}
