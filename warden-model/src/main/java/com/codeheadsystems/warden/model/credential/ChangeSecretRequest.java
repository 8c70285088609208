package com.codeheadsystems.warden.model.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for rotating a principal's password.
 * <p>
 * The request must be made with a live bearer session. The caller re-proves possession of
 * the login secret ({@code oldPin}) and submits the new password twice. The server checks,
 * in a fixed order: throttle, field presence, confirmation match, password policy and
 * finally the old secret. The first failing check decides the response.
 * <p>
 * Used by: {@code POST /credentials/password}
 *
 * @param oldSecret     the current login secret
 * @param newSecret     the new password
 * @param confirmSecret the new password, repeated
 */
public record ChangeSecretRequest(
    @JsonProperty("oldPin") String oldSecret,
    @JsonProperty("newPassword") String newSecret,
    @JsonProperty("confirmPassword") String confirmSecret) {

  @Override
  public String toString() {
    return "ChangeSecretRequest[***]";
  }
}
