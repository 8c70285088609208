package com.codeheadsystems.warden.model.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the single-endpoint form of the API, where the operation is named by an
 * {@code action} field and the remaining fields depend on that action.
 * <p>
 * Recognised actions are {@code login}, {@code logout} and {@code change_password}. Any other
 * value, including a missing one, is rejected with HTTP 400.
 * <p>
 * Used by: {@code POST /credentials/actions}
 *
 * @param action        the operation to perform
 * @param identity      principal identity, for {@code login}
 * @param secret        login secret, for {@code login}
 * @param oldSecret     current login secret, for {@code change_password}
 * @param newSecret     new password, for {@code change_password}
 * @param confirmSecret repeated new password, for {@code change_password}
 */
public record ActionRequest(
    @JsonProperty("action") String action,
    @JsonProperty("username") String identity,
    @JsonProperty("pin") String secret,
    @JsonProperty("oldPin") String oldSecret,
    @JsonProperty("newPassword") String newSecret,
    @JsonProperty("confirmPassword") String confirmSecret) {

  /**
   * Builds an action request for {@code login}.
   *
   * @param identity the identity
   * @param secret   the login secret
   * @return the action request
   */
  public static ActionRequest login(String identity, String secret) {
    return new ActionRequest("login", identity, secret, null, null, null);
  }

  /**
   * Builds an action request for {@code logout}.
   *
   * @return the action request
   */
  public static ActionRequest logout() {
    return new ActionRequest("logout", null, null, null, null, null);
  }

  /**
   * Builds an action request for {@code change_password}.
   *
   * @param oldSecret     the current login secret
   * @param newSecret     the new password
   * @param confirmSecret the repeated new password
   * @return the action request
   */
  public static ActionRequest changePassword(String oldSecret, String newSecret, String confirmSecret) {
    return new ActionRequest("change_password", null, null, oldSecret, newSecret, confirmSecret);
  }

  /**
   * Login view of this request.
   *
   * @return the login request
   */
  public LoginRequest loginRequest() {
    return new LoginRequest(identity, secret);
  }

  /**
   * Change-password view of this request.
   *
   * @return the change secret request
   */
  public ChangeSecretRequest changeSecretRequest() {
    return new ChangeSecretRequest(oldSecret, newSecret, confirmSecret);
  }

  @Override
  public String toString() {
    return "ActionRequest[action=" + action + ", identity=" + identity + "]";
  }
}
