package com.codeheadsystems.warden.model.credential;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful credential operation.
 * <p>
 * Failures are not represented here: they are reported through the HTTP status code
 * (400 validation, 401 unauthenticated or wrong secret, 429 throttled, 503 store failure).
 *
 * @param success always {@code true} for a 2xx response
 * @param message human readable outcome
 * @param token   bearer session token, present only after a login
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message,
    @JsonProperty("token") String token) {

  /**
   * Successful outcome without a token.
   *
   * @param message the message
   * @return the response
   */
  public static ActionResponse ok(String message) {
    return new ActionResponse(true, message, null);
  }

  /**
   * Successful login carrying the new session token.
   *
   * @param token the bearer token
   * @return the response
   */
  public static ActionResponse loggedIn(String token) {
    return new ActionResponse(true, "Logged in", token);
  }
}
