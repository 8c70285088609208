package com.codeheadsystems.warden.server.auth;

import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP {@code Authorization} header values.
 */
public final class BearerTokenExtractor {

  private static final String PREFIX = "bearer";

  private BearerTokenExtractor() {
  }

  /**
   * Extracts the token from a {@code "Bearer <token>"} header value. The scheme is matched
   * case-insensitively.
   *
   * @param authorizationHeader the header value, may be null
   * @return the token, or empty if the header is missing or malformed
   */
  public static Optional<String> extract(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      return Optional.empty();
    }
    String trimmed = authorizationHeader.strip();
    if (trimmed.length() <= PREFIX.length()
        || !trimmed.regionMatches(true, 0, PREFIX, 0, PREFIX.length())
        || !Character.isWhitespace(trimmed.charAt(PREFIX.length()))) {
      return Optional.empty();
    }
    String token = trimmed.substring(PREFIX.length()).strip();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
