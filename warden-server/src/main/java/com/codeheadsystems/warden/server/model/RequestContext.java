package com.codeheadsystems.warden.server.model;

/**
 * Caller details supplied by the HTTP layer for every request. Both values are opaque.
 * <p>
 * Origins that are missing or unparseable collapse into the {@link #UNKNOWN_ORIGIN} bucket,
 * so they are still throttled together rather than skipped.
 *
 * @param origin    caller network address
 * @param userAgent caller user agent, may be null
 */
public record RequestContext(String origin, String userAgent) {

  /**
   * Shared bucket for callers whose origin cannot be determined.
   */
  public static final String UNKNOWN_ORIGIN = "unknown";

  private static final int MAX_ORIGIN_LENGTH = 45;
  private static final int MAX_USER_AGENT_LENGTH = 255;

  public RequestContext {
    origin = normalizeOrigin(origin);
    if (userAgent != null && userAgent.length() > MAX_USER_AGENT_LENGTH) {
      userAgent = userAgent.substring(0, MAX_USER_AGENT_LENGTH);
    }
  }

  /**
   * Normalises an origin. Blank values, values longer than an IPv6 literal and values with
   * whitespace or control characters become {@link #UNKNOWN_ORIGIN}.
   *
   * @param origin the raw origin
   * @return the normalised origin
   */
  public static String normalizeOrigin(String origin) {
    if (origin == null) {
      return UNKNOWN_ORIGIN;
    }
    String trimmed = origin.strip();
    if (trimmed.isEmpty() || trimmed.length() > MAX_ORIGIN_LENGTH) {
      return UNKNOWN_ORIGIN;
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (Character.isWhitespace(c) || Character.isISOControl(c)) {
        return UNKNOWN_ORIGIN;
      }
    }
    return trimmed.toLowerCase();
  }
}
