package com.codeheadsystems.warden.server.config;

import com.codeheadsystems.warden.server.model.RejectionReason;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Strength rules for a new rotating secret: a minimum length, then at least one upper-case
 * letter, one lower-case letter and one digit.
 *
 * @param minimumLength minimum number of characters
 */
public record SecretPolicy(int minimumLength) {

  public static final SecretPolicy DEFAULT = new SecretPolicy(8);

  private static final Pattern UPPER = Pattern.compile("[A-Z]");
  private static final Pattern LOWER = Pattern.compile("[a-z]");
  private static final Pattern DIGIT = Pattern.compile("\\d");

  public SecretPolicy {
    if (minimumLength < 1) {
      throw new IllegalArgumentException("minimumLength must be positive: " + minimumLength);
    }
  }

  /**
   * Checks a candidate secret. Length is checked before complexity.
   *
   * @param candidate the new secret, non-null
   * @return the first rule violated, or empty if the secret is acceptable
   */
  public Optional<RejectionReason> check(String candidate) {
    if (candidate.length() < minimumLength) {
      return Optional.of(RejectionReason.TOO_SHORT);
    }
    if (!UPPER.matcher(candidate).find()
        || !LOWER.matcher(candidate).find()
        || !DIGIT.matcher(candidate).find()) {
      return Optional.of(RejectionReason.COMPLEXITY);
    }
    return Optional.empty();
  }

  /**
   * Message shown to the caller for a rejection under this policy.
   *
   * @param reason the rejection reason
   * @return the message
   */
  public String messageFor(RejectionReason reason) {
    return reason == RejectionReason.TOO_SHORT
        ? String.format(reason.message(), minimumLength)
        : reason.message();
  }
}
