package com.codeheadsystems.warden.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.server.model.RejectionReason;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SecretPolicyTest {

  private final SecretPolicy policy = SecretPolicy.DEFAULT;

  @Test
  void check_strongSecret_passes() {
    assertThat(policy.check("Str0ngPass")).isEmpty();
  }

  @Test
  void check_shortSecret_isTooShortBeforeComplexity() {
    assertThat(policy.check("abc")).contains(RejectionReason.TOO_SHORT);
    assertThat(policy.check("Ab1defg")).contains(RejectionReason.TOO_SHORT);
  }

  @Test
  void check_missingDigit_isComplexity() {
    assertThat(policy.check("Weakpass")).contains(RejectionReason.COMPLEXITY);
  }

  @Test
  void check_missingUpperOrLower_isComplexity() {
    assertThat(policy.check("str0ngpass")).contains(RejectionReason.COMPLEXITY);
    assertThat(policy.check("STR0NGPASS")).contains(RejectionReason.COMPLEXITY);
  }

  @Test
  void messageFor_tooShort_includesMinimumLength() {
    assertThat(policy.messageFor(RejectionReason.TOO_SHORT)).contains("8");
  }

  @Test
  void rateLimitPolicy_rejectsNonPositiveValues() {
    assertThatThrownBy(() -> new RateLimitPolicy(0, Duration.ofMinutes(1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RateLimitPolicy(5, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
