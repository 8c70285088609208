package com.codeheadsystems.warden.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codeheadsystems.warden.server.auth.SessionManager;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WardenAuthenticatorTest {

  @Mock private SessionManager sessionManager;

  @Test
  void authenticate_liveSession_returnsPrincipal() throws Exception {
    when(sessionManager.verify("token"))
        .thenReturn(Optional.of(new SessionManager.VerifyResult("demo", "jti-1")));

    Optional<WardenPrincipal> principal = new WardenAuthenticator(sessionManager).authenticate("token");

    assertThat(principal).contains(new WardenPrincipal("demo", "jti-1"));
    assertThat(principal.get().getName()).isEqualTo("demo");
  }

  @Test
  void authenticate_unknownToken_returnsEmpty() throws Exception {
    when(sessionManager.verify("token")).thenReturn(Optional.empty());

    assertThat(new WardenAuthenticator(sessionManager).authenticate("token")).isEmpty();
  }
}
