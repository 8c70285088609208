package com.codeheadsystems.warden.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.warden.server.auth.SessionManager;
import com.codeheadsystems.warden.server.config.RateLimitPolicy;
import com.codeheadsystems.warden.server.config.SecretPolicy;
import com.codeheadsystems.warden.server.exception.InvalidCredentialsException;
import com.codeheadsystems.warden.server.exception.RateLimitedException;
import com.codeheadsystems.warden.server.hash.Argon2SecretHasher;
import com.codeheadsystems.warden.server.manager.CredentialManager;
import com.codeheadsystems.warden.server.manager.CredentialRotationManager;
import com.codeheadsystems.warden.server.manager.PrincipalLocks;
import com.codeheadsystems.warden.server.manager.RateLimiter;
import com.codeheadsystems.warden.server.model.AuditEvent;
import com.codeheadsystems.warden.server.model.CredentialKind;
import com.codeheadsystems.warden.server.model.RequestContext;
import com.codeheadsystems.warden.server.store.InMemorySessionStore;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcCredentialRotationTest {

  private static final RequestContext CONTEXT = new RequestContext("10.0.0.1", "JUnit");

  private JdbcAuditLog auditLog;
  private JdbcFailedAttemptStore failedAttempts;
  private CredentialManager credentials;
  private CredentialRotationManager manager;

  @BeforeEach
  void setUp() {
    JdbcTransactor transactor = new JdbcTransactor(H2Databases.migrated());
    Clock clock = Clock.systemUTC();
    auditLog = new JdbcAuditLog(transactor);
    failedAttempts = new JdbcFailedAttemptStore(transactor);
    credentials = new CredentialManager(new JdbcCredentialStore(transactor),
        Argon2SecretHasher.forTesting(), clock);
    manager = new CredentialRotationManager(
        credentials,
        new RateLimiter(failedAttempts, RateLimitPolicy.DEFAULT, clock),
        auditLog,
        new SessionManager("jdbc-test-secret-at-least-32-bytes!!".getBytes(StandardCharsets.UTF_8),
            "test-issuer", 3600, new InMemorySessionStore()),
        transactor,
        SecretPolicy.DEFAULT,
        new PrincipalLocks(),
        clock);
    credentials.enroll("demo", CredentialKind.PIN, "1234");
    credentials.enroll("demo", CredentialKind.PASSWORD, "OldPass123");
  }

  @Test
  void rotation_commitsHashResetAndAuditTogether() {
    assertThatThrownBy(() -> manager.login("demo", "0000", CONTEXT, null))
        .isInstanceOf(InvalidCredentialsException.class);
    String token = manager.login("demo", "1234", CONTEXT, null).token();

    manager.changeSecret(token, "1234", "Str0ngPass", "Str0ngPass", CONTEXT);

    assertThat(credentials.verify("demo", CredentialKind.PASSWORD, "Str0ngPass")).isTrue();
    assertThat(credentials.verify("demo", CredentialKind.PIN, "1234")).isTrue();
    assertThat(failedAttempts.countByPrincipal("demo", Instant.EPOCH)).isZero();
    assertThat(auditLog.eventsFor("demo")).extracting(AuditEvent::eventName)
        .containsExactly("login_failure", "login_success", "password_changed");
  }

  @Test
  void login_isThrottledFromDurableCounts() {
    for (int i = 0; i < 5; i++) {
      assertThatThrownBy(() -> manager.login("demo", "9999", CONTEXT, null))
          .isInstanceOf(InvalidCredentialsException.class);
    }

    assertThatThrownBy(() -> manager.login("demo", "1234", CONTEXT, null))
        .isInstanceOf(RateLimitedException.class);
  }
}
