package com.codeheadsystems.warden.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.warden.server.MutableClock;
import com.codeheadsystems.warden.server.auth.SessionManager.Session;
import com.codeheadsystems.warden.server.auth.SessionManager.VerifyResult;
import com.codeheadsystems.warden.server.store.InMemorySessionStore;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionManagerTest {

  private static final byte[] SECRET =
      "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);
  private static final byte[] WRONG_SECRET =
      "wrong-secret-must-be-at-least-32-bytes".getBytes(StandardCharsets.UTF_8);

  private InMemorySessionStore sessionStore;
  private SessionManager sessionManager;

  @BeforeEach
  void setUp() {
    sessionStore = new InMemorySessionStore();
    sessionManager = new SessionManager(SECRET, "test-issuer", 3600, sessionStore);
  }

  @Test
  void startAndVerify_roundTrip() {
    Session session = sessionManager.start("demo", "10.0.0.1", null);

    Optional<VerifyResult> result = sessionManager.verify(session.token());
    assertThat(result).isPresent();
    assertThat(result.get().subject()).isEqualTo("demo");
    assertThat(result.get().jti()).isEqualTo(session.jti());
    assertThat(sessionManager.current(session.token())).contains("demo");
    assertThat(sessionStore.load(session.jti())).get()
        .satisfies(data -> assertThat(data.origin()).isEqualTo("10.0.0.1"));
  }

  @Test
  void start_revokesLivePriorToken() {
    Session prior = sessionManager.start("demo", "10.0.0.1", null);
    Session next = sessionManager.start("demo", "10.0.0.1", prior.token());

    assertThat(sessionManager.current(prior.token())).isEmpty();
    assertThat(sessionManager.current(next.token())).contains("demo");
  }

  @Test
  void start_ignoresGarbagePriorToken() {
    Session session = sessionManager.start("demo", "10.0.0.1", "not-a-jwt");
    assertThat(sessionManager.current(session.token())).contains("demo");
  }

  @Test
  void end_revokesSessionAndReturnsPrincipal() {
    Session session = sessionManager.start("demo", "10.0.0.1", null);

    assertThat(sessionManager.end(session.token())).contains("demo");
    assertThat(sessionManager.current(session.token())).isEmpty();
    assertThat(sessionManager.end(session.token())).isEmpty();
  }

  @Test
  void end_unknownOrMissingToken_isNoOp() {
    assertThat(sessionManager.end(null)).isEmpty();
    assertThat(sessionManager.end("garbage")).isEmpty();
  }

  @Test
  void verify_wrongSecret_returnsEmpty() {
    Session session = sessionManager.start("demo", "10.0.0.1", null);

    SessionManager wrongManager = new SessionManager(WRONG_SECRET, "test-issuer", 3600,
        sessionStore);
    assertThat(wrongManager.verify(session.token())).isEmpty();
  }

  @Test
  void verify_expiredToken_returnsEmpty() {
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withJWTId("expired-jti")
        .withSubject("demo")
        .withIssuedAt(Instant.now().minusSeconds(7200))
        .withExpiresAt(Instant.now().minusSeconds(3600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(sessionManager.verify(token)).isEmpty();
  }

  @Test
  void verify_validSignatureButNoSession_returnsEmpty() {
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withJWTId("forged-jti")
        .withSubject("demo")
        .withExpiresAt(Instant.now().plusSeconds(3600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(sessionManager.verify(token)).isEmpty();
  }

  @Test
  void verify_tamperedToken_returnsEmpty() {
    Session session = sessionManager.start("demo", "10.0.0.1", null);
    String token = session.token();
    String tampered = token.substring(0, token.length() - 2)
        + (token.endsWith("XX") ? "YY" : "XX");
    assertThat(sessionManager.verify(tampered)).isEmpty();
  }

  @Test
  void injectedClock_drivesIssueAndExpiry() {
    MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    SessionManager clocked = new SessionManager(SECRET, "test-issuer", 60,
        new InMemorySessionStore(clock), clock);

    Session session = clocked.start("demo", "10.0.0.1", null);

    // Long past by the system clock, live by the injected one
    assertThat(session.expiresAt()).isEqualTo(Instant.parse("2024-03-01T12:01:00Z"));
    assertThat(clocked.current(session.token())).contains("demo");

    clock.advance(Duration.ofSeconds(59));
    assertThat(clocked.current(session.token())).contains("demo");

    clock.advance(Duration.ofSeconds(1));
    assertThat(clocked.current(session.token())).isEmpty();
  }

  @Test
  void constructor_rejectsNonPositiveTtl() {
    assertThatThrownBy(() -> new SessionManager(SECRET, "test-issuer", 0, sessionStore))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void session_toStringHidesToken() {
    Session session = sessionManager.start("demo", "10.0.0.1", null);
    assertThat(session.toString()).doesNotContain(session.token());
  }
}
