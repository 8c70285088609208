package com.codeheadsystems.warden.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.warden.server.store.SessionData;
import com.codeheadsystems.warden.server.store.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds session tokens to principals.
 * <p>
 * Tokens are JWTs signed with HMAC-SHA256. Each token's JTI is stored in a {@link SessionStore}
 * so that sessions can be ended before expiry. A token whose JTI is not in the store is
 * rejected even if its signature and expiry are valid.
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final SessionStore sessionStore;
  private final String issuer;
  private final long ttlSeconds;
  private final Clock clock;

  /**
   * Creates a new SessionManager on the system UTC clock.
   *
   * @param secret       HMAC-SHA256 signing secret
   * @param issuer       JWT issuer claim
   * @param ttlSeconds   session time-to-live in seconds
   * @param sessionStore backing store for session data and revocation
   */
  public SessionManager(byte[] secret, String issuer, long ttlSeconds, SessionStore sessionStore) {
    this(secret, issuer, ttlSeconds, sessionStore, Clock.systemUTC());
  }

  /**
   * Creates a new SessionManager. Token timestamps and expiry checks both read {@code clock};
   * give the session store the same clock.
   *
   * @param secret       HMAC-SHA256 signing secret
   * @param issuer       JWT issuer claim
   * @param ttlSeconds   session time-to-live in seconds
   * @param sessionStore backing store for session data and revocation
   * @param clock        time source
   */
  public SessionManager(byte[] secret, String issuer, long ttlSeconds, SessionStore sessionStore,
                        Clock clock) {
    if (ttlSeconds < 1) {
      throw new IllegalArgumentException("ttlSeconds must be positive: " + ttlSeconds);
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer))
        .build(clock);
    this.sessionStore = sessionStore;
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
  }

  /**
   * An issued session.
   *
   * @param token       the signed token handed to the caller
   * @param jti         the token id
   * @param principalId the bound principal
   * @param expiresAt   expiry
   */
  public record Session(String token, String jti, String principalId, Instant expiresAt) {

    @Override
    public String toString() {
      return "Session[jti=" + jti + ", principalId=" + principalId + ", expiresAt=" + expiresAt + "]";
    }
  }

  /**
   * Result of a successful token verification.
   *
   * @param subject the principal id
   * @param jti     the JWT ID
   */
  public record VerifyResult(String subject, String jti) {
  }

  /**
   * Starts a session. If the caller presented a prior token that is still live, it is revoked
   * first so a token obtained before login cannot ride the new session.
   *
   * @param principalId the authenticated principal
   * @param origin      the caller origin
   * @param priorToken  the caller's previous token, may be null
   * @return the new session
   */
  public Session start(String principalId, String origin, String priorToken) {
    if (priorToken != null) {
      verify(priorToken).ifPresent(prior -> {
        sessionStore.revoke(prior.jti());
        log.debug("Revoked prior session jti={} on login", prior.jti());
      });
    }
    String jti = UUID.randomUUID().toString();
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plusSeconds(ttlSeconds);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(principalId)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    sessionStore.store(jti, new SessionData(principalId, origin, now, expiresAt));
    log.debug("Issued session jti={} for {}", jti, principalId);
    return new Session(token, jti, principalId, expiresAt);
  }

  /**
   * Verifies a token and returns the subject and JTI if valid and not revoked.
   *
   * @param token JWT string
   * @return verify result if valid, empty if invalid, expired or revoked
   */
  public Optional<VerifyResult> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      String jti = decoded.getId();
      if (jti == null) {
        return Optional.empty();
      }
      Optional<SessionData> session = sessionStore.load(jti);
      if (session.isEmpty()) {
        log.debug("JWT jti={} not found in session store (ended or expired)", jti);
        return Optional.empty();
      }
      if (!session.get().principalId().equals(decoded.getSubject())) {
        log.warn("JWT jti={} subject does not match its session", jti);
        return Optional.empty();
      }
      return Optional.of(new VerifyResult(decoded.getSubject(), jti));
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Returns the principal bound to a live token.
   *
   * @param token JWT string, may be null
   * @return the principal, or empty if there is no live session
   */
  public Optional<String> current(String token) {
    return verify(token).map(VerifyResult::subject);
  }

  /**
   * Ends the session behind a token. Unknown, invalid or already ended tokens are a no-op.
   *
   * @param token JWT string, may be null
   * @return the principal whose session was ended, or empty if nothing was live
   */
  public Optional<String> end(String token) {
    return verify(token).flatMap(result -> sessionStore.revoke(result.jti())
        .map(SessionData::principalId));
  }
}
