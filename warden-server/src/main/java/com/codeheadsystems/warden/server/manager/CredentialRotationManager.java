package com.codeheadsystems.warden.server.manager;

import com.codeheadsystems.warden.model.credential.ActionRequest;
import com.codeheadsystems.warden.model.credential.ActionResponse;
import com.codeheadsystems.warden.server.auth.SessionManager;
import com.codeheadsystems.warden.server.config.SecretPolicy;
import com.codeheadsystems.warden.server.exception.InvalidCredentialsException;
import com.codeheadsystems.warden.server.exception.PrincipalNotFoundException;
import com.codeheadsystems.warden.server.exception.RateLimitedException;
import com.codeheadsystems.warden.server.exception.UnauthorizedException;
import com.codeheadsystems.warden.server.exception.ValidationException;
import com.codeheadsystems.warden.server.model.AuditEvent;
import com.codeheadsystems.warden.server.model.AuditEventKind;
import com.codeheadsystems.warden.server.model.CredentialKind;
import com.codeheadsystems.warden.server.model.CredentialState;
import com.codeheadsystems.warden.server.model.LoginResult;
import com.codeheadsystems.warden.server.model.RejectionReason;
import com.codeheadsystems.warden.server.model.RequestContext;
import com.codeheadsystems.warden.server.model.RotationResult;
import com.codeheadsystems.warden.server.store.AuditLog;
import com.codeheadsystems.warden.server.store.StoreTransactor;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing the login, logout and secret rotation workflow.
 * <p>
 * Framework adapters ({@code CredentialResource} for JAX-RS / Dropwizard,
 * {@code CredentialController} for Spring Boot) stay thin wrappers that only supply the
 * {@link RequestContext} and translate exceptions into HTTP responses.
 * <p>
 * Every handler consults the {@link RateLimiter} before touching credentials. Each failure is
 * recorded against the limiter and audited in one unit of work; a committed rotation replaces
 * the secret, clears the principal's failures and audits the change in one unit of work while
 * holding the principal's lock.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link ValidationException}          - missing fields or weak secret, HTTP 400</li>
 *   <li>{@link UnauthorizedException}        - no live session, HTTP 401</li>
 *   <li>{@link InvalidCredentialsException}  - wrong secret, HTTP 401</li>
 *   <li>{@link RateLimitedException}         - throttled, HTTP 429</li>
 *   <li>{@link PrincipalNotFoundException}   - session principal has no credentials, HTTP 404</li>
 *   <li>{@link com.codeheadsystems.warden.server.exception.StoreFailureException}
 *       - store unavailable, HTTP 503</li>
 * </ul>
 */
@Singleton
public class CredentialRotationManager {

  private static final Logger log = LoggerFactory.getLogger(CredentialRotationManager.class);

  static final String RATE_LIMITED_MESSAGE = "Too many failed attempts. Please try again later.";
  static final String PASSWORD_UPDATED_MESSAGE = "Password updated successfully.";
  static final int MAX_IDENTITY_LENGTH = 255;

  private final CredentialManager credentials;
  private final RateLimiter rateLimiter;
  private final AuditLog auditLog;
  private final SessionManager sessions;
  private final StoreTransactor transactor;
  private final SecretPolicy secretPolicy;
  private final PrincipalLocks locks;
  private final Clock clock;

  @Inject
  public CredentialRotationManager(CredentialManager credentials,
                                   RateLimiter rateLimiter,
                                   AuditLog auditLog,
                                   SessionManager sessions,
                                   StoreTransactor transactor,
                                   SecretPolicy secretPolicy,
                                   PrincipalLocks locks,
                                   Clock clock) {
    this.credentials = credentials;
    this.rateLimiter = rateLimiter;
    this.auditLog = auditLog;
    this.sessions = sessions;
    this.transactor = transactor;
    this.secretPolicy = secretPolicy;
    this.locks = locks;
    this.clock = clock;
  }

  /**
   * Authenticates a principal with its PIN and starts a session.
   *
   * @param identity   the principal identity, surrounding whitespace is ignored
   * @param secret     the PIN
   * @param context    caller details
   * @param priorToken the caller's current token, revoked if still live; may be null
   * @return the new session
   */
  public LoginResult login(String identity, String secret, RequestContext context, String priorToken) {
    return authenticate(identity, secret, CredentialKind.PIN, "Username and PIN are required.",
        context, priorToken);
  }

  /**
   * Authenticates a principal with its password and starts a session. Shares the PIN login's
   * throttle and audit trail, so a rotated password is what this checks.
   *
   * @param identity   the principal identity, surrounding whitespace is ignored
   * @param password   the password
   * @param context    caller details
   * @param priorToken the caller's current token, revoked if still live; may be null
   * @return the new session
   */
  public LoginResult passwordLogin(String identity, String password, RequestContext context,
                                   String priorToken) {
    return authenticate(identity, password, CredentialKind.PASSWORD,
        "Username and password are required.", context, priorToken);
  }

  private LoginResult authenticate(String identity, String secret, CredentialKind kind,
                                   String missingMessage, RequestContext context,
                                   String priorToken) {
    String principalId = identity == null ? null : identity.strip();
    if (isBlank(principalId) || isBlank(secret)) {
      throw new ValidationException(RejectionReason.MISSING_FIELDS, missingMessage);
    }
    if (principalId.length() > MAX_IDENTITY_LENGTH) {
      throw new ValidationException("invalid_identity", "Username is too long.");
    }
    if (rateLimiter.isBlocked(context.origin(), principalId)) {
      log.debug("login({}) throttled for {}", kind, principalId);
      throw new RateLimitedException(RATE_LIMITED_MESSAGE);
    }
    if (!credentials.verify(principalId, kind, secret)) {
      transactor.runInTransaction(() -> {
        rateLimiter.recordFailure(context.origin(), principalId);
        audit(principalId, AuditEventKind.LOGIN_FAILURE, context);
      });
      log.debug("login({}) failed for {}", kind, principalId);
      throw new InvalidCredentialsException("Invalid credentials.");
    }
    audit(principalId, AuditEventKind.LOGIN_SUCCESS, context);
    SessionManager.Session session = sessions.start(principalId, context.origin(), priorToken);
    log.info("Principal {} logged in with {}", principalId, kind);
    return new LoginResult(session.token(), principalId, session.expiresAt());
  }

  /**
   * Ends the session behind the token. Always succeeds; only a live session is audited.
   *
   * @param token   the session token, may be null
   * @param context caller details
   */
  public void logout(String token, RequestContext context) {
    sessions.end(token).ifPresent(principalId -> {
      audit(principalId, AuditEventKind.LOGOUT, context);
      log.info("Principal {} logged out", principalId);
    });
  }

  /**
   * Rotates the session principal's password after re-verifying its PIN.
   *
   * @param token         the session token
   * @param oldSecret     the current PIN
   * @param newSecret     the new password
   * @param confirmSecret the new password again
   * @param context       caller details
   * @return the committed rotation
   */
  public RotationResult changeSecret(String token, String oldSecret, String newSecret,
                                     String confirmSecret, RequestContext context) {
    String principalId = sessions.current(token)
        .orElseThrow(() -> new UnauthorizedException("Not authenticated."));
    if (rateLimiter.isBlocked(context.origin(), principalId)) {
      log.debug("changeSecret() throttled for {}", principalId);
      throw new RateLimitedException(RATE_LIMITED_MESSAGE);
    }
    if (isBlank(oldSecret) || isBlank(newSecret) || isBlank(confirmSecret)) {
      throw reject(principalId, RejectionReason.MISSING_FIELDS, context);
    }
    if (!newSecret.equals(confirmSecret)) {
      throw reject(principalId, RejectionReason.MISMATCH, context);
    }
    Optional<RejectionReason> weakness = secretPolicy.check(newSecret);
    if (weakness.isPresent()) {
      throw reject(principalId, weakness.get(), context);
    }
    return locks.withLock(principalId, () -> {
      if (!credentials.exists(principalId, CredentialKind.PIN)) {
        throw new PrincipalNotFoundException("User not found.");
      }
      if (!credentials.verify(principalId, CredentialKind.PIN, oldSecret)) {
        recordRejection(principalId, RejectionReason.PIN, context);
        throw new InvalidCredentialsException(RejectionReason.PIN.message());
      }
      RotationResult result = transactor.inTransaction(() -> {
        Instant rotatedAt = credentials.replace(principalId, CredentialKind.PASSWORD, newSecret);
        rateLimiter.reset(principalId);
        audit(principalId, AuditEventKind.PASSWORD_CHANGED, context);
        return new RotationResult(principalId, CredentialState.ROTATION_COMMITTED, rotatedAt);
      });
      log.info("Principal {} rotated its password", principalId);
      return result;
    });
  }

  /**
   * Returns the principal behind a live session.
   *
   * @param token the session token, may be null
   * @return the principal, or empty if there is no live session
   */
  public Optional<String> currentPrincipal(String token) {
    return sessions.current(token);
  }

  /**
   * Session state of a token: {@link CredentialState#AUTHENTICATED} or
   * {@link CredentialState#UNAUTHENTICATED}.
   *
   * @param token the session token, may be null
   * @return the state
   */
  public CredentialState sessionState(String token) {
    return sessions.current(token).isPresent()
        ? CredentialState.AUTHENTICATED
        : CredentialState.UNAUTHENTICATED;
  }

  /**
   * Routes a single {@code {"action": ...}} request to its handler.
   *
   * @param request     the request
   * @param context     caller details
   * @param bearerToken the caller's session token, may be null
   * @return the wire response
   */
  public ActionResponse dispatch(ActionRequest request, RequestContext context, String bearerToken) {
    if (request == null) {
      throw new ValidationException("invalid_action", "Invalid action.");
    }
    ActionKind kind = ActionKind.fromName(request.action());
    log.debug("dispatch({})", kind);
    return switch (kind) {
      case LOGIN -> ActionResponse.loggedIn(
          login(request.identity(), request.secret(), context, bearerToken).token());
      case LOGOUT -> {
        logout(bearerToken, context);
        yield ActionResponse.ok("Logged out.");
      }
      case CHANGE_PASSWORD -> {
        changeSecret(bearerToken, request.oldSecret(), request.newSecret(),
            request.confirmSecret(), context);
        yield ActionResponse.ok(PASSWORD_UPDATED_MESSAGE);
      }
    };
  }

  private ValidationException reject(String principalId, RejectionReason reason,
                                     RequestContext context) {
    recordRejection(principalId, reason, context);
    return new ValidationException(reason, secretPolicy.messageFor(reason));
  }

  private void recordRejection(String principalId, RejectionReason reason, RequestContext context) {
    transactor.runInTransaction(() -> {
      rateLimiter.recordFailure(context.origin(), principalId);
      audit(principalId, reason.auditEventKind(), context);
    });
    log.debug("changeSecret() rejected for {}: {}", principalId, reason.code());
  }

  private void audit(String principalId, AuditEventKind kind, RequestContext context) {
    auditLog.append(AuditEvent.of(principalId, kind, context, clock.instant()));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
