package com.codeheadsystems.warden.dropwizard.auth;

import com.codeheadsystems.warden.server.auth.SessionManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that accepts bearer tokens backed by a live session.
 */
public class WardenAuthenticator implements Authenticator<String, WardenPrincipal> {

  private final SessionManager sessionManager;

  public WardenAuthenticator(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Override
  public Optional<WardenPrincipal> authenticate(String token) throws AuthenticationException {
    return sessionManager.verify(token)
        .map(result -> new WardenPrincipal(result.subject(), result.jti()));
  }
}
