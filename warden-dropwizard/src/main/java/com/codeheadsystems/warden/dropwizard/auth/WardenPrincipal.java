package com.codeheadsystems.warden.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing a caller with a live Warden session.
 *
 * @param principalId the session principal
 * @param jti         JWT ID of the session
 */
public record WardenPrincipal(String principalId, String jti) implements Principal {

  @Override
  public String getName() {
    return principalId;
  }
}
