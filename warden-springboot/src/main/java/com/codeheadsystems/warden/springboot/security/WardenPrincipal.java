package com.codeheadsystems.warden.springboot.security;

import java.security.Principal;

public record WardenPrincipal(String principalId, String jti) implements Principal {

  @Override
  public String getName() {
    return principalId;
  }
}
