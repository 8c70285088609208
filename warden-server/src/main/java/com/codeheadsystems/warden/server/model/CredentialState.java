package com.codeheadsystems.warden.server.model;

/**
 * States of the credential rotation workflow. The two rotation states are terminal for a
 * single change-secret attempt; the session itself stays {@link #AUTHENTICATED}.
 */
public enum CredentialState {
  UNAUTHENTICATED,
  AUTHENTICATED,
  ROTATION_REJECTED,
  ROTATION_COMMITTED
}
