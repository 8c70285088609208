package com.codeheadsystems.warden.server.store;

import java.util.Optional;

/**
 * Storage abstraction for live sessions, keyed by the token id (jti).
 * <p>
 * Implementations must be thread-safe.
 */
public interface SessionStore {

  /**
   * Stores session data keyed by the JWT ID (jti).
   *
   * @param jti         unique token identifier
   * @param sessionData session data to store
   */
  void store(String jti, SessionData sessionData);

  /**
   * Loads session data by JWT ID, returning empty if not found or expired.
   *
   * @param jti unique token identifier
   * @return the session data, or empty if not found or expired
   */
  Optional<SessionData> load(String jti);

  /**
   * Revokes a single session by JWT ID. Unknown ids are ignored.
   *
   * @param jti unique token identifier
   * @return the revoked session, or empty if none was live
   */
  Optional<SessionData> revoke(String jti);
}
