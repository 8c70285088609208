package com.codeheadsystems.warden.server.store;

import java.time.Instant;

/**
 * Data stored for a live session.
 *
 * @param principalId the authenticated principal
 * @param origin      the origin the session was started from
 * @param issuedAt    when the session was created
 * @param expiresAt   when the session expires
 */
public record SessionData(
    String principalId,
    String origin,
    Instant issuedAt,
    Instant expiresAt) {
}
