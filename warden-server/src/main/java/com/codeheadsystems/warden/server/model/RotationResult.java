package com.codeheadsystems.warden.server.model;

import java.time.Instant;

/**
 * Outcome of a committed secret rotation.
 *
 * @param principalId the principal whose secret was rotated
 * @param state       always {@link CredentialState#ROTATION_COMMITTED}
 * @param rotatedAt   when the new hash was written
 */
public record RotationResult(String principalId, CredentialState state, Instant rotatedAt) {
}
