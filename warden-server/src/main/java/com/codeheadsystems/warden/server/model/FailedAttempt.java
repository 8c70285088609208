package com.codeheadsystems.warden.server.model;

import java.time.Instant;

/**
 * A single failed verification, counted by the rate limiter.
 *
 * @param principalId targeted principal, null when no identity was supplied
 * @param origin      normalised caller origin
 * @param createdAt   when the attempt failed
 */
public record FailedAttempt(
    String principalId,
    String origin,
    Instant createdAt) {
}
