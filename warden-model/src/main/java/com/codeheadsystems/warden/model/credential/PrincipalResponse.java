package com.codeheadsystems.warden.model.credential;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model naming the principal bound to the caller's session.
 * <p>
 * Used by: {@code GET /credentials/me}
 *
 * @param principalId the authenticated principal identity
 */
public record PrincipalResponse(
    @JsonProperty("principalId") String principalId) {
}
