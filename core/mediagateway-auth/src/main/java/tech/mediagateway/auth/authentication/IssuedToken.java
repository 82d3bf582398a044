package tech.mediagateway.auth.authentication;

import java.time.Duration;
import java.time.Instant;

/**
 * A freshly signed token with the identifiers needed to track it.
 */
public record IssuedToken(String token, String jti, Instant issuedAt, Instant expiresAt) {

    public Duration lifetime() {
        return Duration.between(issuedAt, expiresAt);
    }
}
