package tech.mediagateway.auth.authentication.session;

import java.time.Instant;

/**
 * Binds a refresh-token id to its user. Stored under {@code session:{jti}}
 * for the lifetime of the refresh token.
 *
 * @param family rotation family of the refresh token
 * @param deviceLabel optional label of the device the session was granted to
 */
public record SessionRecord(
    String userId,
    String jti,
    String family,
    String deviceLabel,
    Instant createdAt,
    Instant expiresAt
) {}
