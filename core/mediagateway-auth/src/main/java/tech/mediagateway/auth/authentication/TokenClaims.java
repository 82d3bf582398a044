package tech.mediagateway.auth.authentication;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Verified claims of an access or refresh token.
 *
 * @param family refresh-token family shared by every token rotated from the same
 *               grant, null on access tokens
 */
public record TokenClaims(
    String subject,
    String email,
    Set<String> roles,
    List<String> scopes,
    String jti,
    Instant issuedAt,
    Instant expiresAt,
    TokenUse use,
    String family
) {
    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }
}
