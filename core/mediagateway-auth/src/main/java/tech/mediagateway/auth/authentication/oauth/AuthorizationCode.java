package tech.mediagateway.auth.authentication.oauth;

import java.time.Instant;
import java.util.List;

/**
 * One-time authorization code, stored under {@code authcode:{code}}.
 *
 * <p>{@code used} flips from false to true exactly once, through a
 * compare-and-set on the stored record.
 */
public record AuthorizationCode(
    String code,
    String clientId,
    String redirectUri,
    String userId,
    List<String> scopes,
    String codeChallenge,
    String codeChallengeMethod,
    boolean used,
    Instant createdAt,
    Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public AuthorizationCode markUsed() {
        return new AuthorizationCode(code, clientId, redirectUri, userId, scopes,
            codeChallenge, codeChallengeMethod, true, createdAt, expiresAt);
    }
}
