package tech.mediagateway.auth.authentication.oauth;

import java.time.Instant;
import java.util.List;

/**
 * A validated authorization request waiting for the user to authenticate.
 * Stored under {@code pkce:{state}} and consumed exactly once.
 */
public record PkceChallenge(
    String state,
    String codeChallenge,
    String codeChallengeMethod,
    String clientId,
    String redirectUri,
    List<String> scopes,
    Instant createdAt
) {}
