package tech.mediagateway.auth.authentication.oauth;

/**
 * Parameters of a GET /auth/authorize request, as received.
 */
public record AuthorizationRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String scope,
    String codeChallenge,
    String codeChallengeMethod,
    String state
) {}
