package tech.mediagateway.auth.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.mediagateway.auth.authentication.session.SessionService;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthException;

/**
 * Authenticates the caller of bearer-protected endpoints from the Authorization header.
 */
@ApplicationScoped
public class BearerTokenAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    TokenService tokenService;

    @Inject
    SessionService sessionService;

    public boolean hasBearerToken(String authorizationHeader) {
        return authorizationHeader != null && authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0,
            BEARER_PREFIX.length());
    }

    /**
     * Verify the bearer access token and check it has not been revoked.
     *
     * @return the verified claims
     */
    public TokenClaims authenticate(String authorizationHeader) {
        if (!hasBearerToken(authorizationHeader)) {
            throw new AuthException(new AuthError.Unauthenticated());
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        TokenClaims claims = tokenService.verifyAccessToken(token);
        if (sessionService.isRevoked(claims.jti())) {
            throw new AuthException(new AuthError.TokenRevoked());
        }
        return claims;
    }
}
