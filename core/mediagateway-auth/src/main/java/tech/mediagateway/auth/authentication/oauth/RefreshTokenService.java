package tech.mediagateway.auth.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.authentication.AuthConfig;
import tech.mediagateway.auth.authentication.Scopes;
import tech.mediagateway.auth.authentication.TokenClaims;
import tech.mediagateway.auth.authentication.TokenIssuanceService;
import tech.mediagateway.auth.authentication.TokenPair;
import tech.mediagateway.auth.authentication.TokenService;
import tech.mediagateway.auth.authentication.session.SessionService;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthException;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Refresh token rotation and on-demand revocation.
 *
 * <p>Rotation claims the presented token first: the old jti is revoked with a
 * conditional write, and only the caller that wins it gets new tokens. A token
 * presented again after rotation is rejected as revoked; with
 * {@code mediagateway.auth.refresh.revoke-family-on-reuse} the whole family is
 * revoked too.
 */
@ApplicationScoped
public class RefreshTokenService {

    private static final Logger LOG = Logger.getLogger(RefreshTokenService.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    TokenService tokenService;

    @Inject
    SessionService sessionService;

    @Inject
    TokenIssuanceService tokenIssuance;

    @Inject
    Clock clock;

    /**
     * Rotate a refresh token.
     *
     * @param requestedScope optional narrower scope; must be a subset of the original grant
     */
    public TokenPair refresh(String refreshToken, String requestedScope) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new AuthException(new AuthError.InvalidRequest("refresh_token is required"));
        }
        TokenClaims claims = tokenService.verifyRefreshToken(refreshToken);

        List<String> scopes = claims.scopes();
        if (requestedScope != null && !requestedScope.isBlank()) {
            List<String> requested = Scopes.parse(requestedScope);
            if (!claims.scopes().containsAll(requested)) {
                throw new AuthException(new AuthError.InvalidScope(requestedScope));
            }
            scopes = requested;
        }

        if (!sessionService.revokeIfActive(claims.jti(), remainingLifetime(claims))) {
            LOG.warnf("SECURITY: revoked refresh token presented for user %s, family %s",
                claims.subject(), claims.family());
            if (authConfig.refresh().revokeFamilyOnReuse()) {
                sessionService.revokeFamily(claims.subject(), claims.family());
            }
            throw new AuthException(new AuthError.TokenRevoked());
        }

        return tokenIssuance.issue(claims.subject(), scopes, claims.family(), null);
    }

    /**
     * Revoke an access or refresh token (RFC 7009). Unknown, malformed and expired
     * tokens are ignored; the caller answers 200 either way.
     *
     * @return true if a token was revoked
     */
    public boolean revoke(String token) {
        TokenClaims claims;
        try {
            claims = tokenService.verifyAnyToken(token);
        } catch (AuthException e) {
            LOG.debugf("Ignoring revocation of unverifiable token: %s", e.getError().description());
            return false;
        }
        sessionService.revoke(claims.jti(), remainingLifetime(claims));
        return true;
    }

    private Duration remainingLifetime(TokenClaims claims) {
        return Duration.between(clock.instant(), claims.expiresAt());
    }
}
