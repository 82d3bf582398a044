package tech.mediagateway.auth.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.authentication.session.SessionService;

import java.util.List;
import java.util.UUID;

/**
 * Mints the token pair for a completed grant and registers the refresh token
 * with the session manager. Shared by every grant type.
 */
@ApplicationScoped
public class TokenIssuanceService {

    private static final Logger LOG = Logger.getLogger(TokenIssuanceService.class);

    @Inject
    TokenService tokenService;

    @Inject
    SessionService sessionService;

    @Inject
    UserProfileProvider userProfileProvider;

    /**
     * @param family rotation family to continue, or null to start a new one
     * @param deviceLabel optional label stored on the session
     */
    public TokenPair issue(String userId, List<String> scopes, String family, String deviceLabel) {
        UserProfile profile = userProfileProvider.profileFor(userId);
        String tokenFamily = family != null ? family : UUID.randomUUID().toString();

        IssuedToken access = tokenService.createAccessToken(userId, profile.email(), profile.roles(), scopes);
        IssuedToken refresh = tokenService.createRefreshToken(userId, profile.email(), profile.roles(), scopes,
            tokenFamily);
        sessionService.createSession(userId, refresh.jti(), tokenFamily, deviceLabel, refresh.expiresAt());

        LOG.infof("Issued tokens for user %s (scopes=%s, family=%s)", userId, scopes, tokenFamily);
        return new TokenPair(access, refresh, List.copyOf(scopes), tokenFamily);
    }
}
