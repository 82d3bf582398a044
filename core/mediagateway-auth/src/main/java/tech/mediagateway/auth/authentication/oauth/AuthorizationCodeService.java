package tech.mediagateway.auth.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.authentication.AuthConfig;
import tech.mediagateway.auth.authentication.Scopes;
import tech.mediagateway.auth.authentication.TokenIssuanceService;
import tech.mediagateway.auth.authentication.TokenPair;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthException;
import tech.mediagateway.auth.store.CredentialKeys;
import tech.mediagateway.auth.store.CredentialStore;
import tech.mediagateway.auth.store.StoredRecordCodec;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;

/**
 * Authorization code flow with PKCE.
 *
 * <p>Client, redirect URI, scope and challenge are validated when the request
 * begins, so a stored challenge or code is always bound to a valid client and
 * redirect pair. The exchange then only has to prove possession of the verifier
 * and consume the code exactly once.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class AuthorizationCodeService {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    @Inject
    AuthConfig authConfig;

    @Inject
    OAuthClientRegistry clientRegistry;

    @Inject
    PkceService pkceService;

    @Inject
    CredentialStore store;

    @Inject
    StoredRecordCodec codec;

    @Inject
    TokenIssuanceService tokenIssuance;

    @Inject
    Clock clock;

    // ==================== Authorization ====================

    /**
     * Validate an authorization request and store its challenge under
     * {@code pkce:{state}} until the user authenticates. A state is generated when
     * the client sent none.
     */
    public PkceChallenge beginAuthorization(AuthorizationRequest request) {
        PkceChallenge challenge = validate(request);
        boolean stored = store.putIfAbsent(CredentialKeys.pkce(challenge.state()), codec.encode(challenge),
            authConfig.pkce().challengeTtl());
        if (!stored) {
            throw new AuthException(new AuthError.InvalidRequest("state is already in use"));
        }
        LOG.debugf("Authorization request pending for client %s", challenge.clientId());
        return challenge;
    }

    /**
     * Consume a pending challenge for an authenticated user and issue the code.
     */
    public IssuedCode completeAuthorization(String state, String userId) {
        if (state == null || state.isBlank()) {
            throw new AuthException(new AuthError.InvalidRequest("state is required"));
        }
        PkceChallenge challenge = store.getAndDelete(CredentialKeys.pkce(state))
            .map(json -> codec.decode(json, PkceChallenge.class))
            .orElseThrow(() -> new AuthException(
                new AuthError.InvalidGrant("Unknown or expired authorization request")));
        return issueCode(challenge, userId);
    }

    /**
     * Validate a request from an already authenticated user and issue the code directly.
     */
    public IssuedCode authorize(AuthorizationRequest request, String userId) {
        return issueCode(validate(request), userId);
    }

    /**
     * Store a new one-time code bound to the validated challenge and user.
     */
    IssuedCode issueCode(PkceChallenge challenge, String userId) {
        Instant now = clock.instant();
        AuthorizationCode code = new AuthorizationCode(
            generateAuthorizationCode(),
            challenge.clientId(),
            challenge.redirectUri(),
            userId,
            challenge.scopes(),
            challenge.codeChallenge(),
            challenge.codeChallengeMethod(),
            false,
            now,
            now.plus(authConfig.authorizationCodeTtl()));

        store.put(CredentialKeys.authorizationCode(code.code()), codec.encode(code),
            authConfig.authorizationCodeTtl().plus(authConfig.expiredRetention()));
        LOG.infof("Issued authorization code for user %s, client %s", userId, code.clientId());
        return new IssuedCode(code, challenge.state());
    }

    private PkceChallenge validate(AuthorizationRequest request) {
        if (!"code".equals(request.responseType())) {
            throw new AuthException(new AuthError.UnsupportedResponseType(request.responseType()));
        }

        OAuthClient client = clientRegistry.requireGrantType(request.clientId(), GrantTypes.AUTHORIZATION_CODE);

        if (!client.isRedirectUriAllowed(request.redirectUri())) {
            LOG.warnf("Redirect URI not registered for client %s: %s", client.clientId(), request.redirectUri());
            throw new AuthException(new AuthError.InvalidRequest("redirect_uri is not registered for this client"));
        }

        String method = request.codeChallengeMethod() != null ? request.codeChallengeMethod() : PkceService.METHOD_S256;
        if (!pkceService.isSupportedMethod(method)) {
            throw new AuthException(new AuthError.InvalidRequest("code_challenge_method must be S256"));
        }
        if (!pkceService.isValidCodeChallenge(request.codeChallenge())) {
            throw new AuthException(new AuthError.InvalidRequest("code_challenge is missing or malformed"));
        }

        List<String> scopes = Scopes.parse(request.scope());
        if (!client.areScopesAllowed(scopes)) {
            throw new AuthException(new AuthError.InvalidScope(request.scope()));
        }

        String state = request.state() != null && !request.state().isBlank()
            ? request.state()
            : generateAuthorizationCode();

        return new PkceChallenge(state, request.codeChallenge(), method, client.clientId(),
            request.redirectUri(), scopes, clock.instant());
    }

    // ==================== Exchange ====================

    /**
     * Exchange an authorization code for tokens.
     *
     * <p>All checks run before the code is consumed. Consumption is a
     * compare-and-set of the exact record that was checked, so of any number of
     * concurrent exchanges at most one mints tokens.
     */
    public TokenPair exchange(String code, String codeVerifier, String redirectUri, String clientId) {
        if (code == null || code.isBlank()) {
            throw new AuthException(new AuthError.InvalidRequest("code is required"));
        }
        if (codeVerifier == null || codeVerifier.isBlank()) {
            throw new AuthException(new AuthError.InvalidRequest("code_verifier is required"));
        }

        String key = CredentialKeys.authorizationCode(code);
        String stored = store.get(key)
            .orElseThrow(() -> new AuthException(new AuthError.InvalidGrant("Invalid authorization code")));
        AuthorizationCode authCode = codec.decode(stored, AuthorizationCode.class);

        if (authCode.used()) {
            LOG.errorf("SECURITY: authorization code replay for client %s, user %s",
                authCode.clientId(), authCode.userId());
            throw new AuthException(new AuthError.CodeReused());
        }

        if (authCode.isExpired(clock.instant())) {
            store.delete(key);
            throw new AuthException(new AuthError.CodeExpired());
        }

        if (!pkceService.verifyCodeChallenge(codeVerifier, authCode.codeChallenge(), authCode.codeChallengeMethod())) {
            LOG.warnf("PKCE verification failed for client %s", authCode.clientId());
            throw new AuthException(new AuthError.InvalidGrant("Invalid code_verifier"));
        }

        if (!authCode.clientId().equals(clientId)) {
            LOG.warnf("Authorization code presented by client %s but issued to %s", clientId, authCode.clientId());
            throw new AuthException(new AuthError.InvalidGrant("Client mismatch"));
        }

        if (!authCode.redirectUri().equals(redirectUri)) {
            throw new AuthException(new AuthError.InvalidGrant("Redirect URI mismatch"));
        }

        if (!store.compareAndSet(key, stored, codec.encode(authCode.markUsed()))) {
            LOG.errorf("SECURITY: concurrent exchange of one authorization code for client %s, user %s",
                authCode.clientId(), authCode.userId());
            throw new AuthException(new AuthError.CodeReused());
        }

        return tokenIssuance.issue(authCode.userId(), authCode.scopes(), null, null);
    }

    private static String generateAuthorizationCode() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * A stored code together with the client state to echo on redirect.
     */
    public record IssuedCode(AuthorizationCode code, String state) {}
}
