package tech.mediagateway.auth.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration for the Media Gateway authorization core.
 *
 * Example configuration:
 * <pre>
 * mediagateway.auth.jwt.issuer=https://auth.mediagateway.io
 * mediagateway.auth.jwt.private-key-path=/keys/private.pem
 * mediagateway.auth.jwt.public-key-path=/keys/public.pem
 *
 * mediagateway.auth.clients.tv-app.redirect-uris=https://tv.mediagateway.io/callback
 * mediagateway.auth.clients.tv-app.allowed-scopes=read,write
 *
 * mediagateway.auth.rate-limit.internal-service-secret=${INTERNAL_SERVICE_SECRET}
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "mediagateway.auth")
public interface AuthConfig {

    /**
     * JWT configuration for token issuance and validation.
     */
    JwtConfig jwt();

    /**
     * PKCE configuration for the authorization code flow.
     */
    PkceConfig pkce();

    /**
     * Authorization code lifetime.
     * Default: 5 minutes
     */
    @WithName("authorization-code-ttl")
    @WithDefault("PT5M")
    Duration authorizationCodeTtl();

    /**
     * How long an expired code or device authorization stays in the store, so a
     * late exchange or poll is answered with an expiry error rather than not-found.
     * Default: 1 minute
     */
    @WithName("expired-retention")
    @WithDefault("PT1M")
    Duration expiredRetention();

    /**
     * Device authorization grant (RFC 8628) configuration.
     */
    DeviceConfig device();

    /**
     * Refresh token rotation configuration.
     */
    RefreshConfig refresh();

    /**
     * Roles granted to users the profile provider knows nothing about.
     */
    @WithName("default-roles")
    @WithDefault("free_user")
    List<String> defaultRoles();

    /**
     * Pre-registered clients, keyed by client id.
     */
    Map<String, ClientConfig> clients();

    /**
     * Endpoint rate limiting configuration.
     */
    @WithName("rate-limit")
    RateLimitConfig rateLimit();

    /**
     * JWT configuration.
     */
    interface JwtConfig {
        /**
         * Token issuer (iss claim).
         * Should match the public URL of this auth service.
         */
        @WithDefault("https://auth.mediagateway.io")
        String issuer();

        /**
         * Path to the RSA private key for signing tokens (PEM format).
         * Without it, dev keys are generated and persisted to dev-key-dir.
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        /**
         * Path to the RSA public key for validating tokens (PEM format).
         */
        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        /**
         * Directory for generated dev keys.
         */
        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();

        /**
         * Access token expiry duration.
         * Default: 1 hour
         */
        @WithName("access-token-expiry")
        @WithDefault("PT1H")
        Duration accessTokenExpiry();

        /**
         * Refresh token expiry duration.
         * Default: 30 days
         */
        @WithName("refresh-token-expiry")
        @WithDefault("P30D")
        Duration refreshTokenExpiry();
    }

    interface PkceConfig {
        /**
         * How long a stored challenge waits for the user to complete authorization.
         * Default: 10 minutes
         */
        @WithName("challenge-ttl")
        @WithDefault("PT10M")
        Duration challengeTtl();
    }

    interface DeviceConfig {
        /**
         * Device code lifetime.
         * Default: 15 minutes
         */
        @WithName("code-ttl")
        @WithDefault("PT15M")
        Duration codeTtl();

        /**
         * Minimum polling interval returned to devices.
         */
        @WithName("polling-interval")
        @WithDefault("PT5S")
        Duration pollingInterval();

        /**
         * Page where users enter their user code.
         */
        @WithName("verification-uri")
        @WithDefault("https://auth.mediagateway.io/device")
        String verificationUri();

        /**
         * How many user codes to try before giving up on a collision streak.
         */
        @WithName("user-code-attempts")
        @WithDefault("3")
        int userCodeAttempts();
    }

    interface RefreshConfig {
        /**
         * When a refresh token is presented after rotation, revoke every
         * session of its family instead of only rejecting the request.
         */
        @WithName("revoke-family-on-reuse")
        @WithDefault("false")
        boolean revokeFamilyOnReuse();
    }

    /**
     * A pre-registered OAuth client.
     */
    interface ClientConfig {
        /**
         * Allowed redirect URIs, matched exactly.
         */
        @WithName("redirect-uris")
        Optional<List<String>> redirectUris();

        /**
         * Scopes the client may request.
         */
        @WithName("allowed-scopes")
        @WithDefault("read")
        List<String> allowedScopes();

        /**
         * Grant types the client may use.
         */
        @WithName("grant-types")
        @WithDefault("authorization_code,refresh_token,urn:ietf:params:oauth:grant-type:device_code")
        List<String> grantTypes();
    }

    interface RateLimitConfig {
        /**
         * Whether endpoint rate limiting is active.
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Fixed window length. Counters reset at each window boundary.
         */
        @WithDefault("PT60S")
        Duration window();

        /**
         * Requests per window for /auth/token and /auth/device/poll.
         */
        @WithName("token-limit")
        @WithDefault("10")
        int tokenLimit();

        /**
         * Requests per window for /auth/device and device decisions.
         */
        @WithName("device-limit")
        @WithDefault("5")
        int deviceLimit();

        /**
         * Requests per window for /auth/authorize.
         */
        @WithName("authorize-limit")
        @WithDefault("20")
        int authorizeLimit();

        /**
         * Requests per window for /auth/revoke.
         */
        @WithName("revoke-limit")
        @WithDefault("10")
        int revokeLimit();

        /**
         * Shared secret in X-Internal-Service that skips rate limiting.
         * Unset means no caller can bypass.
         */
        @WithName("internal-service-secret")
        Optional<String> internalServiceSecret();
    }
}
