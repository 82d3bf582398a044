package tech.mediagateway.auth.authentication.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.authentication.AuthConfig;
import tech.mediagateway.auth.store.CredentialKeys;
import tech.mediagateway.auth.store.CredentialStore;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Per-endpoint, per-client request limiting with a fixed window.
 *
 * <p>Windows are aligned to multiples of the window length since the epoch. Each
 * request increments the counter {@code ratelimit:{class}:{client}:{windowStart}},
 * created with a TTL of one window; a request whose post-increment count exceeds
 * the limit is rejected. Counters of past windows simply expire.
 *
 * <p>Callers presenting the internal service secret are not counted.
 *
 * <p>Configuration via mediagateway.auth.rate-limit:
 * <ul>
 *   <li>enabled: Whether rate limiting is active (default: true)</li>
 *   <li>window: Window length (default: 60s)</li>
 *   <li>token-limit, device-limit, authorize-limit, revoke-limit: per-class limits</li>
 *   <li>internal-service-secret: bypass secret (default: none)</li>
 * </ul>
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    CredentialStore store;

    @Inject
    Clock clock;

    /**
     * Count a request and decide whether it may proceed.
     *
     * @param endpointClass the endpoint group
     * @param clientKey client identifier (client id header or remote address)
     * @param bypassSecret value of the internal service header, may be null
     */
    public RateLimitDecision check(EndpointClass endpointClass, String clientKey, String bypassSecret) {
        AuthConfig.RateLimitConfig config = authConfig.rateLimit();
        if (!config.enabled() || isBypass(bypassSecret)) {
            return RateLimitDecision.bypass();
        }

        long windowMillis = config.window().toMillis();
        long now = clock.millis();
        long windowStart = now - Math.floorMod(now, windowMillis);
        Duration retryAfter = Duration.ofMillis(windowStart + windowMillis - now);

        long limit = endpointClass.limit(config);
        String key = CredentialKeys.rateLimit(endpointClass.key(), clientKey, windowStart);
        long count = store.increment(key, config.window());

        if (count > limit) {
            LOG.warnf("Rate limit exceeded for %s:%s (%d/%d), retry after %ss",
                endpointClass, clientKey, count, limit, retryAfter.toSeconds());
            return new RateLimitDecision(false, false, limit, count, retryAfter);
        }
        return new RateLimitDecision(true, false, limit, count, retryAfter);
    }

    /**
     * Constant-time comparison against the configured internal service secret.
     * Always false when no secret is configured.
     */
    boolean isBypass(String presented) {
        Optional<String> secret = authConfig.rateLimit().internalServiceSecret();
        if (presented == null || secret.isEmpty() || secret.get().isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
            secret.get().getBytes(StandardCharsets.UTF_8),
            presented.getBytes(StandardCharsets.UTF_8));
    }
}
