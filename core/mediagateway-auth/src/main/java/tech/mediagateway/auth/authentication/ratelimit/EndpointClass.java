package tech.mediagateway.auth.authentication.ratelimit;

import tech.mediagateway.auth.authentication.AuthConfig;

import java.util.Optional;

/**
 * Rate-limited endpoint groups. Each has its own limit and its own counters.
 */
public enum EndpointClass {
    /** Token endpoint and device polling. */
    TOKEN,
    /** Device authorization requests and decisions. */
    DEVICE,
    AUTHORIZE,
    REVOKE;

    public int limit(AuthConfig.RateLimitConfig config) {
        return switch (this) {
            case TOKEN -> config.tokenLimit();
            case DEVICE -> config.deviceLimit();
            case AUTHORIZE -> config.authorizeLimit();
            case REVOKE -> config.revokeLimit();
        };
    }

    public String key() {
        return name().toLowerCase();
    }

    /**
     * Classify a request path, with or without leading slash.
     */
    public static Optional<EndpointClass> fromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String normalized = path.startsWith("/") ? path : "/" + path;
        if (normalized.endsWith("/") && normalized.length() > 1) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }

        return switch (normalized) {
            case "/auth/token", "/auth/device/poll" -> Optional.of(TOKEN);
            case "/auth/device", "/auth/device/approve", "/auth/device/deny" -> Optional.of(DEVICE);
            case "/auth/authorize", "/auth/authorize/complete" -> Optional.of(AUTHORIZE);
            case "/auth/revoke" -> Optional.of(REVOKE);
            default -> Optional.empty();
        };
    }
}
