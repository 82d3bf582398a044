package tech.mediagateway.auth.error;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

/**
 * Maps {@link AuthError} values to HTTP responses.
 *
 * <p>Response format:
 * <pre>
 * {
 *   "error": "invalid_grant",
 *   "error_description": "Authorization code has expired"
 * }
 * </pre>
 *
 * Rate-limit rejections add {@code message}, {@code retry_after}, {@code limit}
 * and {@code current_count}, plus the {@code Retry-After} and
 * {@code X-RateLimit-*} headers.
 */
public final class AuthErrorResponses {

    private static final Logger LOG = Logger.getLogger(AuthErrorResponses.class);

    public static final String RATE_LIMIT_LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RETRY_AFTER_HEADER = "Retry-After";

    private AuthErrorResponses() {
    }

    public static Response toResponse(AuthError error) {
        if (error.kind().isServerSide()) {
            LOG.errorf("Request failed with %s: %s", error.kind(), error.description());
        }

        Response.ResponseBuilder builder = Response.status(error.status())
            .type(MediaType.APPLICATION_JSON)
            .header(HttpHeaders.CACHE_CONTROL, "no-store");

        if (error instanceof AuthError.RateLimitExceeded rateLimited) {
            long retryAfterSeconds = Math.max(1, (rateLimited.retryAfter().toMillis() + 999) / 1000);
            return builder
                .header(RETRY_AFTER_HEADER, retryAfterSeconds)
                .header(RATE_LIMIT_LIMIT_HEADER, rateLimited.limit())
                .header(RATE_LIMIT_REMAINING_HEADER, 0)
                .entity(new RateLimitErrorResponse(
                    error.code().value(),
                    error.publicDescription(),
                    "Rate limit exceeded. Try again in " + retryAfterSeconds + " seconds.",
                    retryAfterSeconds,
                    rateLimited.limit(),
                    rateLimited.currentCount()))
                .build();
        }

        if (error.code() == OAuthErrorCode.INVALID_TOKEN) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE,
                "Bearer error=\"invalid_token\", error_description=\"" + error.publicDescription() + "\"");
        }

        return builder
            .entity(new ErrorResponse(error.code().value(), error.publicDescription()))
            .build();
    }

    public record ErrorResponse(String error, String error_description) {}

    public record RateLimitErrorResponse(
        String error,
        String error_description,
        String message,
        long retry_after,
        long limit,
        long current_count
    ) {}
}
