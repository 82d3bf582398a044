package tech.mediagateway.auth.authentication.ratelimit;

import java.time.Duration;

/**
 * Outcome of a rate-limit check.
 *
 * @param permitted whether the request may proceed
 * @param limit configured limit, 0 when bypassed or disabled
 * @param currentCount requests counted in the current window, including this one
 * @param retryAfter time until the window resets
 */
public record RateLimitDecision(boolean permitted, boolean bypassed, long limit, long currentCount,
                                Duration retryAfter) {

    public static RateLimitDecision bypass() {
        return new RateLimitDecision(true, true, 0, 0, Duration.ZERO);
    }

    public long remaining() {
        return Math.max(0, limit - currentCount);
    }
}
