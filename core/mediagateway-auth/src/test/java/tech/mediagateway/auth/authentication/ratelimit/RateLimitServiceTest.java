package tech.mediagateway.auth.authentication.ratelimit;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.mediagateway.auth.test.MutableClock;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the fixed-window rate limiter.
 */
@Tag("integration")
@QuarkusTest
class RateLimitServiceTest {

    private static final long WINDOW_MILLIS = 60_000;

    @Inject
    RateLimitService rateLimitService;

    @Inject
    MutableClock clock;

    private String clientKey;

    @BeforeEach
    void setUp() {
        clientKey = "client:" + UUID.randomUUID();
        // Start each test at the beginning of a window so it cannot roll over mid-test
        long now = clock.millis();
        clock.advance(Duration.ofMillis(WINDOW_MILLIS - Math.floorMod(now, WINDOW_MILLIS) + 1));
    }

    @AfterEach
    void resetClock() {
        clock.reset();
    }

    @Test
    @DisplayName("Requests up to the limit should pass and the next should be rejected")
    void check_shouldRejectRequest_whenLimitExceeded() {
        // Act
        for (int i = 1; i <= 10; i++) {
            RateLimitDecision decision = rateLimitService.check(EndpointClass.TOKEN, clientKey, null);
            assertThat(decision.permitted()).isTrue();
            assertThat(decision.remaining()).isEqualTo(10 - i);
        }
        RateLimitDecision rejected = rateLimitService.check(EndpointClass.TOKEN, clientKey, null);

        // Assert
        assertThat(rejected.permitted()).isFalse();
        assertThat(rejected.limit()).isEqualTo(10);
        assertThat(rejected.currentCount()).isEqualTo(11);
        assertThat(rejected.retryAfter()).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Counters should reset in the next window")
    void check_shouldPermitAgain_whenWindowRolls() {
        for (int i = 0; i < 5; i++) {
            rateLimitService.check(EndpointClass.DEVICE, clientKey, null);
        }
        assertThat(rateLimitService.check(EndpointClass.DEVICE, clientKey, null).permitted()).isFalse();

        clock.advance(Duration.ofSeconds(61));

        RateLimitDecision decision = rateLimitService.check(EndpointClass.DEVICE, clientKey, null);
        assertThat(decision.permitted()).isTrue();
        assertThat(decision.currentCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Endpoint classes and clients should be counted separately")
    void check_shouldCountPerClassAndClient() {
        for (int i = 0; i < 5; i++) {
            rateLimitService.check(EndpointClass.DEVICE, clientKey, null);
        }

        assertThat(rateLimitService.check(EndpointClass.DEVICE, clientKey, null).permitted()).isFalse();
        assertThat(rateLimitService.check(EndpointClass.TOKEN, clientKey, null).permitted()).isTrue();
        assertThat(rateLimitService.check(EndpointClass.DEVICE, clientKey + "-other", null).permitted()).isTrue();
    }

    @Test
    @DisplayName("The internal service secret should bypass counting")
    void check_shouldBypass_whenSecretMatches() {
        for (int i = 0; i < 20; i++) {
            RateLimitDecision decision = rateLimitService.check(EndpointClass.REVOKE, clientKey, "test-internal-secret");
            assertThat(decision.permitted()).isTrue();
            assertThat(decision.bypassed()).isTrue();
        }

        assertThat(rateLimitService.check(EndpointClass.REVOKE, clientKey, null).currentCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A wrong secret should be counted like any other request")
    void check_shouldCount_whenSecretWrong() {
        RateLimitDecision decision = rateLimitService.check(EndpointClass.REVOKE, clientKey, "guess");

        assertThat(decision.bypassed()).isFalse();
        assertThat(decision.currentCount()).isEqualTo(1);
        assertThat(rateLimitService.isBypass("")).isFalse();
    }
}
