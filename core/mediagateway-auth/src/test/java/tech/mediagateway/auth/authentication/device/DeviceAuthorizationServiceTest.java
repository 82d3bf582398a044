package tech.mediagateway.auth.authentication.device;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.mediagateway.auth.authentication.TokenPair;
import tech.mediagateway.auth.authentication.TokenService;
import tech.mediagateway.auth.authentication.session.SessionRecord;
import tech.mediagateway.auth.authentication.session.SessionService;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthException;
import tech.mediagateway.auth.store.CredentialKeys;
import tech.mediagateway.auth.store.CredentialStore;
import tech.mediagateway.auth.test.MutableClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the device authorization grant.
 */
@Tag("integration")
@QuarkusTest
class DeviceAuthorizationServiceTest {

    private static final String CLIENT_ID = "tv-app";

    @Inject
    DeviceAuthorizationService deviceService;

    @Inject
    TokenService tokenService;

    @Inject
    SessionService sessionService;

    @Inject
    CredentialStore store;

    @Inject
    MutableClock clock;

    @AfterEach
    void resetClock() {
        clock.reset();
    }

    // ==================== Request ====================

    @Test
    @DisplayName("Request should create a pending authorization with both store keys")
    void requestAuthorization_shouldCreatePendingCode() {
        // Act
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read write");

        // Assert
        assertThat(code.status()).isEqualTo(DeviceCodeStatus.PENDING);
        assertThat(code.userCode()).matches("[A-Z]{4}-[A-Z]{4}");
        assertThat(code.scopes()).containsExactly("read", "write");
        assertThat(code.interval()).isEqualTo(5);
        assertThat(Duration.between(code.createdAt(), code.expiresAt())).isEqualTo(Duration.ofMinutes(15));
        assertThat(store.get(CredentialKeys.deviceCode(code.deviceCode()))).isPresent();
        assertThat(store.get(CredentialKeys.deviceUserCode(code.userCode()))).contains(code.deviceCode());
    }

    @Test
    @DisplayName("Request should reject clients without the device grant and unknown scopes")
    void requestAuthorization_shouldFail_whenClientOrScopeNotAllowed() {
        assertThatThrownBy(() -> deviceService.requestAuthorization("web-app", "read"))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.UnauthorizedClient.class));
        assertThatThrownBy(() -> deviceService.requestAuthorization(CLIENT_ID, "profile"))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.InvalidScope.class));
    }

    // ==================== Poll ====================

    @Test
    @DisplayName("Poll should report pending until the user decides")
    void poll_shouldReportPending_whenUndecided() {
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read");

        assertThatThrownBy(() -> deviceService.poll(code.deviceCode(), CLIENT_ID))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.AuthorizationPending.class));
    }

    @Test
    @DisplayName("Poll after approval should issue tokens once and remove both keys")
    void poll_shouldIssueTokensOnce_whenApproved() {
        // Arrange
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read write");
        deviceService.approve(code.userCode().toLowerCase(Locale.ROOT), "viewer-1");

        // Act
        TokenPair pair = deviceService.poll(code.deviceCode(), CLIENT_ID);

        // Assert
        assertThat(tokenService.verifyAccessToken(pair.accessToken().token()).subject()).isEqualTo("viewer-1");
        assertThat(pair.scopes()).containsExactly("read", "write");
        assertThat(sessionService.findSession(pair.refreshToken().jti()))
            .map(SessionRecord::deviceLabel)
            .contains("device:" + CLIENT_ID);
        assertThat(store.get(CredentialKeys.deviceCode(code.deviceCode()))).isEmpty();
        assertThat(store.get(CredentialKeys.deviceUserCode(code.userCode()))).isEmpty();

        assertThatThrownBy(() -> deviceService.poll(code.deviceCode(), CLIENT_ID))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.DeviceCodeNotFound.class));
    }

    @Test
    @DisplayName("Poll after denial should report access denied")
    void poll_shouldReportDenied_whenDenied() {
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read");
        deviceService.deny(code.userCode(), "viewer-2");

        assertThatThrownBy(() -> deviceService.poll(code.deviceCode(), CLIENT_ID))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.AccessDenied.class));
    }

    @Test
    @DisplayName("Poll after the lifetime should report expiry and remove both keys")
    void poll_shouldReportExpired_whenLifetimeEnded() {
        // Arrange
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read");
        clock.advance(Duration.ofMinutes(15).plusSeconds(5));

        // Act & Assert
        assertThatThrownBy(() -> deviceService.poll(code.deviceCode(), CLIENT_ID))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.DeviceCodeExpired.class));
        assertThat(store.get(CredentialKeys.deviceUserCode(code.userCode()))).isEmpty();
        assertThatThrownBy(() -> deviceService.poll(code.deviceCode(), CLIENT_ID))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.DeviceCodeNotFound.class));
    }

    @Test
    @DisplayName("Poll by another client should be rejected")
    void poll_shouldFail_whenClientMismatch() {
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read");

        assertThatThrownBy(() -> deviceService.poll(code.deviceCode(), "web-app"))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.InvalidGrant.class));
    }

    @Test
    @DisplayName("Concurrent polls of an approved code should issue exactly one token pair")
    void poll_shouldHaveSingleWinner_whenRacing() throws Exception {
        // Arrange
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read");
        deviceService.approve(code.userCode(), "viewer-3");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            // Act
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        deviceService.poll(code.deviceCode(), CLIENT_ID);
                        return true;
                    } catch (AuthException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            // Assert
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    // ==================== Decisions ====================

    @Test
    @DisplayName("A second approval should fail as already decided")
    void approve_shouldFail_whenAlreadyApproved() {
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read");
        DeviceCode approved = deviceService.approve(code.userCode(), "viewer-4");

        assertThat(approved.status()).isEqualTo(DeviceCodeStatus.APPROVED);
        assertThat(approved.userId()).isEqualTo("viewer-4");
        assertThatThrownBy(() -> deviceService.approve(code.userCode(), "viewer-4"))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isEqualTo(new AuthError.AlreadyDecided("APPROVED")));
    }

    @Test
    @DisplayName("Approval after denial should fail as already decided")
    void approve_shouldFail_whenDenied() {
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read");
        deviceService.deny(code.userCode(), "viewer-5");

        assertThatThrownBy(() -> deviceService.approve(code.userCode(), "viewer-5"))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isEqualTo(new AuthError.AlreadyDecided("DENIED")));
    }

    @Test
    @DisplayName("Unknown and expired user codes should fail with the same error")
    void approve_shouldFailGenerically_whenCodeUnknownOrExpired() {
        assertThatThrownBy(() -> deviceService.approve("ZZZZ-ZZZZ", "viewer-6"))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.InvalidUserCode.class));

        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read");
        clock.advance(Duration.ofMinutes(15).plusSeconds(5));

        assertThatThrownBy(() -> deviceService.approve(code.userCode(), "viewer-6"))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.InvalidUserCode.class));
        assertThat(store.get(CredentialKeys.deviceCode(code.deviceCode()))).isEmpty();
    }

    @Test
    @DisplayName("A dangling user code mapping should be removed on lookup")
    void approve_shouldRemoveDanglingMapping() {
        DeviceCode code = deviceService.requestAuthorization(CLIENT_ID, "read");
        store.delete(CredentialKeys.deviceCode(code.deviceCode()));

        assertThatThrownBy(() -> deviceService.approve(code.userCode(), "viewer-7"))
            .isInstanceOfSatisfying(AuthException.class, e ->
                assertThat(e.getError()).isInstanceOf(AuthError.InvalidUserCode.class));
        assertThat(store.get(CredentialKeys.deviceUserCode(code.userCode()))).isEmpty();
    }
}
