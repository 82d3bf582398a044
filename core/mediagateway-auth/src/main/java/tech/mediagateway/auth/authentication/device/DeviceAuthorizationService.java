package tech.mediagateway.auth.authentication.device;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.authentication.AuthConfig;
import tech.mediagateway.auth.authentication.Scopes;
import tech.mediagateway.auth.authentication.TokenIssuanceService;
import tech.mediagateway.auth.authentication.TokenPair;
import tech.mediagateway.auth.authentication.oauth.GrantTypes;
import tech.mediagateway.auth.authentication.oauth.OAuthClient;
import tech.mediagateway.auth.authentication.oauth.OAuthClientRegistry;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthException;
import tech.mediagateway.auth.store.CredentialKeys;
import tech.mediagateway.auth.store.CredentialStore;
import tech.mediagateway.auth.store.StoredRecordCodec;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Device authorization grant (RFC 8628).
 *
 * <p>The primary record {@code devicecode:{deviceCode}} is the only source trusted
 * for issuing tokens. The reverse mapping {@code devicecode:user:{userCode}} only
 * resolves what a user typed to a device code. Both keys are created together in
 * one store operation and deleted together in one store operation.
 *
 * <p>Status transitions are compare-and-set writes of the record that was read,
 * so two concurrent decisions cannot both succeed, and an approved record is
 * consumed by exactly one poll.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc8628">RFC 8628 - Device Authorization Grant</a>
 */
@ApplicationScoped
public class DeviceAuthorizationService {

    private static final Logger LOG = Logger.getLogger(DeviceAuthorizationService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    @Inject
    AuthConfig authConfig;

    @Inject
    OAuthClientRegistry clientRegistry;

    @Inject
    UserCodeGenerator userCodeGenerator;

    @Inject
    CredentialStore store;

    @Inject
    StoredRecordCodec codec;

    @Inject
    TokenIssuanceService tokenIssuance;

    @Inject
    Clock clock;

    /**
     * Start a device authorization for a client.
     */
    public DeviceCode requestAuthorization(String clientId, String scope) {
        OAuthClient client = clientRegistry.requireGrantType(clientId, GrantTypes.DEVICE_CODE);
        List<String> scopes = Scopes.parse(scope);
        if (!client.areScopesAllowed(scopes)) {
            throw new AuthException(new AuthError.InvalidScope(scope));
        }

        AuthConfig.DeviceConfig config = authConfig.device();
        for (int attempt = 1; attempt <= config.userCodeAttempts(); attempt++) {
            Instant now = clock.instant();
            DeviceCode deviceCode = new DeviceCode(
                generateDeviceCode(),
                userCodeGenerator.generate(),
                client.clientId(),
                scopes,
                DeviceCodeStatus.PENDING,
                null,
                config.verificationUri(),
                (int) config.pollingInterval().toSeconds(),
                now,
                now.plus(config.codeTtl()));

            Map<String, String> entries = new LinkedHashMap<>();
            entries.put(CredentialKeys.deviceCode(deviceCode.deviceCode()), codec.encode(deviceCode));
            entries.put(CredentialKeys.deviceUserCode(deviceCode.userCode()), deviceCode.deviceCode());

            if (store.putAllIfAbsent(entries, config.codeTtl().plus(authConfig.expiredRetention()))) {
                LOG.infof("Device authorization started for client %s (user code %s)",
                    client.clientId(), deviceCode.userCode());
                return deviceCode;
            }
            LOG.debugf("User code collision on attempt %d, regenerating", attempt);
        }

        throw new AuthException(new AuthError.Internal(
            "No free user code after " + config.userCodeAttempts() + " attempts"));
    }

    /**
     * Approve a pending device authorization on behalf of an authenticated user.
     * A second decision on the same code fails.
     */
    public DeviceCode approve(String userCode, String userId) {
        DeviceCode approved = decide(userCode, record -> record.approve(userId));
        LOG.infof("Device authorization approved by user %s for client %s", userId, approved.clientId());
        return approved;
    }

    /**
     * Deny a pending device authorization.
     */
    public DeviceCode deny(String userCode, String userId) {
        DeviceCode denied = decide(userCode, DeviceCode::deny);
        LOG.infof("Device authorization denied by user %s for client %s", userId, denied.clientId());
        return denied;
    }

    private DeviceCode decide(String userCode, UnaryOperator<DeviceCode> transition) {
        String normalized = userCodeGenerator.normalize(userCode);
        String userKey = CredentialKeys.deviceUserCode(normalized);
        String deviceCodeValue = store.get(userKey)
            .orElseThrow(() -> new AuthException(new AuthError.InvalidUserCode()));

        String key = CredentialKeys.deviceCode(deviceCodeValue);
        Optional<String> stored = store.get(key);
        if (stored.isEmpty()) {
            // Primary gone: the mapping is dangling
            store.delete(userKey);
            throw new AuthException(new AuthError.InvalidUserCode());
        }

        DeviceCode record = codec.decode(stored.get(), DeviceCode.class);
        DeviceCodeStatus status = record.effectiveStatus(clock.instant());
        if (status == DeviceCodeStatus.EXPIRED) {
            store.delete(key, userKey);
            throw new AuthException(new AuthError.InvalidUserCode());
        }
        if (status != DeviceCodeStatus.PENDING) {
            throw new AuthException(new AuthError.AlreadyDecided(status.name()));
        }

        DeviceCode updated = transition.apply(record);
        if (!store.compareAndSet(key, stored.get(), codec.encode(updated))) {
            throw new AuthException(new AuthError.AlreadyDecided("CONCURRENT"));
        }
        return updated;
    }

    /**
     * Poll a device authorization.
     *
     * <p>Pending and denied authorizations fail with their RFC 8628 error. An
     * approved authorization is consumed, both keys deleted in the same operation,
     * before tokens are minted; a later poll gets not-found.
     *
     * @param clientId optional; when given it must match the requesting client
     */
    public TokenPair poll(String deviceCode, String clientId) {
        if (deviceCode == null || deviceCode.isBlank()) {
            throw new AuthException(new AuthError.InvalidRequest("device_code is required"));
        }

        String key = CredentialKeys.deviceCode(deviceCode);
        String stored = store.get(key)
            .orElseThrow(() -> new AuthException(new AuthError.DeviceCodeNotFound()));
        DeviceCode record = codec.decode(stored, DeviceCode.class);

        if (clientId != null && !record.clientId().equals(clientId)) {
            throw new AuthException(new AuthError.InvalidGrant("Client mismatch"));
        }

        String userKey = CredentialKeys.deviceUserCode(record.userCode());
        switch (record.effectiveStatus(clock.instant())) {
            case PENDING:
                throw new AuthException(new AuthError.AuthorizationPending());
            case DENIED:
                throw new AuthException(new AuthError.AccessDenied());
            case EXPIRED:
                store.delete(key, userKey);
                throw new AuthException(new AuthError.DeviceCodeExpired());
            case APPROVED:
            default:
                break;
        }

        if (!store.compareAndDelete(key, stored, userKey)) {
            // Another poll consumed it first
            throw new AuthException(new AuthError.DeviceCodeNotFound());
        }

        return tokenIssuance.issue(record.userId(), record.scopes(), null, "device:" + record.clientId());
    }

    private static String generateDeviceCode() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
