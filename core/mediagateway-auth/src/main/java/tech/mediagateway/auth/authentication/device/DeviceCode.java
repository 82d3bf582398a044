package tech.mediagateway.auth.authentication.device;

import java.time.Instant;
import java.util.List;

/**
 * A device authorization, stored under {@code devicecode:{deviceCode}} with a
 * reverse mapping {@code devicecode:user:{userCode}} holding the device code.
 *
 * @param userId set only once approved
 * @param interval minimum polling interval in seconds
 */
public record DeviceCode(
    String deviceCode,
    String userCode,
    String clientId,
    List<String> scopes,
    DeviceCodeStatus status,
    String userId,
    String verificationUri,
    int interval,
    Instant createdAt,
    Instant expiresAt
) {

    /**
     * The stored status, or EXPIRED once the lifetime has ended.
     */
    public DeviceCodeStatus effectiveStatus(Instant now) {
        return now.isBefore(expiresAt) ? status : DeviceCodeStatus.EXPIRED;
    }

    public DeviceCode approve(String approvingUserId) {
        return new DeviceCode(deviceCode, userCode, clientId, scopes, DeviceCodeStatus.APPROVED,
            approvingUserId, verificationUri, interval, createdAt, expiresAt);
    }

    public DeviceCode deny() {
        return new DeviceCode(deviceCode, userCode, clientId, scopes, DeviceCodeStatus.DENIED,
            null, verificationUri, interval, createdAt, expiresAt);
    }
}
