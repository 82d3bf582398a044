package tech.mediagateway.auth.authentication.device;

/**
 * Device authorization response (RFC 8628 section 3.2).
 */
public record DeviceAuthorizationResponse(
    String device_code,
    String user_code,
    String verification_uri,
    String verification_uri_complete,
    long expires_in,
    int interval
) {

    public static DeviceAuthorizationResponse from(DeviceCode deviceCode, long expiresIn) {
        return new DeviceAuthorizationResponse(
            deviceCode.deviceCode(),
            deviceCode.userCode(),
            deviceCode.verificationUri(),
            deviceCode.verificationUri() + "?user_code=" + deviceCode.userCode(),
            expiresIn,
            deviceCode.interval());
    }
}
