package tech.mediagateway.auth.store;

/**
 * Key namespace of the credential store.
 */
public final class CredentialKeys {

    public static final String PKCE = "pkce:";
    public static final String AUTHORIZATION_CODE = "authcode:";
    public static final String DEVICE_CODE = "devicecode:";
    public static final String DEVICE_USER_CODE = "devicecode:user:";
    public static final String SESSION = "session:";
    public static final String USER_SESSIONS = "sessions:user:";
    public static final String REVOKED = "revoked:";
    public static final String RATE_LIMIT = "ratelimit:";

    private CredentialKeys() {
    }

    public static String pkce(String state) {
        return PKCE + state;
    }

    public static String authorizationCode(String code) {
        return AUTHORIZATION_CODE + code;
    }

    public static String deviceCode(String deviceCode) {
        return DEVICE_CODE + deviceCode;
    }

    public static String deviceUserCode(String userCode) {
        return DEVICE_USER_CODE + userCode;
    }

    public static String session(String jti) {
        return SESSION + jti;
    }

    public static String userSessions(String userId) {
        return USER_SESSIONS + userId;
    }

    public static String revoked(String jti) {
        return REVOKED + jti;
    }

    public static String rateLimit(String endpointClass, String clientKey, long windowStart) {
        return RATE_LIMIT + endpointClass + ":" + clientKey + ":" + windowStart;
    }
}
