package tech.mediagateway.auth.error;

/**
 * OAuth2 error codes returned in the {@code error} field, with their default HTTP status.
 */
public enum OAuthErrorCode {
    INVALID_REQUEST("invalid_request", 400),
    INVALID_CLIENT("invalid_client", 401),
    INVALID_GRANT("invalid_grant", 400),
    UNAUTHORIZED_CLIENT("unauthorized_client", 400),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", 400),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", 400),
    INVALID_SCOPE("invalid_scope", 400),
    ACCESS_DENIED("access_denied", 400),
    AUTHORIZATION_PENDING("authorization_pending", 400),
    EXPIRED_TOKEN("expired_token", 400),
    INVALID_TOKEN("invalid_token", 401),
    INSUFFICIENT_SCOPE("insufficient_scope", 403),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", 429),
    SERVER_ERROR("server_error", 500);

    private final String value;
    private final int status;

    OAuthErrorCode(String value, int status) {
        this.value = value;
        this.status = status;
    }

    public String value() {
        return value;
    }

    public int status() {
        return status;
    }
}
