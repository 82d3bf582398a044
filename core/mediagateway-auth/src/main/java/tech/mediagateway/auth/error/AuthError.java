package tech.mediagateway.auth.error;

import java.time.Duration;

/**
 * Sealed interface representing every failure the authorization core reports.
 *
 * <p>Each variant carries its {@link ErrorKind}, the OAuth2 {@link OAuthErrorCode}
 * sent on the wire, and a description. {@link AuthErrorResponses} is the single
 * place that turns an error into an HTTP response.
 *
 * <p>For server-side kinds the description is internal detail: it is logged but
 * never returned to the client.
 */
public sealed interface AuthError permits
    AuthError.InvalidRequest,
    AuthError.UnsupportedResponseType,
    AuthError.UnsupportedGrantType,
    AuthError.InvalidClient,
    AuthError.UnauthorizedClient,
    AuthError.InvalidScope,
    AuthError.InvalidGrant,
    AuthError.CodeExpired,
    AuthError.CodeReused,
    AuthError.InvalidToken,
    AuthError.TokenExpired,
    AuthError.TokenRevoked,
    AuthError.Unauthenticated,
    AuthError.InsufficientScope,
    AuthError.AuthorizationPending,
    AuthError.AccessDenied,
    AuthError.DeviceCodeExpired,
    AuthError.DeviceCodeNotFound,
    AuthError.InvalidUserCode,
    AuthError.AlreadyDecided,
    AuthError.RateLimitExceeded,
    AuthError.StoreUnavailable,
    AuthError.ConfigurationInvalid,
    AuthError.Internal {

    ErrorKind kind();

    OAuthErrorCode code();

    /**
     * Human-readable description of the error.
     */
    String description();

    /**
     * HTTP status to answer with.
     */
    default int status() {
        return code().status();
    }

    /**
     * Description safe to return to the client.
     */
    default String publicDescription() {
        return kind().isServerSide() ? "Internal server error" : description();
    }

    record InvalidRequest(String description) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_REQUEST;
        }
    }

    record UnsupportedResponseType(String responseType) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.UNSUPPORTED_RESPONSE_TYPE;
        }

        @Override
        public String description() {
            return "Only 'code' response type is supported";
        }
    }

    record UnsupportedGrantType(String grantType) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.UNSUPPORTED_GRANT_TYPE;
        }

        @Override
        public String description() {
            return "Unsupported grant type: " + grantType;
        }
    }

    /**
     * Unknown client. The client id is not echoed back.
     */
    record InvalidClient(String clientId) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_CLIENT;
        }

        @Override
        public String description() {
            return "Unknown client";
        }
    }

    record UnauthorizedClient(String clientId, String grantType) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.INSUFFICIENT_PERMISSION;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.UNAUTHORIZED_CLIENT;
        }

        @Override
        public String description() {
            return "Client is not authorized for grant type " + grantType;
        }
    }

    record InvalidScope(String scope) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.INSUFFICIENT_PERMISSION;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_SCOPE;
        }

        @Override
        public String description() {
            return "Scope not allowed: " + scope;
        }
    }

    /**
     * Bad authorization code, PKCE verifier, client binding or redirect binding.
     */
    record InvalidGrant(String description) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_GRANT;
        }
    }

    record CodeExpired() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_EXPIRED;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_GRANT;
        }

        @Override
        public String description() {
            return "Authorization code has expired";
        }
    }

    /**
     * An authorization code was presented after it had been used.
     */
    record CodeReused() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_REUSED;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_GRANT;
        }

        @Override
        public String description() {
            return "Authorization code has already been used";
        }
    }

    record InvalidToken(String description) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_TOKEN;
        }
    }

    record TokenExpired() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_EXPIRED;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_TOKEN;
        }

        @Override
        public String description() {
            return "Token has expired";
        }
    }

    record TokenRevoked() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_REUSED;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_TOKEN;
        }

        @Override
        public String description() {
            return "Token has been revoked";
        }
    }

    record Unauthenticated() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_TOKEN;
        }

        @Override
        public String description() {
            return "Bearer token required";
        }
    }

    record InsufficientScope(String requiredScope) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.INSUFFICIENT_PERMISSION;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INSUFFICIENT_SCOPE;
        }

        @Override
        public String description() {
            return "Token lacks required scope: " + requiredScope;
        }
    }

    record AuthorizationPending() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.AUTHORIZATION_PENDING;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.AUTHORIZATION_PENDING;
        }

        @Override
        public String description() {
            return "The user has not yet approved the device";
        }
    }

    record AccessDenied() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.ACCESS_DENIED;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.ACCESS_DENIED;
        }

        @Override
        public String description() {
            return "The user denied the authorization request";
        }
    }

    record DeviceCodeExpired() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_EXPIRED;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.EXPIRED_TOKEN;
        }

        @Override
        public String description() {
            return "The device code has expired";
        }
    }

    record DeviceCodeNotFound() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_GRANT;
        }

        @Override
        public String description() {
            return "Device code not found";
        }

        @Override
        public int status() {
            return 404;
        }
    }

    /**
     * Unknown or expired user code. Both cases share one message.
     */
    record InvalidUserCode() implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CREDENTIAL_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_GRANT;
        }

        @Override
        public String description() {
            return "Invalid or expired user code";
        }
    }

    record AlreadyDecided(String decidedStatus) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.STATE_CONFLICT;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.INVALID_GRANT;
        }

        @Override
        public String description() {
            return "Device authorization has already been decided";
        }
    }

    /**
     * @param limit configured limit for the endpoint class
     * @param currentCount count in the current window, including this request
     * @param retryAfter time until the window resets
     */
    record RateLimitExceeded(long limit, long currentCount, Duration retryAfter) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.RATE_LIMITED;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.RATE_LIMIT_EXCEEDED;
        }

        @Override
        public String description() {
            return "Rate limit exceeded: " + currentCount + "/" + limit + " requests, retry after "
                + retryAfter.toSeconds() + "s";
        }
    }

    record StoreUnavailable(String detail) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.STORE_UNAVAILABLE;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.SERVER_ERROR;
        }

        @Override
        public String description() {
            return detail;
        }

        @Override
        public int status() {
            return 503;
        }

        @Override
        public String publicDescription() {
            return "Service temporarily unavailable";
        }
    }

    record ConfigurationInvalid(String detail) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.CONFIGURATION_INVALID;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.SERVER_ERROR;
        }

        @Override
        public String description() {
            return detail;
        }
    }

    record Internal(String detail) implements AuthError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.INTERNAL;
        }

        @Override
        public OAuthErrorCode code() {
            return OAuthErrorCode.SERVER_ERROR;
        }

        @Override
        public String description() {
            return detail;
        }
    }
}
