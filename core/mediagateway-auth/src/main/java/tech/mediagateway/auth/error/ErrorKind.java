package tech.mediagateway.auth.error;

/**
 * Classification of authorization failures, independent of the wire code.
 */
public enum ErrorKind {
    /** Bad code, token, client, PKCE verifier or request parameter. */
    CREDENTIAL_INVALID,
    /** Code, token or device code past its lifetime. */
    CREDENTIAL_EXPIRED,
    /** A single-use credential presented again. */
    CREDENTIAL_REUSED,
    /** Device authorization already decided. */
    STATE_CONFLICT,
    INSUFFICIENT_PERMISSION,
    RATE_LIMITED,
    /** RFC 8628 polling states: not failures of the request, but of the grant so far. */
    AUTHORIZATION_PENDING,
    ACCESS_DENIED,
    STORE_UNAVAILABLE,
    CONFIGURATION_INVALID,
    INTERNAL;

    public boolean isServerSide() {
        return this == STORE_UNAVAILABLE || this == CONFIGURATION_INVALID || this == INTERNAL;
    }
}
