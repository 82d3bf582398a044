package tech.mediagateway.auth.error;

/**
 * Carries an {@link AuthError} out of the service layer.
 *
 * <p>Resources let it propagate; {@link AuthExceptionMapper} turns it into a response.
 */
public class AuthException extends RuntimeException {

    private final AuthError error;

    public AuthException(AuthError error) {
        super(error.description());
        this.error = error;
    }

    public AuthException(AuthError error, Throwable cause) {
        super(error.description(), cause);
        this.error = error;
    }

    public AuthError getError() {
        return error;
    }
}
