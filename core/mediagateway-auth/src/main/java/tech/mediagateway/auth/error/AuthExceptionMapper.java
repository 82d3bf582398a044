package tech.mediagateway.auth.error;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * JAX-RS exception mapper for AuthException.
 *
 * This centralizes error handling so individual resources don't need try-catch blocks.
 */
@Provider
public class AuthExceptionMapper implements ExceptionMapper<AuthException> {

    @Override
    public Response toResponse(AuthException exception) {
        return AuthErrorResponses.toResponse(exception.getError());
    }
}
