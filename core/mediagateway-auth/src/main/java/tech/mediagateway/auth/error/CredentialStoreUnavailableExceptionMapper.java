package tech.mediagateway.auth.error;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import tech.mediagateway.auth.store.CredentialStoreUnavailableException;

/**
 * Collapses store failures to a generic 503 {@code server_error}.
 * The failing operation is logged, never returned.
 */
@Provider
public class CredentialStoreUnavailableExceptionMapper implements ExceptionMapper<CredentialStoreUnavailableException> {

    @Override
    public Response toResponse(CredentialStoreUnavailableException exception) {
        return AuthErrorResponses.toResponse(new AuthError.StoreUnavailable(exception.getMessage()));
    }
}
