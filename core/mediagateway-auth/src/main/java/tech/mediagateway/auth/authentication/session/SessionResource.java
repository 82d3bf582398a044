package tech.mediagateway.auth.authentication.session;

import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.mediagateway.auth.authentication.BearerTokenAuthenticator;
import tech.mediagateway.auth.authentication.TokenClaims;

import java.time.Instant;
import java.util.List;

/**
 * Session endpoints for the signed-in user.
 */
@Path("/auth/sessions")
@Tag(name = "Sessions", description = "Active sessions of the current user")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    @Inject
    SessionService sessionService;

    @Inject
    BearerTokenAuthenticator authenticator;

    @GET
    @Operation(summary = "List active sessions")
    public List<SessionSummary> list(@HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader) {
        TokenClaims user = authenticator.authenticate(authHeader);
        return sessionService.activeSessions(user.subject()).stream()
            .map(session -> new SessionSummary(session.jti(), session.deviceLabel(), session.createdAt(),
                session.expiresAt()))
            .toList();
    }

    /**
     * Sign out everywhere: revoke every refresh token of the caller.
     */
    @DELETE
    @Operation(summary = "Revoke all sessions of the current user")
    public InvalidationResponse invalidateAll(@HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader) {
        TokenClaims user = authenticator.authenticate(authHeader);
        return new InvalidationResponse(sessionService.invalidateAllSessions(user.subject(), null));
    }

    public record SessionSummary(String id, String device, Instant createdAt, Instant expiresAt) {}

    public record InvalidationResponse(int revoked) {}
}
