package tech.mediagateway.auth.authentication.ratelimit;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthErrorResponses;

import java.util.Optional;

/**
 * JAX-RS filter that applies {@link RateLimitService} to the /auth endpoints.
 *
 * <p>Recognized headers:
 * <ul>
 *   <li>{@code X-Client-ID} - client key for counting</li>
 *   <li>{@code X-Internal-Service} - bypass secret for trusted internal callers</li>
 * </ul>
 *
 * <p>Without the header the {@code client_id} query parameter is the client key,
 * and without either the remote address is.
 *
 * <p>Rejected requests are aborted with 429. Counted requests get
 * {@code X-RateLimit-Limit} and {@code X-RateLimit-Remaining} on the response.
 */
@Provider
@Priority(Priorities.AUTHENTICATION - 100)
public class RateLimitFilter implements ContainerRequestFilter, ContainerResponseFilter {

    public static final String CLIENT_ID_HEADER = "X-Client-ID";
    public static final String INTERNAL_SERVICE_HEADER = "X-Internal-Service";
    public static final String CLIENT_ID_PARAM = "client_id";

    private static final String DECISION_PROPERTY = RateLimitFilter.class.getName() + ".decision";

    @Inject
    RateLimitService rateLimitService;

    @Inject
    HttpServerRequest httpRequest;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        Optional<EndpointClass> endpointClass = EndpointClass.fromPath(requestContext.getUriInfo().getPath());
        if (endpointClass.isEmpty()) {
            return;
        }

        RateLimitDecision decision = rateLimitService.check(
            endpointClass.get(),
            clientKey(requestContext),
            requestContext.getHeaderString(INTERNAL_SERVICE_HEADER));
        requestContext.setProperty(DECISION_PROPERTY, decision);

        if (!decision.permitted()) {
            requestContext.abortWith(AuthErrorResponses.toResponse(new AuthError.RateLimitExceeded(
                decision.limit(), decision.currentCount(), decision.retryAfter())));
        }
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        Object property = requestContext.getProperty(DECISION_PROPERTY);
        if (!(property instanceof RateLimitDecision decision) || decision.bypassed()) {
            return;
        }
        responseContext.getHeaders().putSingle(AuthErrorResponses.RATE_LIMIT_LIMIT_HEADER, decision.limit());
        responseContext.getHeaders().putSingle(AuthErrorResponses.RATE_LIMIT_REMAINING_HEADER, decision.remaining());
    }

    private String clientKey(ContainerRequestContext requestContext) {
        String clientId = requestContext.getHeaderString(CLIENT_ID_HEADER);
        if (clientId != null && !clientId.isBlank()) {
            return "client:" + clientId.trim();
        }
        String clientIdParam = requestContext.getUriInfo().getQueryParameters().getFirst(CLIENT_ID_PARAM);
        if (clientIdParam != null && !clientIdParam.isBlank()) {
            return "client:" + clientIdParam.trim();
        }
        SocketAddress remote = httpRequest.remoteAddress();
        return "ip:" + (remote != null ? remote.host() : "unknown");
    }
}
