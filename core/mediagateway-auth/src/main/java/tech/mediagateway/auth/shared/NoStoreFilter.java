package tech.mediagateway.auth.shared;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;

/**
 * JAX-RS filter that forbids caching of every /auth response.
 *
 * Token and code responses must never be stored by browsers or proxies
 * (RFC 6749 section 5.1).
 */
@Provider
@Priority(Priorities.HEADER_DECORATOR)
public class NoStoreFilter implements ContainerResponseFilter {

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        String path = requestContext.getUriInfo().getPath();
        if (!path.startsWith("/auth") && !path.startsWith("auth")) {
            return;
        }
        responseContext.getHeaders().putSingle(HttpHeaders.CACHE_CONTROL, "no-store");
        responseContext.getHeaders().putSingle("Pragma", "no-cache");
    }
}
