package tech.mediagateway.auth.authentication;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.Map;

/**
 * Publishes the token verification key so services consuming access tokens
 * can verify them.
 */
@Path("/.well-known")
@Tag(name = "Discovery", description = "Key discovery endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class WellKnownResource {

    @Inject
    JwtKeyService jwtKeyService;

    /**
     * JSON Web Key Set (JWKS) endpoint.
     */
    @GET
    @Path("/jwks.json")
    @Operation(summary = "Get JSON Web Key Set for token verification")
    @APIResponse(responseCode = "200", description = "JWKS document")
    public Map<String, Object> jwks() {
        return jwtKeyService.getJwks();
    }
}
