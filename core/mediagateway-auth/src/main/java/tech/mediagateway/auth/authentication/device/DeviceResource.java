package tech.mediagateway.auth.authentication.device;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.mediagateway.auth.authentication.AuthConfig;
import tech.mediagateway.auth.authentication.BearerTokenAuthenticator;
import tech.mediagateway.auth.authentication.TokenClaims;
import tech.mediagateway.auth.authentication.TokenResponse;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthException;

/**
 * Device authorization endpoints (RFC 8628).
 *
 * POST /auth/device          - device requests a code pair
 * POST /auth/device/approve  - signed-in user approves the user code
 * POST /auth/device/deny     - signed-in user denies the user code
 * GET  /auth/device/poll     - device polls for its tokens
 */
@Path("/auth/device")
@Tag(name = "Device Authorization", description = "RFC 8628 device authorization grant")
@Produces(MediaType.APPLICATION_JSON)
public class DeviceResource {

    @Inject
    AuthConfig authConfig;

    @Inject
    DeviceAuthorizationService deviceAuthorizationService;

    @Inject
    BearerTokenAuthenticator authenticator;

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Start a device authorization")
    public DeviceAuthorizationResponse requestAuthorization(
            @Parameter(description = "OAuth client ID")
            @FormParam("client_id") String clientId,

            @Parameter(description = "Requested scopes (space-separated)")
            @FormParam("scope") String scope
    ) {
        DeviceCode deviceCode = deviceAuthorizationService.requestAuthorization(clientId, scope);
        return DeviceAuthorizationResponse.from(deviceCode, authConfig.device().codeTtl().toSeconds());
    }

    @POST
    @Path("/approve")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Approve a device by its user code")
    public DecisionResponse approve(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            UserCodeRequest request
    ) {
        TokenClaims user = authenticator.authenticate(authHeader);
        DeviceCode approved = deviceAuthorizationService.approve(requireUserCode(request), user.subject());
        return new DecisionResponse(approved.status().name().toLowerCase(), approved.clientId());
    }

    @POST
    @Path("/deny")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Deny a device by its user code")
    public DecisionResponse deny(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            UserCodeRequest request
    ) {
        TokenClaims user = authenticator.authenticate(authHeader);
        DeviceCode denied = deviceAuthorizationService.deny(requireUserCode(request), user.subject());
        return new DecisionResponse(denied.status().name().toLowerCase(), denied.clientId());
    }

    @GET
    @Path("/poll")
    @Operation(summary = "Poll for tokens of a device authorization")
    public TokenResponse poll(
            @Parameter(description = "Device code from the authorization response")
            @QueryParam("device_code") String deviceCode,

            @Parameter(description = "OAuth client ID, checked against the device code when present")
            @QueryParam("client_id") String clientId
    ) {
        return TokenResponse.from(deviceAuthorizationService.poll(deviceCode, clientId));
    }

    private static String requireUserCode(UserCodeRequest request) {
        if (request == null || request.user_code() == null || request.user_code().isBlank()) {
            throw new AuthException(new AuthError.InvalidRequest("user_code is required"));
        }
        return request.user_code();
    }

    public record UserCodeRequest(String user_code) {}

    public record DecisionResponse(String status, String client_id) {}
}
