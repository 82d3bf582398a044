package tech.mediagateway.auth.authentication.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.authentication.AuthConfig;
import tech.mediagateway.auth.authentication.BearerTokenAuthenticator;
import tech.mediagateway.auth.authentication.TokenClaims;
import tech.mediagateway.auth.authentication.TokenPair;
import tech.mediagateway.auth.authentication.TokenResponse;
import tech.mediagateway.auth.authentication.device.DeviceAuthorizationService;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * OAuth2 endpoints implementing:
 * - Authorization Code flow with PKCE
 * - Refresh token grant with rotation
 * - Device code grant at the token endpoint (RFC 8628)
 * - Token revocation (RFC 7009)
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749">RFC 6749 - OAuth 2.0</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/auth")
@Tag(name = "OAuth2 Authorization", description = "Authorization code, token and revocation endpoints")
public class AuthorizationResource {

    private static final Logger LOG = Logger.getLogger(AuthorizationResource.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    AuthorizationCodeService authorizationCodeService;

    @Inject
    RefreshTokenService refreshTokenService;

    @Inject
    DeviceAuthorizationService deviceAuthorizationService;

    @Inject
    OAuthClientRegistry clientRegistry;

    @Inject
    BearerTokenAuthenticator authenticator;

    // ==================== Authorization Endpoint ====================

    /**
     * OAuth2 Authorization endpoint.
     *
     * With a bearer token the user is already authenticated: a code is issued and
     * the browser redirected. Without one, the validated request is parked under
     * its state and the client is told to authenticate the user and call
     * /auth/authorize/complete.
     *
     * GET /auth/authorize?
     *   response_type=code
     *   &client_id=tv-app
     *   &redirect_uri=https://tv.mediagateway.io/callback
     *   &scope=read write
     *   &state=xyz123
     *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
     *   &code_challenge_method=S256
     */
    @GET
    @Path("/authorize")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Start authorization code flow")
    public Response authorize(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,

            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "OAuth client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "URI to redirect after authorization")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "Requested scopes (space-separated)")
            @QueryParam("scope") String scope,

            @Parameter(description = "Client state for CSRF protection")
            @QueryParam("state") String state,

            @Parameter(description = "PKCE code challenge")
            @QueryParam("code_challenge") String codeChallenge,

            @Parameter(description = "PKCE challenge method, only S256")
            @QueryParam("code_challenge_method") @DefaultValue("S256") String codeChallengeMethod
    ) {
        AuthorizationRequest request = new AuthorizationRequest(responseType, clientId, redirectUri, scope,
            codeChallenge, codeChallengeMethod, state);

        if (authenticator.hasBearerToken(authHeader)) {
            TokenClaims user = authenticator.authenticate(authHeader);
            return redirectWithCode(authorizationCodeService.authorize(request, user.subject()));
        }

        PkceChallenge pending = authorizationCodeService.beginAuthorization(request);
        return Response.ok(new AuthorizationPendingResponse(
            pending.state(),
            "/auth/authorize/complete",
            authConfig.pkce().challengeTtl().toSeconds()
        )).build();
    }

    /**
     * Complete a parked authorization request once the user has authenticated.
     */
    @POST
    @Path("/authorize/complete")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Complete a pending authorization for the authenticated user")
    public Response completeAuthorization(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            @Parameter(description = "State returned by /auth/authorize")
            @FormParam("state") String state
    ) {
        TokenClaims user = authenticator.authenticate(authHeader);
        return redirectWithCode(authorizationCodeService.completeAuthorization(state, user.subject()));
    }

    // ==================== Token Endpoint ====================

    /**
     * OAuth2 Token endpoint.
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange a grant for tokens")
    public TokenResponse token(
            @Parameter(description = "Grant type")
            @FormParam("grant_type") String grantType,

            @Parameter(description = "Authorization code (authorization_code grant)")
            @FormParam("code") String code,

            @Parameter(description = "Redirect URI (must match the authorization request)")
            @FormParam("redirect_uri") String redirectUri,

            @Parameter(description = "Client ID")
            @FormParam("client_id") String clientId,

            @Parameter(description = "PKCE code verifier")
            @FormParam("code_verifier") String codeVerifier,

            @Parameter(description = "Refresh token (refresh_token grant)")
            @FormParam("refresh_token") String refreshToken,

            @Parameter(description = "Device code (device_code grant)")
            @FormParam("device_code") String deviceCode,

            @Parameter(description = "Requested scopes (refresh_token grant, narrowing only)")
            @FormParam("scope") String scope
    ) {
        if (grantType == null || grantType.isEmpty()) {
            throw new AuthException(new AuthError.InvalidRequest("grant_type is required"));
        }

        TokenPair tokens = switch (grantType) {
            case GrantTypes.AUTHORIZATION_CODE -> {
                clientRegistry.requireGrantType(clientId, grantType);
                yield authorizationCodeService.exchange(code, codeVerifier, redirectUri, clientId);
            }
            case GrantTypes.REFRESH_TOKEN -> {
                if (clientId != null) {
                    clientRegistry.requireGrantType(clientId, grantType);
                }
                yield refreshTokenService.refresh(refreshToken, scope);
            }
            case GrantTypes.DEVICE_CODE -> {
                if (clientId != null) {
                    clientRegistry.requireGrantType(clientId, grantType);
                }
                yield deviceAuthorizationService.poll(deviceCode, clientId);
            }
            default -> throw new AuthException(new AuthError.UnsupportedGrantType(grantType));
        };

        LOG.debugf("Token grant %s succeeded", grantType);
        return TokenResponse.from(tokens);
    }

    // ==================== Revocation Endpoint ====================

    /**
     * Token revocation (RFC 7009). Answers 200 whether or not the token was valid.
     */
    @POST
    @Path("/revoke")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Revoke an access or refresh token")
    public Response revoke(
            @Parameter(description = "Token to revoke")
            @FormParam("token") String token,

            @Parameter(description = "access_token or refresh_token; both are tried regardless")
            @FormParam("token_type_hint") String tokenTypeHint
    ) {
        if (token == null || token.isBlank()) {
            throw new AuthException(new AuthError.InvalidRequest("token is required"));
        }
        boolean revoked = refreshTokenService.revoke(token);
        LOG.debugf("Revocation request (hint=%s) revoked=%s", tokenTypeHint, revoked);
        return Response.ok().build();
    }

    // ==================== Helper Methods ====================

    private Response redirectWithCode(AuthorizationCodeService.IssuedCode issued) {
        String redirectUri = issued.code().redirectUri();
        StringBuilder location = new StringBuilder(redirectUri)
            .append(redirectUri.contains("?") ? '&' : '?')
            .append("code=").append(encode(issued.code().code()));
        if (issued.state() != null) {
            location.append("&state=").append(encode(issued.state()));
        }
        return Response.seeOther(URI.create(location.toString())).build();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Returned by /auth/authorize when the user still has to authenticate.
     */
    public record AuthorizationPendingResponse(String state, String complete_uri, long expires_in) {}
}
