package tech.mediagateway.auth.authentication;

/**
 * Token endpoint response body.
 */
public record TokenResponse(
    String access_token,
    String refresh_token,
    String token_type,
    long expires_in,
    String scope
) {

    public static TokenResponse from(TokenPair pair) {
        return new TokenResponse(
            pair.accessToken().token(),
            pair.refreshToken().token(),
            "Bearer",
            pair.accessToken().lifetime().toSeconds(),
            Scopes.join(pair.scopes()));
    }
}
