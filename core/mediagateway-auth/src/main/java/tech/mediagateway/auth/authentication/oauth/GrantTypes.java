package tech.mediagateway.auth.authentication.oauth;

/**
 * Grant type identifiers accepted at the token endpoint.
 */
public final class GrantTypes {

    public static final String AUTHORIZATION_CODE = "authorization_code";
    public static final String REFRESH_TOKEN = "refresh_token";
    public static final String DEVICE_CODE = "urn:ietf:params:oauth:grant-type:device_code";

    private GrantTypes() {
    }
}
