package tech.mediagateway.auth.authentication.oauth;

import java.util.Collection;
import java.util.List;

/**
 * A pre-registered OAuth client.
 *
 * @param clientId unique client identifier used in OAuth flows
 * @param redirectUris allowed redirect URIs, matched exactly
 * @param allowedScopes scopes the client may request
 * @param grantTypes grant types the client may use
 */
public record OAuthClient(
    String clientId,
    List<String> redirectUris,
    List<String> allowedScopes,
    List<String> grantTypes
) {

    /**
     * Check if a redirect URI is allowed for this client.
     */
    public boolean isRedirectUriAllowed(String uri) {
        if (redirectUris == null || uri == null) {
            return false;
        }
        return redirectUris.contains(uri);
    }

    /**
     * Check if a grant type is allowed for this client.
     */
    public boolean isGrantTypeAllowed(String grantType) {
        if (grantTypes == null || grantType == null) {
            return false;
        }
        return grantTypes.contains(grantType);
    }

    /**
     * Check if every requested scope is allowed for this client.
     */
    public boolean areScopesAllowed(Collection<String> scopes) {
        return allowedScopes != null && allowedScopes.containsAll(scopes);
    }
}
