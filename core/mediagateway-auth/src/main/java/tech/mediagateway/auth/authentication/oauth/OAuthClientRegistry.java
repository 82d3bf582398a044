package tech.mediagateway.auth.authentication.oauth;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.authentication.AuthConfig;
import tech.mediagateway.auth.error.AuthError;
import tech.mediagateway.auth.error.AuthException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Clients registered through {@code mediagateway.auth.clients.*}.
 */
@ApplicationScoped
public class OAuthClientRegistry {

    private static final Logger LOG = Logger.getLogger(OAuthClientRegistry.class);

    @Inject
    AuthConfig authConfig;

    private Map<String, OAuthClient> clients;

    @PostConstruct
    void init() {
        this.clients = authConfig.clients().entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> new OAuthClient(
                entry.getKey(),
                entry.getValue().redirectUris().orElse(List.of()),
                List.copyOf(entry.getValue().allowedScopes()),
                List.copyOf(entry.getValue().grantTypes()))));
        LOG.infof("Registered %d OAuth clients: %s", clients.size(), clients.keySet());
    }

    public Optional<OAuthClient> findByClientId(String clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(clientId));
    }

    /**
     * Look up a client, failing with invalid_client when it is not registered.
     */
    public OAuthClient require(String clientId) {
        return findByClientId(clientId).orElseThrow(() -> {
            LOG.debugf("Unknown client_id: %s", clientId);
            return new AuthException(new AuthError.InvalidClient(clientId));
        });
    }

    /**
     * Look up a client and check it may use a grant type.
     */
    public OAuthClient requireGrantType(String clientId, String grantType) {
        OAuthClient client = require(clientId);
        if (!client.isGrantTypeAllowed(grantType)) {
            throw new AuthException(new AuthError.UnauthorizedClient(clientId, grantType));
        }
        return client;
    }
}
