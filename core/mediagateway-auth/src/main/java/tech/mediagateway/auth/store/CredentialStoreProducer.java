package tech.mediagateway.auth.store;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * CDI producer that selects the CredentialStore implementation
 * based on configuration.
 */
@ApplicationScoped
public class CredentialStoreProducer {

    private static final Logger LOG = Logger.getLogger(CredentialStoreProducer.class);

    @Inject
    CredentialStoreConfig config;

    @Inject
    Instance<InMemoryCredentialStore> inMemoryStore;

    @Inject
    Instance<RedisCredentialStore> redisStore;

    @Produces
    @ApplicationScoped
    public CredentialStore credentialStore() {
        CredentialStore.StoreType type = config.type();
        LOG.infof("Initializing credential store: type=%s, operationTimeout=%s", type, config.operationTimeout());

        return switch (type) {
            case MEMORY -> {
                LOG.warn("Using in-memory credential store (Caffeine); state is not shared across instances");
                yield inMemoryStore.get();
            }
            case REDIS -> {
                LOG.info("Using Redis credential store");
                yield redisStore.get();
            }
        };
    }
}
