package tech.mediagateway.auth.store;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the credential store.
 */
@ConfigMapping(prefix = "mediagateway.store")
public interface CredentialStoreConfig {

    /**
     * Store backend type: MEMORY or REDIS.
     */
    @WithDefault("MEMORY")
    CredentialStore.StoreType type();

    /**
     * Upper bound for a single store round trip. A call that exceeds it fails
     * as store-unavailable.
     */
    @WithDefault("PT2S")
    Duration operationTimeout();

    /**
     * Maximum number of entries held by the in-memory store.
     */
    @WithDefault("100000")
    long maxSize();

    /**
     * Redis configuration (only used when type=REDIS).
     */
    Redis redis();

    interface Redis {
        /**
         * Prefix prepended to every key, for sharing a Redis database.
         */
        Optional<String> keyPrefix();
    }
}
