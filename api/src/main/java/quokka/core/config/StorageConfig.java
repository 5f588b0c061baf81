package quokka.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for token storage.
 *
 * <p>Configuration prefix: {@code quokka.storage}
 */
@ConfigMapping(prefix = "quokka.storage")
public interface StorageConfig {

    /**
     * Storage provider name.
     *
     * <p>Available providers: redis, memory, or custom SPI name.
     *
     * @return Provider name (default: memory)
     */
    @WithDefault("memory")
    String provider();

    /**
     * Default expiry of protocol correlation state.
     */
    @WithDefault("PT10M")
    Duration protocolStateExpiry();

    /**
     * Redis-specific configuration.
     */
    RedisConfig redis();

    interface RedisConfig {

        /**
         * Key prefix for every key written by the token stores.
         *
         * @return Key prefix (default: quokka:)
         */
        @WithDefault("quokka:")
        String keyPrefix();

        /**
         * Timeout for a single Redis operation.
         */
        @WithDefault("PT2S")
        Duration timeout();
    }
}
