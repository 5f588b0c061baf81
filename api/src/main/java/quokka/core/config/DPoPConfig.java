package quokka.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for DPoP proof validation.
 *
 * <p>Configuration prefix: {@code quokka.dpop}
 */
@ConfigMapping(prefix = "quokka.dpop")
public interface DPoPConfig {

    /**
     * Maximum age of a proof, measured from its {@code iat}.
     */
    @WithDefault("PT60S")
    Duration proofLifetime();

    /**
     * Tolerated clock difference between client and server.
     */
    @WithDefault("PT5S")
    Duration clockSkew();

    /**
     * Server nonce configuration.
     */
    NonceConfig nonce();

    interface NonceConfig {

        /**
         * Require a server-issued nonce in every proof.
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Lifetime of an issued nonce.
         */
        @WithDefault("PT5M")
        Duration lifetime();
    }
}
