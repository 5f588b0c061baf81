package quokka.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for token issuance.
 *
 * <p>Configuration prefix: {@code quokka.token}
 */
@ConfigMapping(prefix = "quokka.token")
public interface TokenConfig {

    /**
     * Issuer identifier placed in the {@code iss} claim of every token.
     *
     * @return Issuer URL (default: http://localhost:8080)
     */
    @WithDefault("http://localhost:8080")
    String issuer();

    /**
     * Upper bound for one token endpoint request, covering every store,
     * provider and notification call it makes.
     *
     * @return Operation timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration operationTimeout();

    /**
     * Lifetime of authorization codes issued to the login journey.
     *
     * @return Code lifetime (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration authorizationCodeLifetime();
}
