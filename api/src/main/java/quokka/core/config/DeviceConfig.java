package quokka.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the device authorization grant.
 *
 * <p>Configuration prefix: {@code quokka.device}
 */
@ConfigMapping(prefix = "quokka.device")
public interface DeviceConfig {

    /**
     * Page where users enter their user code.
     */
    @WithDefault("http://localhost:8080/device")
    String verificationUri();
}
