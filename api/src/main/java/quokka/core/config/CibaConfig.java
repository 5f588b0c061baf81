package quokka.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for Client-Initiated Backchannel Authentication.
 *
 * <p>Configuration prefix: {@code quokka.ciba}
 */
@ConfigMapping(prefix = "quokka.ciba")
public interface CibaConfig {

    /**
     * Maximum length of a binding message.
     */
    @WithDefault("64")
    int bindingMessageMaxLength();

    /**
     * Client notification (ping and push mode) delivery settings.
     */
    NotificationConfig notification();

    interface NotificationConfig {

        /**
         * Retries after a failed delivery. Zero disables retrying.
         */
        @WithDefault("2")
        int retries();

        /**
         * Initial backoff between retries.
         */
        @WithDefault("PT1S")
        Duration backoff();

        /**
         * Timeout of a single delivery attempt.
         */
        @WithDefault("PT5S")
        Duration timeout();
    }
}
