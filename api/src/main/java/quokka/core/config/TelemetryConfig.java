package quokka.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Metrics are disabled by default and must be enabled explicitly:
 * <pre>{@code
 * quokka.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "quokka.telemetry")
public interface TelemetryConfig {

    MetricsConfig metrics();

    interface MetricsConfig {

        /**
         * Enable metrics collection with Micrometer.
         */
        @WithDefault("false")
        boolean enabled();
    }
}
