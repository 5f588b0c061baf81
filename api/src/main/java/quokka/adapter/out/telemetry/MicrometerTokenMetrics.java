package quokka.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import quokka.core.config.TelemetryConfig;
import quokka.core.port.out.TokenMetrics;

/**
 * Micrometer-backed token engine metrics.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code quokka.tokens.issued} - Successful token responses by grant type</li>
 *   <li>{@code quokka.grants.failed} - Failed grants by grant type and OAuth error</li>
 *   <li>{@code quokka.keys.signatures} - Signatures by key-material provider</li>
 *   <li>{@code quokka.ciba.requests} - Backchannel authentication requests by outcome</li>
 *   <li>{@code quokka.storage.timeouts} / {@code quokka.storage.failures} - Store errors</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerTokenMetrics implements TokenMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerTokenMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config.metrics().enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordTokensIssued(String grantType) {
        if (!enabled) {
            return;
        }

        Counter.builder("quokka.tokens.issued")
                .description("Token responses issued")
                .tag("grant_type", nullSafe(grantType))
                .register(registry)
                .increment();
    }

    @Override
    public void recordGrantFailure(String grantType, String error) {
        if (!enabled) {
            return;
        }

        Counter.builder("quokka.grants.failed")
                .description("Token requests rejected")
                .tag("grant_type", nullSafe(grantType))
                .tag("error", nullSafe(error))
                .register(registry)
                .increment();
    }

    @Override
    public void recordSignature(String providerName) {
        if (!enabled) {
            return;
        }

        Counter.builder("quokka.keys.signatures")
                .description("JWS signatures produced")
                .tag("provider", nullSafe(providerName))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCibaRequest(String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("quokka.ciba.requests")
                .description("Backchannel authentication requests")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStorageTimeout(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("quokka.storage.timeouts")
                .description("Token store operations that timed out")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStorageFailure(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("quokka.storage.failures")
                .description("Token store operations that failed")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
