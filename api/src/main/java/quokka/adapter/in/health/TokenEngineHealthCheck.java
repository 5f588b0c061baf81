package quokka.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import quokka.core.service.key.KeyMaterialProviderRegistry;
import quokka.core.service.storage.TokenStorageProviderRegistry;

/**
 * Readiness of the token engine's backends.
 *
 * <p>Ready when the selected token storage provider is available and at
 * least one key-material provider can sign. Each provider contributes its
 * own health data.
 */
@Readiness
@ApplicationScoped
public class TokenEngineHealthCheck implements HealthCheck {

    private final TokenStorageProviderRegistry storageProviders;
    private final KeyMaterialProviderRegistry keyProviders;

    @Inject
    public TokenEngineHealthCheck(
            TokenStorageProviderRegistry storageProviders, KeyMaterialProviderRegistry keyProviders) {
        this.storageProviders = storageProviders;
        this.keyProviders = keyProviders;
    }

    @Override
    public HealthCheckResponse call() {
        final HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("token-engine");

        final var storage = storageProviders.getSelectedProvider();
        var up = storage.isAvailable();
        builder.withData("storage.provider", storage.name());
        final var storageHealth = storage.healthCheck();
        if (storageHealth.isPresent()) {
            up &= storageHealth.get().getStatus() == HealthCheckResponse.Status.UP;
            builder.withData("storage.status", storageHealth.get().getStatus().name());
        }

        final var available = keyProviders.getAvailableProviders();
        builder.withData("keys.providers", available.size());
        for (final var provider : available) {
            provider.healthCheck().ifPresent(health -> builder.withData(
                    "keys." + provider.name(), health.getStatus().name()));
        }
        up &= !available.isEmpty();

        return builder.status(up).build();
    }
}
