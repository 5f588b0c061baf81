package quokka.core.service.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import quokka.core.config.StorageConfig;
import quokka.core.port.out.AuthorizationCodeStore;
import quokka.core.port.out.DPoPNonceStore;
import quokka.core.port.out.ProtocolStateStore;
import quokka.core.port.out.RefreshTokenStore;
import quokka.spi.TokenStorageProvider;

/**
 * Registry for token storage providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (quokka.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
@ApplicationScoped
public class TokenStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(TokenStorageProviderRegistry.class);

    private final Instance<TokenStorageProvider> providers;
    private final StorageConfig config;

    private volatile TokenStorageProvider selectedProvider;

    @Inject
    public TokenStorageProviderRegistry(Instance<TokenStorageProvider> providers, StorageConfig config) {
        this.providers = providers;
        this.config = config;
    }

    public AuthorizationCodeStore authorizationCodeStore() {
        return getSelectedProvider().createAuthorizationCodeStore();
    }

    public RefreshTokenStore refreshTokenStore() {
        return getSelectedProvider().createRefreshTokenStore();
    }

    public ProtocolStateStore protocolStateStore() {
        return getSelectedProvider().createProtocolStateStore();
    }

    public DPoPNonceStore dpopNonceStore() {
        return getSelectedProvider().createDPoPNonceStore();
    }

    /**
     * Get the selected storage provider.
     *
     * @return Selected provider
     */
    public synchronized TokenStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private TokenStorageProvider selectProvider() {
        final var configuredProvider = config.provider();
        final var availableProviders = getAvailableProviders();

        LOG.debugf(
                "Available token storage providers: %s",
                availableProviders.stream().map(TokenStorageProvider::name).toList());

        Optional<TokenStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured token storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("memory")) {
            LOG.warnf("Configured token storage provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using token storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No token storage providers available");
    }

    /**
     * Available providers, highest priority first (for health checks).
     */
    public List<TokenStorageProvider> getAvailableProviders() {
        return providers.stream()
                .filter(TokenStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(TokenStorageProvider::priority).reversed())
                .toList();
    }
}
