package quokka.core.service.key;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import quokka.core.config.KeysConfig;
import quokka.spi.KeyMaterialProvider;

/**
 * Registry for key-material providers.
 *
 * <p>Discovers providers via CDI. Keys remember the provider that generated
 * them, so signing always resolves by name; only generation goes through
 * default selection.
 *
 * <p>Default selection order:
 * <ol>
 *   <li>Configured provider (quokka.keys.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class KeyMaterialProviderRegistry {

    private static final Logger LOG = Logger.getLogger(KeyMaterialProviderRegistry.class);

    private final Instance<KeyMaterialProvider> providers;
    private final KeysConfig config;

    @Inject
    public KeyMaterialProviderRegistry(Instance<KeyMaterialProvider> providers, KeysConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Resolve the provider that owns a key.
     *
     * @param name provider name recorded on the key
     * @return the provider
     * @throws KeyProviderUnavailableException if the provider is unknown or unavailable
     */
    public KeyMaterialProvider require(String name) {
        final var provider = find(name)
                .orElseThrow(() ->
                        new KeyProviderUnavailableException(name, "Key-material provider not registered: " + name));
        if (!provider.isAvailable()) {
            throw new KeyProviderUnavailableException(name, "Key-material provider unavailable: " + name);
        }
        return provider;
    }

    public Optional<KeyMaterialProvider> find(String name) {
        return providers.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Select the provider for new keys.
     *
     * @param requested explicitly requested provider, or null
     * @return the provider
     * @throws KeyProviderUnavailableException if the requested provider, or
     *     every provider, is unavailable
     */
    public KeyMaterialProvider select(String requested) {
        if (requested != null) {
            return require(requested);
        }

        final var availableProviders = getAvailableProviders();
        final var configuredProvider = config.provider();
        final var configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent()) {
            return configured.get();
        }

        if (availableProviders.isEmpty()) {
            throw new KeyProviderUnavailableException(configuredProvider, "No key-material providers available");
        }

        final var provider = availableProviders.get(0);
        LOG.warnf(
                "Configured key-material provider '%s' is not available, falling back to %s (priority: %d)",
                configuredProvider, provider.name(), provider.priority());
        return provider;
    }

    /**
     * Available providers, highest priority first.
     */
    public List<KeyMaterialProvider> getAvailableProviders() {
        return providers.stream()
                .filter(KeyMaterialProvider::isAvailable)
                .sorted(Comparator.comparingInt(KeyMaterialProvider::priority).reversed())
                .toList();
    }

    /**
     * All registered providers (for health checks).
     */
    public List<KeyMaterialProvider> getAllProviders() {
        return providers.stream().toList();
    }
}
