package quokka.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import quokka.core.port.out.AuthorizationCodeStore;
import quokka.core.port.out.DPoPNonceStore;
import quokka.core.port.out.ProtocolStateStore;
import quokka.core.port.out.RefreshTokenStore;
import quokka.core.service.storage.TokenStorageProviderRegistry;

/**
 * CDI producer for the shared token stores.
 *
 * <p>Delegates to the {@link TokenStorageProviderRegistry}, which selects the
 * storage provider based on configuration and availability. Platform teams
 * can plug in another backend by implementing
 * {@link quokka.spi.TokenStorageProvider} and registering it via CDI.
 */
@ApplicationScoped
public class TokenStoreProducer {

    private final TokenStorageProviderRegistry registry;

    @Inject
    public TokenStoreProducer(TokenStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public AuthorizationCodeStore authorizationCodeStore() {
        return registry.authorizationCodeStore();
    }

    @Produces
    @ApplicationScoped
    public RefreshTokenStore refreshTokenStore() {
        return registry.refreshTokenStore();
    }

    @Produces
    @ApplicationScoped
    public ProtocolStateStore protocolStateStore() {
        return registry.protocolStateStore();
    }

    @Produces
    @ApplicationScoped
    public DPoPNonceStore dpopNonceStore() {
        return registry.dpopNonceStore();
    }
}
