package quokka.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import quokka.core.config.StorageConfig;
import quokka.core.port.out.AuthorizationCodeStore;
import quokka.core.port.out.DPoPNonceStore;
import quokka.core.port.out.ProtocolStateStore;
import quokka.core.port.out.RefreshTokenStore;
import quokka.spi.TokenStorageProvider;

/**
 * In-memory token storage provider.
 *
 * <p>This provider is always available and serves as a fallback when
 * Redis or other storage backends are unavailable.
 *
 * <p><strong>Warning:</strong> In-memory storage requires sticky sessions
 * when running multiple Quokka instances, and single-use guarantees for
 * codes, refresh tokens and DPoP proofs only hold within one instance.
 */
@ApplicationScoped
public class InMemoryStorageProvider implements TokenStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final Clock clock;
    private final StorageConfig config;
    private final AtomicBoolean warningLogged = new AtomicBoolean(false);

    private volatile InMemoryAuthorizationCodeStore codeStore;
    private volatile InMemoryRefreshTokenStore refreshTokenStore;
    private volatile InMemoryProtocolStateStore protocolStateStore;
    private volatile InMemoryDPoPNonceStore nonceStore;

    @Inject
    public InMemoryStorageProvider(Clock clock, StorageConfig config) {
        this.clock = clock;
        this.config = config;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized AuthorizationCodeStore createAuthorizationCodeStore() {
        logWarningOnce();
        if (codeStore == null) {
            codeStore = new InMemoryAuthorizationCodeStore(clock);
        }
        return codeStore;
    }

    @Override
    public synchronized RefreshTokenStore createRefreshTokenStore() {
        logWarningOnce();
        if (refreshTokenStore == null) {
            refreshTokenStore = new InMemoryRefreshTokenStore(clock);
        }
        return refreshTokenStore;
    }

    @Override
    public synchronized ProtocolStateStore createProtocolStateStore() {
        if (protocolStateStore == null) {
            protocolStateStore = new InMemoryProtocolStateStore(clock, config.protocolStateExpiry());
        }
        return protocolStateStore;
    }

    @Override
    public synchronized DPoPNonceStore createDPoPNonceStore() {
        if (nonceStore == null) {
            nonceStore = new InMemoryDPoPNonceStore(clock);
        }
        return nonceStore;
    }

    private void logWarningOnce() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Token storage is in-memory only!");
            LOG.warn("  Codes and refresh tokens are single-use per instance only.");
            LOG.warn("  Sticky sessions are REQUIRED when running multiple Quokka instances.");
            LOG.warn("  Configure quokka.storage.provider=redis for production.");
            LOG.warn("========================================================================");
        }
    }

    @Scheduled(every = "60s", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void purgeExpired() {
        var removed = 0;
        if (codeStore != null) {
            removed += codeStore.purgeExpired();
        }
        if (refreshTokenStore != null) {
            removed += refreshTokenStore.purgeExpired();
        }
        if (protocolStateStore != null) {
            removed += protocolStateStore.purgeExpired();
        }
        if (nonceStore != null) {
            removed += nonceStore.purgeExpired();
        }
        if (removed > 0) {
            LOG.debugf("Purged %d expired in-memory token storage entries", removed);
        }
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("token-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("authorizationCodes", codeStore != null ? codeStore.size() : 0)
                .withData("refreshTokens", refreshTokenStore != null ? refreshTokenStore.size() : 0)
                .build());
    }
}
