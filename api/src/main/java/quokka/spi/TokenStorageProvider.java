package quokka.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import quokka.core.port.out.AuthorizationCodeStore;
import quokka.core.port.out.DPoPNonceStore;
import quokka.core.port.out.ProtocolStateStore;
import quokka.core.port.out.RefreshTokenStore;

/**
 * SPI for the shared, replay-critical token stores.
 *
 * <p>Every store created by a provider must implement its atomic operations
 * as a single conditional update against the backend, never as
 * read-then-write.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (development only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (quokka.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 *   <li>Memory fallback (always available)</li>
 * </ol>
 */
public interface TokenStorageProvider {

    /**
     * Provider name for configuration selection.
     */
    String name();

    /**
     * Priority for automatic selection. Higher is preferred.
     */
    int priority();

    /**
     * Whether the provider can be used.
     */
    boolean isAvailable();

    AuthorizationCodeStore createAuthorizationCodeStore();

    RefreshTokenStore createRefreshTokenStore();

    ProtocolStateStore createProtocolStateStore();

    DPoPNonceStore createDPoPNonceStore();

    /**
     * Health indicator for the readiness check.
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
