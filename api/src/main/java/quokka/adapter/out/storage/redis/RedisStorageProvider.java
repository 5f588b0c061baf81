package quokka.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import quokka.core.config.StorageConfig;
import quokka.core.port.out.AuthorizationCodeStore;
import quokka.core.port.out.DPoPNonceStore;
import quokka.core.port.out.ProtocolStateStore;
import quokka.core.port.out.RefreshTokenStore;
import quokka.core.port.out.TokenMetrics;
import quokka.spi.TokenStorageProvider;

/**
 * Redis-based token storage provider.
 *
 * <p>This is the recommended provider for production deployments. Every
 * replay-critical operation is a single Redis command, so single-use
 * guarantees hold across instances.
 */
@ApplicationScoped
public class RedisStorageProvider implements TokenStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisStorageProvider.class);
    private static final int PRIORITY = 100;

    private enum AvailabilityState {
        CHECKING,
        AVAILABLE,
        UNAVAILABLE
    }

    private final ReactiveRedisDataSource redisDataSource;
    private final StorageConfig config;
    private final TokenMetrics metrics;
    private final Clock clock;
    private final AtomicReference<AvailabilityState> availabilityState =
            new AtomicReference<>(AvailabilityState.CHECKING);

    private volatile RedisAuthorizationCodeStore codeStore;
    private volatile RedisRefreshTokenStore refreshTokenStore;
    private volatile RedisProtocolStateStore protocolStateStore;
    private volatile RedisDPoPNonceStore nonceStore;

    @Inject
    public RedisStorageProvider(
            ReactiveRedisDataSource redisDataSource, StorageConfig config, TokenMetrics metrics, Clock clock) {
        this.redisDataSource = redisDataSource;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    void checkAvailability() {
        if (!"redis".equals(config.provider())) {
            availabilityState.set(AvailabilityState.UNAVAILABLE);
            return;
        }
        redisDataSource
                .key(String.class)
                .exists("test-connection")
                .ifNoItem()
                .after(Duration.ofSeconds(5))
                .fail()
                .subscribe()
                .with(
                        result -> {
                            availabilityState.set(AvailabilityState.AVAILABLE);
                            LOG.info("Redis token storage is available");
                        },
                        error -> {
                            availabilityState.set(AvailabilityState.UNAVAILABLE);
                            LOG.warnf("Redis token storage is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return availabilityState.get() == AvailabilityState.AVAILABLE;
    }

    @Override
    public synchronized AuthorizationCodeStore createAuthorizationCodeStore() {
        if (codeStore == null) {
            codeStore = new RedisAuthorizationCodeStore(
                    redisDataSource, timeoutHelper("authorization-codes"), keyPrefix(), clock);
        }
        return codeStore;
    }

    @Override
    public synchronized RefreshTokenStore createRefreshTokenStore() {
        if (refreshTokenStore == null) {
            refreshTokenStore =
                    new RedisRefreshTokenStore(redisDataSource, timeoutHelper("refresh-tokens"), keyPrefix(), clock);
        }
        return refreshTokenStore;
    }

    @Override
    public synchronized ProtocolStateStore createProtocolStateStore() {
        if (protocolStateStore == null) {
            protocolStateStore = new RedisProtocolStateStore(
                    redisDataSource,
                    timeoutHelper("protocol-state"),
                    keyPrefix(),
                    config.protocolStateExpiry(),
                    clock);
        }
        return protocolStateStore;
    }

    @Override
    public synchronized DPoPNonceStore createDPoPNonceStore() {
        if (nonceStore == null) {
            nonceStore = new RedisDPoPNonceStore(redisDataSource, timeoutHelper("dpop-nonces"), keyPrefix());
        }
        return nonceStore;
    }

    private RedisTimeoutHelper timeoutHelper(String storeName) {
        return new RedisTimeoutHelper(config.redis().timeout(), metrics, storeName);
    }

    private String keyPrefix() {
        return config.redis().keyPrefix();
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var state = availabilityState.get();
        if (state == AvailabilityState.AVAILABLE) {
            return Optional.of(HealthCheckResponse.named("token-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", keyPrefix())
                    .build());
        }
        if (!"redis".equals(config.provider())) {
            return Optional.empty();
        }
        final var error = state == AvailabilityState.CHECKING ? "Availability check in progress" : "Redis not available";
        return Optional.of(HealthCheckResponse.named("token-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", error)
                .build());
    }
}
