package quokka.adapter.out.storage.redis;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.port.out.TokenMetrics;
import quokka.spi.StorageProviderException;

/**
 * Applies the configured timeout and failure handling to Redis operations.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: timeouts and failures surface as
 *       {@link StorageProviderException}. Used for every replay-critical
 *       operation; a failed consume must never be mistaken for a miss.</li>
 *   <li>{@link #withTimeoutFallback} - Fail-soft: returns a fallback on
 *       timeout or failure. Used for lookups whose absence is harmless.</li>
 * </ul>
 *
 * <h2>Metrics</h2>
 * Records timeouts and non-timeout failures separately, tagged by store and
 * operation.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final TokenMetrics metrics;
    private final String storeName;

    /**
     * @param timeout   the timeout for Redis operations
     * @param metrics   metrics sink, may be null
     * @param storeName store name for logging and metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, TokenMetrics metrics, String storeName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeName = storeName;
    }

    /**
     * Apply the timeout to an operation that must not silently degrade.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     * @return a Uni that fails with {@link StorageProviderException} on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, storeName);
                })
                .onFailure(e -> !(e instanceof StorageProviderException))
                .transform(error -> {
                    LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return new StorageProviderException(
                            "Redis operation failed: " + operationName + " in " + storeName, error);
                });
    }

    /**
     * Apply the timeout with a fallback value on timeout or failure.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param fallback      supplier for the fallback value
     * @param <T>           the result type
     * @return a Uni that returns the fallback on timeout or failure
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (fallback): {0} in {1} after {2}",
                            operationName, storeName, timeout);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (fallback): {0} in {1}: {2}",
                            operationName, storeName, error.getMessage());
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStorageTimeout(storeName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStorageFailure(storeName, operationName);
        }
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends StorageProviderException {
        private final String operation;
        private final String store;

        public RedisTimeoutException(String operation, String store) {
            super("Redis operation timeout: " + operation + " in " + store);
            this.operation = operation;
            this.store = store;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the store where the timeout occurred. */
        public String getStore() {
            return store;
        }
    }
}
