package quokka.core.cache;

import java.util.Optional;
import java.util.function.Function;

/**
 * Local in-memory cache with TTL support.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return Optional containing the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Gets a value, computing and caching it when absent.
     *
     * @param key    the cache key
     * @param loader computes the value on a miss
     * @return the cached or computed value
     */
    V get(K key, Function<? super K, ? extends V> loader);

    void put(K key, V value);

    void invalidate(K key);

    void invalidateAll();

    long estimatedSize();
}
