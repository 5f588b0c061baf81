package quokka.adapter.out.storage.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import quokka.core.port.out.DPoPNonceStore;
import quokka.core.util.RandomValues;

/**
 * Redis implementation of DPoP replay and nonce storage.
 *
 * <p>Proof identifiers are recorded with {@code SET NX EX}, so exactly one
 * instance accepts a given proof. Nonces are consumed with GETDEL.
 *
 * <h2>Key Structure</h2>
 * <ul>
 *   <li>{@code {prefix}dpop:jti:{jkt}:{jti}} - Used proof marker</li>
 *   <li>{@code {prefix}dpop:nonce:{nonce}} - Outstanding server nonce</li>
 * </ul>
 */
public class RedisDPoPNonceStore implements DPoPNonceStore {

    private static final int NONCE_BYTES = 16;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final String keyPrefix;

    public RedisDPoPNonceStore(
            ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.timeoutHelper = timeoutHelper;
        this.keyPrefix = keyPrefix + "dpop:";
    }

    @Override
    public Uni<Boolean> tryMarkAsUsed(String proofId, Duration ttl) {
        final var operation = redisDataSource
                .execute("SET", keyPrefix + "jti:" + proofId, "1", "NX", "EX", String.valueOf(Math.max(1, ttl.toSeconds())))
                .map(response -> response != null);
        return timeoutHelper.withTimeout(operation, "tryMarkAsUsed");
    }

    @Override
    public Uni<String> issueNonce(Duration ttl) {
        final var nonce = RandomValues.base64Url(NONCE_BYTES);
        final var operation = valueCommands
                .setex(keyPrefix + "nonce:" + nonce, Math.max(1, ttl.toSeconds()), "1")
                .replaceWith(nonce);
        return timeoutHelper.withTimeout(operation, "issueNonce");
    }

    @Override
    public Uni<Boolean> consumeNonce(String nonce) {
        if (nonce == null) {
            return Uni.createFrom().item(false);
        }
        final var operation = valueCommands.getdel(keyPrefix + "nonce:" + nonce).map(value -> value != null);
        return timeoutHelper.withTimeout(operation, "consumeNonce");
    }
}
