package quokka.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.token.RefreshToken;
import quokka.core.port.out.RefreshTokenStore;
import quokka.core.util.SecureHash;

/**
 * Redis implementation of refresh token storage.
 *
 * <p>Tokens are stored as JSON with a TTL matching their absolute expiry.
 * A per-session set indexes handles so a session can be revoked at once.
 * {@link #consume} uses GETDEL, so two concurrent redemptions of a one-time
 * token cannot both succeed.
 *
 * <h2>Key Structure</h2>
 * <ul>
 *   <li>{@code {prefix}rt:{handle}} - Token record</li>
 *   <li>{@code {prefix}rt:consumed:{handle}} - Tombstone of a redeemed token</li>
 *   <li>{@code {prefix}rt:session:{sessionId}} - Set of handles for a session</li>
 * </ul>
 */
public class RedisRefreshTokenStore implements RefreshTokenStore {

    private static final Logger LOG = Logger.getLogger(RedisRefreshTokenStore.class);
    private static final RedisRecordCodec<RefreshToken> CODEC = new RedisRecordCodec<>(RefreshToken.class);

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final String keyPrefix;
    private final Clock clock;

    public RedisRefreshTokenStore(
            ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper, String keyPrefix, Clock clock) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        this.keyPrefix = keyPrefix + "rt:";
        this.clock = clock;
    }

    @Override
    public Uni<Void> store(RefreshToken token) {
        final var ttl = ttlSeconds(token.absoluteExpiresAt());
        Uni<Void> operation = valueCommands.setex(tokenKey(token.handle()), ttl, CODEC.encode(token));
        if (token.sessionId() != null) {
            final var sessionKey = sessionKey(token.sessionId());
            operation = operation
                    .flatMap(ignored -> setCommands.sadd(sessionKey, token.handle()))
                    .flatMap(ignored -> keyCommands.expire(sessionKey, Duration.ofSeconds(ttl)))
                    .replaceWithVoid();
        }
        return timeoutHelper.withTimeout(
                operation.invoke(() ->
                        LOG.debugf("Stored refresh token %s", SecureHash.fingerprint(token.handle()))),
                "store");
    }

    @Override
    public Uni<Optional<RefreshToken>> find(String handle) {
        final var operation =
                valueCommands.get(tokenKey(handle)).map(json -> Optional.ofNullable(json).map(CODEC::decode));
        return timeoutHelper.withTimeout(operation, "find");
    }

    @Override
    public Uni<Optional<RefreshToken>> consume(String handle) {
        final var operation = valueCommands.getdel(tokenKey(handle)).flatMap(json -> {
            if (json == null) {
                return Uni.createFrom().item(Optional.<RefreshToken>empty());
            }
            final var consumed = CODEC.decode(json);
            return valueCommands
                    .setex(keyPrefix + "consumed:" + handle, ttlSeconds(consumed.absoluteExpiresAt()), json)
                    .replaceWith(Optional.of(consumed));
        });
        return timeoutHelper.withTimeout(operation, "consume");
    }

    @Override
    public Uni<Optional<RefreshToken>> findConsumed(String handle) {
        final var operation = valueCommands
                .get(keyPrefix + "consumed:" + handle)
                .map(json -> Optional.ofNullable(json).map(CODEC::decode));
        return timeoutHelper.withTimeout(operation, "findConsumed");
    }

    @Override
    public Uni<Integer> revokeSession(String sessionId) {
        if (sessionId == null) {
            return Uni.createFrom().item(0);
        }
        final var sessionKey = sessionKey(sessionId);
        final var operation = setCommands.smembers(sessionKey).flatMap(handles -> {
            if (handles.isEmpty()) {
                return Uni.createFrom().item(0);
            }
            final var keys = handles.stream().map(this::tokenKey).toArray(String[]::new);
            return keyCommands
                    .del(keys)
                    .call(() -> keyCommands.del(sessionKey))
                    .map(Integer::intValue);
        });
        return timeoutHelper.withTimeout(operation, "revokeSession");
    }

    private String tokenKey(String handle) {
        return keyPrefix + handle;
    }

    private String sessionKey(String sessionId) {
        return keyPrefix + "session:" + sessionId;
    }

    private long ttlSeconds(Instant expiresAt) {
        return Math.max(1, Duration.between(clock.instant(), expiresAt).toSeconds());
    }
}
