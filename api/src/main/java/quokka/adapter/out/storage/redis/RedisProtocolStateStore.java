package quokka.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import quokka.core.model.state.ProtocolState;
import quokka.core.port.out.ProtocolStateStore;
import quokka.core.util.RandomValues;

/**
 * Redis implementation of protocol state storage.
 *
 * <p>State is written with SETEX and read without locking; readers on other
 * instances may briefly miss a fresh write.
 */
public class RedisProtocolStateStore implements ProtocolStateStore {

    private static final RedisRecordCodec<ProtocolState> CODEC = new RedisRecordCodec<>(ProtocolState.class);
    private static final int CORRELATION_ID_BYTES = 24;

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final String keyPrefix;
    private final Duration defaultExpiry;
    private final Clock clock;

    public RedisProtocolStateStore(
            ReactiveRedisDataSource redisDataSource,
            RedisTimeoutHelper timeoutHelper,
            String keyPrefix,
            Duration defaultExpiry,
            Clock clock) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        this.keyPrefix = keyPrefix + "state:";
        this.defaultExpiry = defaultExpiry;
        this.clock = clock;
    }

    @Override
    public Uni<String> store(String protocol, Map<String, String> payload, Duration expiresIn) {
        final var ttl = expiresIn != null ? expiresIn : defaultExpiry;
        final var now = clock.instant();
        final var correlationId = RandomValues.base64Url(CORRELATION_ID_BYTES);
        final var state = new ProtocolState(correlationId, protocol, payload, now, now.plus(ttl));
        final var operation = valueCommands
                .setex(keyPrefix + correlationId, Math.max(1, ttl.toSeconds()), CODEC.encode(state))
                .replaceWith(correlationId);
        return timeoutHelper.withTimeout(operation, "store");
    }

    @Override
    public Uni<Optional<ProtocolState>> get(String correlationId) {
        final var operation = valueCommands
                .get(keyPrefix + correlationId)
                .map(json -> Optional.ofNullable(json).map(CODEC::decode));
        return timeoutHelper.withTimeout(operation, "get");
    }

    @Override
    public Uni<Void> remove(String correlationId) {
        return timeoutHelper.withTimeout(
                keyCommands.del(keyPrefix + correlationId).replaceWithVoid(), "remove");
    }
}
