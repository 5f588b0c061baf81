package quokka.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.token.AuthorizationCode;
import quokka.core.port.out.AuthorizationCodeStore;
import quokka.core.util.SecureHash;

/**
 * Redis implementation of authorization code storage.
 *
 * <p>Codes are stored as JSON with a TTL matching their expiry.
 * {@link #consume} uses GETDEL for an atomic retrieve-and-delete, then leaves
 * a tombstone for replay detection.
 *
 * <h2>Key Structure</h2>
 * <ul>
 *   <li>{@code {prefix}code:{code}} - Unredeemed code</li>
 *   <li>{@code {prefix}code:consumed:{code}} - Tombstone of a redeemed code</li>
 * </ul>
 */
public class RedisAuthorizationCodeStore implements AuthorizationCodeStore {

    private static final Logger LOG = Logger.getLogger(RedisAuthorizationCodeStore.class);
    private static final RedisRecordCodec<AuthorizationCode> CODEC = new RedisRecordCodec<>(AuthorizationCode.class);

    private final ReactiveValueCommands<String, String> valueCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final String keyPrefix;
    private final Clock clock;

    public RedisAuthorizationCodeStore(
            ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper, String keyPrefix, Clock clock) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.timeoutHelper = timeoutHelper;
        this.keyPrefix = keyPrefix + "code:";
        this.clock = clock;
    }

    @Override
    public Uni<Void> store(AuthorizationCode code) {
        final var operation = valueCommands
                .setex(keyPrefix + code.code(), ttlSeconds(code.expiresAt()), CODEC.encode(code))
                .invoke(() -> LOG.debugf("Stored authorization code %s", SecureHash.fingerprint(code.code())));
        return timeoutHelper.withTimeout(operation, "store");
    }

    @Override
    public Uni<Optional<AuthorizationCode>> consume(String code) {
        final var operation = valueCommands.getdel(keyPrefix + code).flatMap(json -> {
            if (json == null) {
                return Uni.createFrom().item(Optional.<AuthorizationCode>empty());
            }
            final var consumed = CODEC.decode(json);
            return valueCommands
                    .setex(keyPrefix + "consumed:" + code, ttlSeconds(consumed.expiresAt()), json)
                    .replaceWith(Optional.of(consumed));
        });
        return timeoutHelper.withTimeout(operation, "consume");
    }

    @Override
    public Uni<Optional<AuthorizationCode>> findConsumed(String code) {
        final var operation = valueCommands
                .get(keyPrefix + "consumed:" + code)
                .map(json -> Optional.ofNullable(json).map(CODEC::decode));
        return timeoutHelper.withTimeout(operation, "findConsumed");
    }

    private long ttlSeconds(Instant expiresAt) {
        return Math.max(1, Duration.between(clock.instant(), expiresAt).toSeconds());
    }
}
