package quokka.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.token.RefreshToken;
import quokka.core.port.out.RefreshTokenStore;
import quokka.core.util.SecureHash;

/**
 * In-memory implementation of refresh token storage.
 *
 * <p>This implementation is intended for development and testing only.
 * Tokens are lost on restart and not shared across instances.
 */
public class InMemoryRefreshTokenStore implements RefreshTokenStore {

    private static final Logger LOG = Logger.getLogger(InMemoryRefreshTokenStore.class);

    private final ConcurrentMap<String, RefreshToken> tokens = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RefreshToken> consumed = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRefreshTokenStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Void> store(RefreshToken token) {
        return Uni.createFrom().item(() -> {
            tokens.put(token.handle(), token);
            LOG.debugf("Stored refresh token %s", SecureHash.fingerprint(token.handle()));
            return null;
        });
    }

    @Override
    public Uni<Optional<RefreshToken>> find(String handle) {
        return Uni.createFrom().item(() -> Optional.ofNullable(tokens.get(handle)));
    }

    @Override
    public Uni<Optional<RefreshToken>> consume(String handle) {
        return Uni.createFrom().item(() -> {
            final var entry = tokens.remove(handle);
            if (entry == null) {
                return Optional.<RefreshToken>empty();
            }
            consumed.put(handle, entry);
            return Optional.of(entry);
        });
    }

    @Override
    public Uni<Optional<RefreshToken>> findConsumed(String handle) {
        return Uni.createFrom().item(() -> Optional.ofNullable(consumed.get(handle))
                .filter(entry -> !entry.isExpired(clock.instant())));
    }

    @Override
    public Uni<Integer> revokeSession(String sessionId) {
        return Uni.createFrom().item(() -> {
            if (sessionId == null) {
                return 0;
            }
            final var before = tokens.size();
            tokens.values().removeIf(token -> Objects.equals(token.sessionId(), sessionId));
            return before - tokens.size();
        });
    }

    /**
     * Drop expired tokens and tombstones.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        final var now = clock.instant();
        final var before = tokens.size() + consumed.size();
        tokens.values().removeIf(token -> token.isExpired(now));
        consumed.values().removeIf(token -> token.isExpired(now));
        return before - tokens.size() - consumed.size();
    }

    public int size() {
        return tokens.size();
    }
}
