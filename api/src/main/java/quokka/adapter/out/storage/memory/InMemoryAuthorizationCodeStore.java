package quokka.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.token.AuthorizationCode;
import quokka.core.port.out.AuthorizationCodeStore;
import quokka.core.util.SecureHash;

/**
 * In-memory implementation of authorization code storage.
 *
 * <p>This implementation is intended for development and testing only.
 * Codes are lost on restart and not shared across instances.
 */
public class InMemoryAuthorizationCodeStore implements AuthorizationCodeStore {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthorizationCodeStore.class);

    private final ConcurrentMap<String, AuthorizationCode> codes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AuthorizationCode> consumed = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryAuthorizationCodeStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Void> store(AuthorizationCode code) {
        return Uni.createFrom().item(() -> {
            codes.put(code.code(), code);
            LOG.debugf("Stored authorization code %s", SecureHash.fingerprint(code.code()));
            return null;
        });
    }

    @Override
    public Uni<Optional<AuthorizationCode>> consume(String code) {
        return Uni.createFrom().item(() -> {
            final var entry = codes.remove(code);
            if (entry == null) {
                return Optional.<AuthorizationCode>empty();
            }
            consumed.put(code, entry);
            return Optional.of(entry);
        });
    }

    @Override
    public Uni<Optional<AuthorizationCode>> findConsumed(String code) {
        return Uni.createFrom().item(() -> Optional.ofNullable(consumed.get(code))
                .filter(entry -> !entry.isExpired(clock.instant())));
    }

    /**
     * Drop expired codes and tombstones.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        final var now = clock.instant();
        final var before = codes.size() + consumed.size();
        codes.values().removeIf(entry -> entry.isExpired(now));
        consumed.values().removeIf(entry -> entry.isExpired(now));
        return before - codes.size() - consumed.size();
    }

    public int size() {
        return codes.size();
    }
}
