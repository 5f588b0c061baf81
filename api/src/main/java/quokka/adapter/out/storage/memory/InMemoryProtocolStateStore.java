package quokka.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import quokka.core.model.state.ProtocolState;
import quokka.core.port.out.ProtocolStateStore;
import quokka.core.util.RandomValues;

/**
 * In-memory implementation of protocol state storage.
 */
public class InMemoryProtocolStateStore implements ProtocolStateStore {

    private static final int CORRELATION_ID_BYTES = 24;

    private final ConcurrentMap<String, ProtocolState> states = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultExpiry;

    public InMemoryProtocolStateStore(Clock clock, Duration defaultExpiry) {
        this.clock = clock;
        this.defaultExpiry = defaultExpiry;
    }

    @Override
    public Uni<String> store(String protocol, Map<String, String> payload, Duration expiresIn) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var correlationId = RandomValues.base64Url(CORRELATION_ID_BYTES);
            final var ttl = expiresIn != null ? expiresIn : defaultExpiry;
            states.put(correlationId, new ProtocolState(correlationId, protocol, payload, now, now.plus(ttl)));
            return correlationId;
        });
    }

    @Override
    public Uni<Optional<ProtocolState>> get(String correlationId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(states.get(correlationId))
                .filter(state -> !state.isExpired(clock.instant())));
    }

    @Override
    public Uni<Void> remove(String correlationId) {
        return Uni.createFrom().item(() -> {
            states.remove(correlationId);
            return null;
        });
    }

    public int purgeExpired() {
        final var now = clock.instant();
        final var before = states.size();
        states.values().removeIf(state -> state.isExpired(now));
        return before - states.size();
    }
}
