package quokka.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.ciba.CibaRequest;
import quokka.core.port.out.CibaRequestStore;

/**
 * In-memory backchannel authentication request store.
 *
 * <p>Expired requests are kept for a short while after expiry so polls
 * report {@code expired_token} rather than an unknown request.
 */
@ApplicationScoped
public class InMemoryCibaRequestStore implements CibaRequestStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCibaRequestStore.class);
    private static final Duration RETENTION_AFTER_EXPIRY = Duration.ofMinutes(5);

    private final ConcurrentMap<String, CibaRequest> requests = new ConcurrentHashMap<>();
    private final Clock clock;

    @Inject
    public InMemoryCibaRequestStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Void> store(CibaRequest request) {
        return Uni.createFrom().item(() -> {
            requests.put(request.authReqId(), request);
            return null;
        });
    }

    @Override
    public Uni<Optional<CibaRequest>> find(String authReqId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(requests.get(authReqId)));
    }

    @Override
    public Uni<Boolean> compareAndSet(CibaRequest expected, CibaRequest updated) {
        return Uni.createFrom().item(() -> requests.replace(expected.authReqId(), expected, updated));
    }

    @Scheduled(every = "60s", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void purgeExpired() {
        final var cutoff = clock.instant().minus(RETENTION_AFTER_EXPIRY);
        final var before = requests.size();
        requests.values().removeIf(request -> request.expiresAt().isBefore(cutoff));
        final var removed = before - requests.size();
        if (removed > 0) {
            LOG.debugf("Purged %d expired backchannel authentication requests", removed);
        }
    }
}
