package quokka.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;

import quokka.core.model.token.ReferenceToken;
import quokka.core.port.out.ReferenceTokenStore;

/**
 * In-memory store backing reference access tokens.
 */
@ApplicationScoped
public class InMemoryReferenceTokenStore implements ReferenceTokenStore {

    private final ConcurrentMap<String, ReferenceToken> tokens = new ConcurrentHashMap<>();
    private final Clock clock;

    @Inject
    public InMemoryReferenceTokenStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Void> store(ReferenceToken token) {
        return Uni.createFrom().item(() -> {
            tokens.put(token.handle(), token);
            return null;
        });
    }

    @Override
    public Uni<Optional<ReferenceToken>> find(String handle) {
        return Uni.createFrom().item(() -> Optional.ofNullable(tokens.get(handle))
                .filter(token -> token.expiresAt().isAfter(clock.instant())));
    }

    @Scheduled(every = "60s", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void purgeExpired() {
        final var now = clock.instant();
        tokens.values().removeIf(token -> !token.expiresAt().isAfter(now));
    }
}
