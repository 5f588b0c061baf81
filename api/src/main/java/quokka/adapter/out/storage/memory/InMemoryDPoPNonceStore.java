package quokka.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;

import quokka.core.port.out.DPoPNonceStore;
import quokka.core.util.RandomValues;

/**
 * In-memory implementation of DPoP replay and nonce storage.
 *
 * <p>Replay detection is only effective within one instance.
 */
public class InMemoryDPoPNonceStore implements DPoPNonceStore {

    private static final int NONCE_BYTES = 16;

    private final ConcurrentMap<String, Instant> usedProofs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> nonces = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDPoPNonceStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Boolean> tryMarkAsUsed(String proofId, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var expiresAt = now.plus(ttl);
            final var firstUse = new AtomicBoolean(false);
            usedProofs.compute(proofId, (id, existing) -> {
                if (existing != null && existing.isAfter(now)) {
                    return existing;
                }
                firstUse.set(true);
                return expiresAt;
            });
            return firstUse.get();
        });
    }

    @Override
    public Uni<String> issueNonce(Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var nonce = RandomValues.base64Url(NONCE_BYTES);
            nonces.put(nonce, clock.instant().plus(ttl));
            return nonce;
        });
    }

    @Override
    public Uni<Boolean> consumeNonce(String nonce) {
        return Uni.createFrom().item(() -> {
            if (nonce == null) {
                return false;
            }
            final var expiresAt = nonces.remove(nonce);
            return expiresAt != null && expiresAt.isAfter(clock.instant());
        });
    }

    public int purgeExpired() {
        final var now = clock.instant();
        final var before = usedProofs.size() + nonces.size();
        usedProofs.values().removeIf(expiry -> !expiry.isAfter(now));
        nonces.values().removeIf(expiry -> !expiry.isAfter(now));
        return before - usedProofs.size() - nonces.size();
    }
}
