package quokka.adapter.out.storage.memory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import quokka.core.model.key.SigningKey;
import quokka.core.port.out.SigningKeyStore;

/**
 * In-memory signing key store.
 *
 * <p>Key records do not survive a restart, so locally generated keys are
 * regenerated on start. Tokens signed before a restart stop verifying.
 */
@ApplicationScoped
public class InMemorySigningKeyStore implements SigningKeyStore {

    private final ConcurrentMap<String, SigningKey> keys = new ConcurrentHashMap<>();

    @Override
    public Uni<SigningKey> insert(SigningKey key) {
        return Uni.createFrom().item(() -> {
            if (keys.putIfAbsent(key.keyId(), key) != null) {
                throw new IllegalStateException("Signing key already exists: " + key.keyId());
            }
            return key;
        });
    }

    @Override
    public Uni<Boolean> replace(SigningKey expected, SigningKey updated) {
        return Uni.createFrom().item(() -> keys.replace(expected.keyId(), expected, updated));
    }

    @Override
    public Uni<Optional<SigningKey>> findById(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(keys.get(keyId)));
    }

    @Override
    public Uni<List<SigningKey>> findAll() {
        return Uni.createFrom().item(() -> List.copyOf(keys.values()));
    }

    @Override
    public Uni<List<SigningKey>> findByScope(String tenantId, String clientId) {
        return Uni.createFrom()
                .item(() -> keys.values().stream()
                        .filter(key -> key.belongsTo(tenantId, clientId))
                        .toList());
    }

    @Override
    public Uni<Boolean> delete(String keyId) {
        return Uni.createFrom().item(() -> keys.remove(keyId) != null);
    }

    /**
     * Clear all keys (for testing).
     */
    public void clear() {
        keys.clear();
    }
}
