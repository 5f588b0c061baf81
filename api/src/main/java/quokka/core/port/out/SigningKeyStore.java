package quokka.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.key.SigningKey;

/**
 * Storage for signing key records.
 *
 * <p>Records hold public metadata and the provider-owned protected material
 * only. Implementations must make {@link #replace} a single conditional
 * update so concurrent lifecycle sweeps from several instances cannot
 * overwrite each other.
 */
public interface SigningKeyStore {

    /**
     * Insert a key. Fails if a key with the same id exists.
     *
     * @param key the key to insert
     * @return the stored key
     */
    Uni<SigningKey> insert(SigningKey key);

    /**
     * Replace {@code expected} with {@code updated} if the stored record still
     * equals {@code expected}.
     *
     * @return true if the record was replaced
     */
    Uni<Boolean> replace(SigningKey expected, SigningKey updated);

    Uni<Optional<SigningKey>> findById(String keyId);

    /**
     * All keys, in no particular order.
     */
    Uni<List<SigningKey>> findAll();

    /**
     * Keys scoped to exactly the given tenant and client. Null values select
     * the default scope.
     */
    Uni<List<SigningKey>> findByScope(String tenantId, String clientId);

    /**
     * Delete a key record.
     *
     * @return true if a record was deleted
     */
    Uni<Boolean> delete(String keyId);
}
