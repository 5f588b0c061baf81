package quokka.core.port.out;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.state.ProtocolState;

/**
 * Shared store for protocol correlation data.
 *
 * <p>The store guarantees the data survives for the requested expiry window.
 * It does not guarantee transactional atomicity across instances; consumers
 * must tolerate eventual consistency.
 */
public interface ProtocolStateStore {

    /**
     * Store a payload under a newly generated correlation id.
     *
     * @param protocol  owning protocol
     * @param payload   protocol-specific data
     * @param expiresIn how long the state lives; null uses the store default
     * @return the correlation id
     */
    Uni<String> store(String protocol, Map<String, String> payload, Duration expiresIn);

    Uni<Optional<ProtocolState>> get(String correlationId);

    Uni<Void> remove(String correlationId);
}
