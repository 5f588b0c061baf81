package quokka.core.model.state;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque correlation data carried across a redirect or asynchronous boundary.
 *
 * @param correlationId generated handle
 * @param protocol      owning protocol, for example {@code ciba}
 * @param payload       protocol-specific data
 * @param createdAt     creation time
 * @param expiresAt     expiry time
 */
public record ProtocolState(
        String correlationId, String protocol, Map<String, String> payload, Instant createdAt, Instant expiresAt) {

    public ProtocolState {
        Objects.requireNonNull(correlationId, "correlationId cannot be null");
        Objects.requireNonNull(protocol, "protocol cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
