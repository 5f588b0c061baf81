package quokka.core.model.token;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Claims behind an opaque reference access token, resolved later through
 * introspection.
 *
 * @param handle    opaque token value
 * @param clientId  client the token was issued to
 * @param claims    the claims a JWT access token would have carried
 * @param expiresAt token expiry
 */
public record ReferenceToken(String handle, String clientId, Map<String, Object> claims, Instant expiresAt) {

    public ReferenceToken {
        Objects.requireNonNull(handle, "handle cannot be null");
        Objects.requireNonNull(clientId, "clientId cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        claims = claims == null ? Map.of() : Map.copyOf(claims);
    }
}
