package quokka.core.model.token;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A persisted refresh token grant.
 *
 * @param handle            opaque token value presented by the client
 * @param clientId          client the token was issued to
 * @param subjectId         subject
 * @param scopes            scopes originally granted
 * @param sessionId         login session id, or null
 * @param claims            extra claims carried into refreshed access tokens
 * @param authTime          original authentication time, or null
 * @param amr               authentication methods
 * @param acr               authentication context class, or null
 * @param tenantId          tenant, or null
 * @param dpopKeyThumbprint bound DPoP key thumbprint, or null
 * @param createdAt         first issue time of this token family
 * @param absoluteExpiresAt hard expiry of the token family
 * @param expiresAt         current expiry (sliding or absolute)
 */
public record RefreshToken(
        String handle,
        String clientId,
        String subjectId,
        Set<String> scopes,
        String sessionId,
        Map<String, Object> claims,
        Instant authTime,
        List<String> amr,
        String acr,
        String tenantId,
        String dpopKeyThumbprint,
        Instant createdAt,
        Instant absoluteExpiresAt,
        Instant expiresAt) {

    public RefreshToken {
        Objects.requireNonNull(handle, "handle cannot be null");
        Objects.requireNonNull(clientId, "clientId cannot be null");
        Objects.requireNonNull(subjectId, "subjectId cannot be null");
        Objects.requireNonNull(absoluteExpiresAt, "absoluteExpiresAt cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        scopes = scopes == null ? Set.of() : scopes;
        claims = claims == null ? Map.of() : Map.copyOf(claims);
        amr = amr == null ? List.of() : List.copyOf(amr);
    }

    /**
     * Whether the token is past either its absolute or its sliding expiry.
     */
    public boolean isExpired(Instant now) {
        return !absoluteExpiresAt.isAfter(now) || !expiresAt.isAfter(now);
    }

    public boolean isDpopBound() {
        return dpopKeyThumbprint != null;
    }
}
