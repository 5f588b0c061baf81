package quokka.core.model.token;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single-use authorization code issued by the login journey.
 *
 * @param code                the opaque code value
 * @param clientId            client the code was issued to
 * @param subjectId           authenticated subject
 * @param redirectUri         redirect URI used in the authorization request, or null
 * @param scopes              granted scopes
 * @param codeChallenge       PKCE challenge, or null
 * @param codeChallengeMethod {@code S256} or {@code plain}, or null
 * @param nonce               OIDC nonce, or null
 * @param sessionId           login session id
 * @param authTime            when the user authenticated
 * @param amr                 authentication methods
 * @param acr                 authentication context class, or null
 * @param tenantId            tenant, or null
 * @param createdAt           issue time
 * @param expiresAt           expiry time
 */
public record AuthorizationCode(
        String code,
        String clientId,
        String subjectId,
        String redirectUri,
        Set<String> scopes,
        String codeChallenge,
        String codeChallengeMethod,
        String nonce,
        String sessionId,
        Instant authTime,
        List<String> amr,
        String acr,
        String tenantId,
        Instant createdAt,
        Instant expiresAt) {

    public AuthorizationCode {
        Objects.requireNonNull(code, "code cannot be null");
        Objects.requireNonNull(clientId, "clientId cannot be null");
        Objects.requireNonNull(subjectId, "subjectId cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        scopes = scopes == null ? Set.of() : scopes;
        amr = amr == null ? List.of() : List.copyOf(amr);
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean hasChallenge() {
        return codeChallenge != null && !codeChallenge.isBlank();
    }
}
