package quokka.core.model.token;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import quokka.core.model.client.Client;

/**
 * Input for building exactly one token. Not persisted.
 *
 * @param subjectId           subject, or null for client-only tokens
 * @param client              the client the token is issued to
 * @param scopes              granted scopes
 * @param claims              additional claims
 * @param accessTokenLifetime access token lifetime in seconds
 * @param identityLifetime    ID token lifetime in seconds
 * @param sessionId           session id, or null
 * @param nonce               OIDC nonce, or null
 * @param dpopKeyThumbprint   DPoP key thumbprint to bind, or null
 * @param pairwiseSubjectSalt salt for pairwise subjects, or null
 * @param reference           whether to issue an opaque reference token
 * @param tenantId            tenant, or null
 * @param audiences           token audiences; empty means the client id
 * @param authTime            authentication time, or null
 * @param amr                 authentication methods
 * @param acr                 authentication context class, or null
 */
public record TokenCreationRequest(
        String subjectId,
        Client client,
        Set<String> scopes,
        Map<String, Object> claims,
        int accessTokenLifetime,
        int identityLifetime,
        String sessionId,
        String nonce,
        String dpopKeyThumbprint,
        String pairwiseSubjectSalt,
        boolean reference,
        String tenantId,
        List<String> audiences,
        Instant authTime,
        List<String> amr,
        String acr) {

    public TokenCreationRequest {
        Objects.requireNonNull(client, "client cannot be null");
        scopes = scopes == null ? Set.of() : scopes;
        claims = claims == null ? Map.of() : claims;
        audiences = audiences == null ? List.of() : List.copyOf(audiences);
        amr = amr == null ? List.of() : List.copyOf(amr);
        if (accessTokenLifetime <= 0) {
            throw new IllegalArgumentException("accessTokenLifetime must be positive seconds");
        }
        if (identityLifetime <= 0) {
            throw new IllegalArgumentException("identityLifetime must be positive seconds");
        }
    }

    public boolean hasSubject() {
        return subjectId != null;
    }
}
