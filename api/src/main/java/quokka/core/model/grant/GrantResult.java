package quokka.core.model.grant;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import quokka.core.model.token.RefreshToken;

/**
 * Outcome of evaluating one grant. Immutable once produced.
 *
 * <p>Protocol violations are values, never exceptions: a failed grant carries
 * an {@link OAuthError} and an optional description that is safe to return
 * to the client.
 *
 * @param success                whether the grant was accepted
 * @param grantType              grant type that produced the result
 * @param subjectId              subject, or null for client-only grants
 * @param clientId               requesting client
 * @param scopes                 granted scopes
 * @param claims                 extra claims to place in issued tokens
 * @param sessionId              login session id, or null
 * @param authTime               authentication time, or null
 * @param amr                    authentication methods
 * @param acr                    authentication context class, or null
 * @param nonce                  OIDC nonce, or null
 * @param authorizationCode      the redeemed code, used for {@code c_hash}, or null
 * @param dpopKeyThumbprint      DPoP key bound to the issued tokens, or null
 * @param audiences              requested audiences
 * @param issuedTokenType        RFC 8693 issued token type, or null
 * @param presentedRefreshToken  refresh token presented on a refresh grant, or null
 * @param issueRefreshToken      whether a new refresh token should be issued on a refresh grant
 * @param error                  failure code, or null on success
 * @param errorDescription       failure description, or null
 */
public record GrantResult(
        boolean success,
        String grantType,
        String subjectId,
        String clientId,
        Set<String> scopes,
        Map<String, Object> claims,
        String sessionId,
        Instant authTime,
        List<String> amr,
        String acr,
        String nonce,
        String authorizationCode,
        String dpopKeyThumbprint,
        List<String> audiences,
        String issuedTokenType,
        RefreshToken presentedRefreshToken,
        boolean issueRefreshToken,
        OAuthError error,
        String errorDescription) {

    public GrantResult {
        scopes = Scopes.ordered(scopes);
        claims = claims == null ? Map.of() : Map.copyOf(claims);
        amr = amr == null ? List.of() : List.copyOf(amr);
        audiences = audiences == null ? List.of() : List.copyOf(audiences);
        if (success && error != null) {
            throw new IllegalArgumentException("A successful grant cannot carry an error");
        }
        if (!success) {
            Objects.requireNonNull(error, "A failed grant must carry an error");
        }
    }

    public static GrantResult failure(OAuthError error, String description) {
        return new GrantResult(
                false, null, null, null, Set.of(), Map.of(), null, null, List.of(), null, null, null, null,
                List.of(), null, null, false, error, description);
    }

    public static GrantResult failure(OAuthError error) {
        return failure(error, null);
    }

    public static Builder success(String grantType, String clientId) {
        return new Builder(grantType, clientId);
    }

    public Optional<String> subject() {
        return Optional.ofNullable(subjectId);
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }

    public static class Builder {
        private final String grantType;
        private final String clientId;
        private String subjectId;
        private Set<String> scopes = Set.of();
        private Map<String, Object> claims = Map.of();
        private String sessionId;
        private Instant authTime;
        private List<String> amr = List.of();
        private String acr;
        private String nonce;
        private String authorizationCode;
        private String dpopKeyThumbprint;
        private List<String> audiences = List.of();
        private String issuedTokenType;
        private RefreshToken presentedRefreshToken;
        private boolean issueRefreshToken = true;

        private Builder(String grantType, String clientId) {
            this.grantType = Objects.requireNonNull(grantType, "grantType cannot be null");
            this.clientId = Objects.requireNonNull(clientId, "clientId cannot be null");
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder scopes(Set<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder claims(Map<String, Object> claims) {
            this.claims = claims;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder authTime(Instant authTime) {
            this.authTime = authTime;
            return this;
        }

        public Builder amr(List<String> amr) {
            this.amr = amr;
            return this;
        }

        public Builder acr(String acr) {
            this.acr = acr;
            return this;
        }

        public Builder nonce(String nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder authorizationCode(String authorizationCode) {
            this.authorizationCode = authorizationCode;
            return this;
        }

        public Builder dpopKeyThumbprint(String dpopKeyThumbprint) {
            this.dpopKeyThumbprint = dpopKeyThumbprint;
            return this;
        }

        public Builder audiences(List<String> audiences) {
            this.audiences = audiences;
            return this;
        }

        public Builder issuedTokenType(String issuedTokenType) {
            this.issuedTokenType = issuedTokenType;
            return this;
        }

        public Builder presentedRefreshToken(RefreshToken presentedRefreshToken) {
            this.presentedRefreshToken = presentedRefreshToken;
            return this;
        }

        public Builder issueRefreshToken(boolean issueRefreshToken) {
            this.issueRefreshToken = issueRefreshToken;
            return this;
        }

        public GrantResult build() {
            return new GrantResult(
                    true,
                    grantType,
                    subjectId,
                    clientId,
                    scopes,
                    claims,
                    sessionId,
                    authTime,
                    amr,
                    acr,
                    nonce,
                    authorizationCode,
                    dpopKeyThumbprint,
                    audiences,
                    issuedTokenType,
                    presentedRefreshToken,
                    issueRefreshToken,
                    null,
                    null);
        }
    }
}
