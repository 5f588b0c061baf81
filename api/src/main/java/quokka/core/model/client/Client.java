package quokka.core.model.client;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A registered OAuth2 / OIDC client.
 *
 * <p>Clients are resolved by an external store and consumed read-only. A
 * grant handler rejects any request whose grant type or scope is not in the
 * client's allow-lists.
 *
 * <p>Lifetimes are whole seconds.
 */
public record Client(
        String clientId,
        boolean enabled,
        String secret,
        boolean publicClient,
        Set<String> allowedGrantTypes,
        Set<String> allowedScopes,
        Set<String> redirectUris,
        int accessTokenLifetime,
        int identityTokenLifetime,
        int refreshTokenLifetime,
        int slidingRefreshTokenLifetime,
        RefreshTokenUsage refreshTokenUsage,
        RefreshTokenExpiration refreshTokenExpiration,
        boolean allowOfflineAccess,
        boolean requirePkce,
        boolean allowPlainTextPkce,
        boolean requireDpop,
        AccessTokenType accessTokenType,
        String pairwiseSubjectSalt,
        boolean cibaEnabled,
        CibaDeliveryMode cibaDeliveryMode,
        URI cibaNotificationEndpoint,
        int cibaRequestLifetime,
        int cibaPollingInterval,
        boolean cibaRequireUserCode,
        int deviceCodeLifetime,
        int devicePollingInterval) {

    public Client {
        Objects.requireNonNull(clientId, "clientId cannot be null");
        if (clientId.isBlank()) {
            throw new IllegalArgumentException("clientId cannot be blank");
        }
        allowedGrantTypes = allowedGrantTypes == null ? Set.of() : Set.copyOf(allowedGrantTypes);
        allowedScopes = allowedScopes == null ? Set.of() : Set.copyOf(allowedScopes);
        redirectUris = redirectUris == null ? Set.of() : Set.copyOf(redirectUris);
        refreshTokenUsage = refreshTokenUsage == null ? RefreshTokenUsage.ONE_TIME_ONLY : refreshTokenUsage;
        refreshTokenExpiration =
                refreshTokenExpiration == null ? RefreshTokenExpiration.ABSOLUTE : refreshTokenExpiration;
        accessTokenType = accessTokenType == null ? AccessTokenType.JWT : accessTokenType;
        cibaDeliveryMode = cibaDeliveryMode == null ? CibaDeliveryMode.POLL : cibaDeliveryMode;
    }

    public boolean allowsGrantType(String grantType) {
        return grantType != null && allowedGrantTypes.contains(grantType);
    }

    public boolean allowsScope(String scope) {
        return allowedScopes.contains(scope);
    }

    public boolean allowsRedirectUri(String redirectUri) {
        return redirectUri != null && redirectUris.contains(redirectUri);
    }

    public boolean hasSecret() {
        return secret != null && !secret.isEmpty();
    }

    public Optional<String> pairwiseSalt() {
        return Optional.ofNullable(pairwiseSubjectSalt).filter(s -> !s.isBlank());
    }

    public Optional<URI> notificationEndpoint() {
        return Optional.ofNullable(cibaNotificationEndpoint);
    }

    public static Builder builder(String clientId) {
        return new Builder(clientId);
    }

    public Builder toBuilder() {
        return new Builder(clientId)
                .enabled(enabled)
                .secret(secret)
                .publicClient(publicClient)
                .allowedGrantTypes(allowedGrantTypes)
                .allowedScopes(allowedScopes)
                .redirectUris(redirectUris)
                .accessTokenLifetime(accessTokenLifetime)
                .identityTokenLifetime(identityTokenLifetime)
                .refreshTokenLifetime(refreshTokenLifetime)
                .slidingRefreshTokenLifetime(slidingRefreshTokenLifetime)
                .refreshTokenUsage(refreshTokenUsage)
                .refreshTokenExpiration(refreshTokenExpiration)
                .allowOfflineAccess(allowOfflineAccess)
                .requirePkce(requirePkce)
                .allowPlainTextPkce(allowPlainTextPkce)
                .requireDpop(requireDpop)
                .accessTokenType(accessTokenType)
                .pairwiseSubjectSalt(pairwiseSubjectSalt)
                .cibaEnabled(cibaEnabled)
                .cibaDeliveryMode(cibaDeliveryMode)
                .cibaNotificationEndpoint(cibaNotificationEndpoint)
                .cibaRequestLifetime(cibaRequestLifetime)
                .cibaPollingInterval(cibaPollingInterval)
                .cibaRequireUserCode(cibaRequireUserCode)
                .deviceCodeLifetime(deviceCodeLifetime)
                .devicePollingInterval(devicePollingInterval);
    }

    public static class Builder {
        private final String clientId;
        private boolean enabled = true;
        private String secret;
        private boolean publicClient;
        private Set<String> allowedGrantTypes = Set.of();
        private Set<String> allowedScopes = Set.of();
        private Set<String> redirectUris = Set.of();
        private int accessTokenLifetime = 3600;
        private int identityTokenLifetime = 300;
        private int refreshTokenLifetime = 2_592_000;
        private int slidingRefreshTokenLifetime = 1_296_000;
        private RefreshTokenUsage refreshTokenUsage = RefreshTokenUsage.ONE_TIME_ONLY;
        private RefreshTokenExpiration refreshTokenExpiration = RefreshTokenExpiration.ABSOLUTE;
        private boolean allowOfflineAccess;
        private boolean requirePkce = true;
        private boolean allowPlainTextPkce;
        private boolean requireDpop;
        private AccessTokenType accessTokenType = AccessTokenType.JWT;
        private String pairwiseSubjectSalt;
        private boolean cibaEnabled;
        private CibaDeliveryMode cibaDeliveryMode = CibaDeliveryMode.POLL;
        private URI cibaNotificationEndpoint;
        private int cibaRequestLifetime = 300;
        private int cibaPollingInterval = 5;
        private boolean cibaRequireUserCode;
        private int deviceCodeLifetime = 300;
        private int devicePollingInterval = 5;

        private Builder(String clientId) {
            this.clientId = clientId;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder publicClient(boolean publicClient) {
            this.publicClient = publicClient;
            return this;
        }

        public Builder allowedGrantTypes(Set<String> allowedGrantTypes) {
            this.allowedGrantTypes = allowedGrantTypes;
            return this;
        }

        public Builder allowedScopes(Set<String> allowedScopes) {
            this.allowedScopes = allowedScopes;
            return this;
        }

        public Builder redirectUris(Set<String> redirectUris) {
            this.redirectUris = redirectUris;
            return this;
        }

        public Builder accessTokenLifetime(int accessTokenLifetime) {
            this.accessTokenLifetime = accessTokenLifetime;
            return this;
        }

        public Builder identityTokenLifetime(int identityTokenLifetime) {
            this.identityTokenLifetime = identityTokenLifetime;
            return this;
        }

        public Builder refreshTokenLifetime(int refreshTokenLifetime) {
            this.refreshTokenLifetime = refreshTokenLifetime;
            return this;
        }

        public Builder slidingRefreshTokenLifetime(int slidingRefreshTokenLifetime) {
            this.slidingRefreshTokenLifetime = slidingRefreshTokenLifetime;
            return this;
        }

        public Builder refreshTokenUsage(RefreshTokenUsage refreshTokenUsage) {
            this.refreshTokenUsage = refreshTokenUsage;
            return this;
        }

        public Builder refreshTokenExpiration(RefreshTokenExpiration refreshTokenExpiration) {
            this.refreshTokenExpiration = refreshTokenExpiration;
            return this;
        }

        public Builder allowOfflineAccess(boolean allowOfflineAccess) {
            this.allowOfflineAccess = allowOfflineAccess;
            return this;
        }

        public Builder requirePkce(boolean requirePkce) {
            this.requirePkce = requirePkce;
            return this;
        }

        public Builder allowPlainTextPkce(boolean allowPlainTextPkce) {
            this.allowPlainTextPkce = allowPlainTextPkce;
            return this;
        }

        public Builder requireDpop(boolean requireDpop) {
            this.requireDpop = requireDpop;
            return this;
        }

        public Builder accessTokenType(AccessTokenType accessTokenType) {
            this.accessTokenType = accessTokenType;
            return this;
        }

        public Builder pairwiseSubjectSalt(String pairwiseSubjectSalt) {
            this.pairwiseSubjectSalt = pairwiseSubjectSalt;
            return this;
        }

        public Builder cibaEnabled(boolean cibaEnabled) {
            this.cibaEnabled = cibaEnabled;
            return this;
        }

        public Builder cibaDeliveryMode(CibaDeliveryMode cibaDeliveryMode) {
            this.cibaDeliveryMode = cibaDeliveryMode;
            return this;
        }

        public Builder cibaNotificationEndpoint(URI cibaNotificationEndpoint) {
            this.cibaNotificationEndpoint = cibaNotificationEndpoint;
            return this;
        }

        public Builder cibaRequestLifetime(int cibaRequestLifetime) {
            this.cibaRequestLifetime = cibaRequestLifetime;
            return this;
        }

        public Builder cibaPollingInterval(int cibaPollingInterval) {
            this.cibaPollingInterval = cibaPollingInterval;
            return this;
        }

        public Builder cibaRequireUserCode(boolean cibaRequireUserCode) {
            this.cibaRequireUserCode = cibaRequireUserCode;
            return this;
        }

        public Builder deviceCodeLifetime(int deviceCodeLifetime) {
            this.deviceCodeLifetime = deviceCodeLifetime;
            return this;
        }

        public Builder devicePollingInterval(int devicePollingInterval) {
            this.devicePollingInterval = devicePollingInterval;
            return this;
        }

        public Client build() {
            return new Client(
                    clientId,
                    enabled,
                    secret,
                    publicClient,
                    allowedGrantTypes,
                    allowedScopes,
                    redirectUris,
                    accessTokenLifetime,
                    identityTokenLifetime,
                    refreshTokenLifetime,
                    slidingRefreshTokenLifetime,
                    refreshTokenUsage,
                    refreshTokenExpiration,
                    allowOfflineAccess,
                    requirePkce,
                    allowPlainTextPkce,
                    requireDpop,
                    accessTokenType,
                    pairwiseSubjectSalt,
                    cibaEnabled,
                    cibaDeliveryMode,
                    cibaNotificationEndpoint,
                    cibaRequestLifetime,
                    cibaPollingInterval,
                    cibaRequireUserCode,
                    deviceCodeLifetime,
                    devicePollingInterval);
        }
    }
}
