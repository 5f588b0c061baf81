package quokka.core.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import quokka.core.model.client.AccessTokenType;
import quokka.core.model.client.CibaDeliveryMode;
import quokka.core.model.client.RefreshTokenExpiration;
import quokka.core.model.client.RefreshTokenUsage;

/**
 * Configuration-backed client and user registrations.
 *
 * <p>Configuration prefix: {@code quokka.registry}
 *
 * <p>Example configuration:
 * <pre>{@code
 * quokka.registry.clients.reporting.secret=s3cret
 * quokka.registry.clients.reporting.grant-types=client_credentials
 * quokka.registry.clients.reporting.scopes=api.read,api.write
 * quokka.registry.users.alice.password=wonderland
 * quokka.registry.users.alice.email=alice@example.com
 * }</pre>
 */
@ConfigMapping(prefix = "quokka.registry")
public interface RegistryConfig {

    /**
     * Clients keyed by client id.
     */
    Map<String, ClientEntry> clients();

    /**
     * Users keyed by username.
     */
    Map<String, UserEntry> users();

    interface ClientEntry {

        @WithDefault("true")
        boolean enabled();

        Optional<String> secret();

        @WithDefault("false")
        boolean publicClient();

        Optional<List<String>> grantTypes();

        Optional<List<String>> scopes();

        Optional<List<String>> redirectUris();

        @WithDefault("3600")
        int accessTokenLifetime();

        @WithDefault("300")
        int identityTokenLifetime();

        @WithDefault("2592000")
        int refreshTokenLifetime();

        @WithDefault("1296000")
        int slidingRefreshTokenLifetime();

        @WithDefault("ONE_TIME_ONLY")
        RefreshTokenUsage refreshTokenUsage();

        @WithDefault("ABSOLUTE")
        RefreshTokenExpiration refreshTokenExpiration();

        @WithDefault("false")
        boolean allowOfflineAccess();

        @WithDefault("true")
        boolean requirePkce();

        @WithDefault("false")
        boolean allowPlainTextPkce();

        @WithDefault("false")
        boolean requireDpop();

        @WithDefault("JWT")
        AccessTokenType accessTokenType();

        Optional<String> pairwiseSubjectSalt();

        CibaEntry ciba();

        DeviceEntry device();
    }

    interface CibaEntry {

        @WithDefault("false")
        boolean enabled();

        @WithDefault("POLL")
        CibaDeliveryMode deliveryMode();

        Optional<String> notificationEndpoint();

        @WithDefault("300")
        int requestLifetime();

        @WithDefault("5")
        int pollingInterval();

        @WithDefault("false")
        boolean requireUserCode();
    }

    interface DeviceEntry {

        @WithDefault("300")
        int codeLifetime();

        @WithDefault("5")
        int pollingInterval();
    }

    interface UserEntry {

        /**
         * Subject id. Defaults to the username.
         */
        Optional<String> subject();

        String password();

        Optional<String> email();

        @WithDefault("true")
        boolean active();

        @WithDefault("false")
        boolean locked();

        @WithDefault("false")
        boolean mfaRequired();
    }
}
