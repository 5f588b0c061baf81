package quokka.adapter.out.client;

import java.net.URI;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.config.RegistryConfig;
import quokka.core.config.RegistryConfig.ClientEntry;
import quokka.core.model.client.Client;
import quokka.core.port.out.ClientStore;

/**
 * Client store backed by {@code quokka.registry.clients.*} configuration.
 *
 * <p>Clients are read once at startup. Production deployments register a
 * {@link ClientStore} bean backed by their client registry instead.
 *
 * <p>Example:
 * <pre>{@code
 * quokka.registry.clients.billing.secret=s3cret
 * quokka.registry.clients.billing.grant-types=client_credentials
 * quokka.registry.clients.billing.scopes=invoices.read,invoices.write
 * }</pre>
 */
@ApplicationScoped
public class ConfigClientStore implements ClientStore {

    private static final Logger LOG = Logger.getLogger(ConfigClientStore.class);

    private final Map<String, Client> clients;

    @Inject
    public ConfigClientStore(RegistryConfig config) {
        final var loaded = new HashMap<String, Client>();
        config.clients().forEach((clientId, entry) -> loaded.put(clientId, toClient(clientId, entry)));
        this.clients = Map.copyOf(loaded);
        LOG.infof("Loaded %d clients from configuration", clients.size());
    }

    @Override
    public Uni<Optional<Client>> findClient(String clientId) {
        if (clientId == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom().item(Optional.ofNullable(clients.get(clientId)));
    }

    static Client toClient(String clientId, ClientEntry entry) {
        return Client.builder(clientId)
                .enabled(entry.enabled())
                .secret(entry.secret().orElse(null))
                .publicClient(entry.publicClient())
                .allowedGrantTypes(toSet(entry.grantTypes()))
                .allowedScopes(toSet(entry.scopes()))
                .redirectUris(toSet(entry.redirectUris()))
                .accessTokenLifetime(entry.accessTokenLifetime())
                .identityTokenLifetime(entry.identityTokenLifetime())
                .refreshTokenLifetime(entry.refreshTokenLifetime())
                .slidingRefreshTokenLifetime(entry.slidingRefreshTokenLifetime())
                .refreshTokenUsage(entry.refreshTokenUsage())
                .refreshTokenExpiration(entry.refreshTokenExpiration())
                .allowOfflineAccess(entry.allowOfflineAccess())
                .requirePkce(entry.requirePkce())
                .allowPlainTextPkce(entry.allowPlainTextPkce())
                .requireDpop(entry.requireDpop())
                .accessTokenType(entry.accessTokenType())
                .pairwiseSubjectSalt(entry.pairwiseSubjectSalt().orElse(null))
                .cibaEnabled(entry.ciba().enabled())
                .cibaDeliveryMode(entry.ciba().deliveryMode())
                .cibaNotificationEndpoint(
                        entry.ciba().notificationEndpoint().map(URI::create).orElse(null))
                .cibaRequestLifetime(entry.ciba().requestLifetime())
                .cibaPollingInterval(entry.ciba().pollingInterval())
                .cibaRequireUserCode(entry.ciba().requireUserCode())
                .deviceCodeLifetime(entry.device().codeLifetime())
                .devicePollingInterval(entry.device().pollingInterval())
                .build();
    }

    private static Set<String> toSet(Optional<List<String>> values) {
        return values.<Set<String>>map(LinkedHashSet::new).orElseGet(Set::of);
    }
}
