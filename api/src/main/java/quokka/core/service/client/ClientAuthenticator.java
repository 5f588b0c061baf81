package quokka.core.service.client;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.client.Client;
import quokka.core.model.client.ClientCredentials;
import quokka.core.port.out.ClientStore;

/**
 * Authenticates clients at the token, CIBA and device authorization endpoints.
 *
 * <p>Confidential clients authenticate with {@code client_secret_basic} or
 * {@code client_secret_post}; public clients present only their id. Every
 * failure looks the same to the caller.
 */
@ApplicationScoped
public class ClientAuthenticator {

    private static final Logger LOG = Logger.getLogger(ClientAuthenticator.class);

    private final ClientStore clients;

    @Inject
    public ClientAuthenticator(ClientStore clients) {
        this.clients = clients;
    }

    /**
     * @return Uni with the authenticated client, or empty when authentication fails
     */
    public Uni<Optional<Client>> authenticate(ClientCredentials credentials) {
        return clients.findClient(credentials.clientId()).map(found -> {
            if (found.isEmpty()) {
                LOG.debugf("Unknown client %s", credentials.clientId());
                return Optional.empty();
            }
            final var client = found.get();
            if (!client.enabled()) {
                LOG.warnf("Disabled client %s attempted to authenticate", client.clientId());
                return Optional.empty();
            }
            if (!verify(client, credentials)) {
                LOG.warnf(
                        "Client %s failed %s authentication",
                        client.clientId(),
                        credentials.method().name().toLowerCase(Locale.ROOT));
                return Optional.empty();
            }
            return Optional.of(client);
        });
    }

    private static boolean verify(Client client, ClientCredentials credentials) {
        if (credentials.method() == ClientCredentials.Method.NONE) {
            return client.publicClient();
        }
        if (!client.hasSecret()) {
            return false;
        }
        return MessageDigest.isEqual(
                client.secret().getBytes(StandardCharsets.UTF_8),
                credentials.secret().getBytes(StandardCharsets.UTF_8));
    }
}
