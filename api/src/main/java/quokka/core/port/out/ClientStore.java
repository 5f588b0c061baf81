package quokka.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.client.Client;

/**
 * Resolves registered clients. Clients are consumed read-only.
 */
public interface ClientStore {

    Uni<Optional<Client>> findClient(String clientId);
}
