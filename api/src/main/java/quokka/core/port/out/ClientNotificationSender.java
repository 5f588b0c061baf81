package quokka.core.port.out;

import io.smallrye.mutiny.Uni;

import quokka.core.model.ciba.CibaRequest;
import quokka.core.model.client.Client;
import quokka.core.model.token.TokenResponse;

/**
 * Delivers CIBA ping and push callbacks to a client's notification endpoint.
 */
public interface ClientNotificationSender {

    /**
     * Ping mode: tell the client the request is ready to be polled.
     */
    Uni<Void> ping(Client client, CibaRequest request);

    /**
     * Push mode: deliver the token response directly.
     */
    Uni<Void> push(Client client, CibaRequest request, TokenResponse tokens);
}
