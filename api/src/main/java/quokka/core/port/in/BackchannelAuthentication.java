package quokka.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.ciba.CibaAuthenticationRequest;
import quokka.core.model.ciba.CibaRequest;
import quokka.core.model.ciba.CibaResult;
import quokka.core.model.ciba.CibaStatus;
import quokka.core.model.client.Client;

/**
 * Use case for Client-Initiated Backchannel Authentication.
 */
public interface BackchannelAuthentication {

    /**
     * Start a backchannel authentication request for an authenticated client.
     */
    Uni<CibaResult> authenticate(CibaAuthenticationRequest request, Client client);

    /**
     * Record the user's approval. Idempotent once the request is terminal.
     *
     * @return Uni with the resulting status
     */
    Uni<CibaStatus> approve(String authReqId, String subjectId, String sessionId);

    /**
     * Record the user's denial. Idempotent once the request is terminal.
     *
     * @return Uni with the resulting status
     */
    Uni<CibaStatus> deny(String authReqId);

    /**
     * Look up a request by the correlation id handed to the approval journey.
     */
    Uni<Optional<CibaRequest>> findByCorrelation(String correlationId);
}
