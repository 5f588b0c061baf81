package quokka.core.port.in;

import io.smallrye.mutiny.Uni;

import quokka.core.model.client.ClientCredentials;
import quokka.core.model.grant.TokenRequest;
import quokka.core.model.token.TokenEndpointResult;

/**
 * Use case behind the token endpoint.
 */
public interface TokenIssuance {

    /**
     * Authenticate the client, validate DPoP, evaluate the grant and issue tokens.
     *
     * @param credentials client credentials as presented
     * @param request     the token request; its client id must match the credentials
     * @return Uni with the endpoint result; never fails
     */
    Uni<TokenEndpointResult> token(ClientCredentials credentials, TokenRequest request);
}
