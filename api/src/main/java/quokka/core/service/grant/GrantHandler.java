package quokka.core.service.grant;

import io.smallrye.mutiny.Uni;

import quokka.core.model.client.Client;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.TokenRequest;

/**
 * Validates one OAuth2 grant type and produces the grant outcome.
 *
 * <p>Protocol violations are returned as {@link GrantResult#failure}; a
 * handler only fails its {@code Uni} for unexpected errors such as an
 * unreachable store.
 */
public interface GrantHandler {

    /**
     * The literal {@code grant_type} value this handler serves.
     */
    String grantType();

    /**
     * Handle a token request for an authenticated client that is allowed to use this grant.
     */
    Uni<GrantResult> handle(TokenRequest request, Client client);
}
