package quokka.core.model.token;

import java.util.Objects;

import quokka.core.model.client.Client;

/**
 * Request-scoped inputs for token creation that are not part of the grant outcome.
 *
 * @param client             the authenticated client
 * @param tenantId           tenant the request was resolved to, or null
 * @param dpopKeyThumbprint  thumbprint of a validated DPoP proof, or null
 */
public record TokenIssueContext(Client client, String tenantId, String dpopKeyThumbprint) {

    public TokenIssueContext {
        Objects.requireNonNull(client, "client cannot be null");
    }
}
