package quokka.core.service.grant;

import java.util.LinkedHashSet;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import quokka.core.model.client.Client;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.Scopes;
import quokka.core.model.grant.TokenRequest;

/**
 * Handles {@code grant_type=client_credentials}: machine-to-machine access with no subject.
 */
@ApplicationScoped
public class ClientCredentialsGrantHandler implements GrantHandler {

    @Override
    public String grantType() {
        return GrantTypes.CLIENT_CREDENTIALS;
    }

    @Override
    public Uni<GrantResult> handle(TokenRequest request, Client client) {
        if (client.publicClient()) {
            return Uni.createFrom()
                    .item(GrantResult.failure(
                            OAuthError.UNAUTHORIZED_CLIENT, "Public clients cannot use client_credentials"));
        }

        var scopes = GrantScopes.requested(request);
        for (final var scope : scopes) {
            if (Scopes.isIdentityScope(scope)) {
                return Uni.createFrom()
                        .item(GrantResult.failure(
                                OAuthError.INVALID_SCOPE, "Identity scope " + scope + " requires a user"));
            }
        }
        if (scopes.isEmpty()) {
            scopes = client.allowedScopes().stream()
                    .filter(scope -> !Scopes.isIdentityScope(scope))
                    .sorted()
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }

        final var scopeError = GrantScopes.checkAllowed(scopes, client);
        if (scopeError.isPresent()) {
            return Uni.createFrom().item(GrantResult.failure(OAuthError.INVALID_SCOPE, scopeError.get()));
        }

        return Uni.createFrom()
                .item(GrantResult.success(grantType(), client.clientId())
                        .scopes(scopes)
                        .issueRefreshToken(false)
                        .build());
    }
}
