package quokka.core.service.grant;

import java.util.Optional;
import java.util.Set;

import quokka.core.model.client.Client;
import quokka.core.model.grant.Scopes;
import quokka.core.model.grant.TokenRequest;

/**
 * Scope rules shared by the grant handlers.
 */
public final class GrantScopes {

    private GrantScopes() {}

    public static Set<String> requested(TokenRequest request) {
        return Scopes.parse(request.parameters().get("scope"));
    }

    /**
     * Check that a client may be granted every scope in {@code scopes}.
     *
     * <p>{@code offline_access} is governed by the client's offline access
     * flag rather than its scope allow-list.
     *
     * @return a description of the violation, or empty when all scopes are allowed
     */
    public static Optional<String> checkAllowed(Set<String> scopes, Client client) {
        for (final var scope : scopes) {
            if (Scopes.OFFLINE_ACCESS.equals(scope)) {
                if (!client.allowOfflineAccess()) {
                    return Optional.of("Client is not allowed to request offline_access");
                }
            } else if (!client.allowsScope(scope)) {
                return Optional.of("Scope " + scope + " is not allowed for this client");
            }
        }
        return Optional.empty();
    }

    /**
     * Check that {@code requested} narrows {@code original}.
     */
    public static Optional<String> checkSubset(Set<String> requested, Set<String> original) {
        for (final var scope : requested) {
            if (!original.contains(scope)) {
                return Optional.of("Scope " + scope + " exceeds the original grant");
            }
        }
        return Optional.empty();
    }
}
