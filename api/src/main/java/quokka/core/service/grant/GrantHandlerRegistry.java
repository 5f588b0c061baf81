package quokka.core.service.grant;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.client.Client;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.TokenRequest;

/**
 * Dispatches token requests to the {@link GrantHandler} for their grant type.
 *
 * <p>Handlers are discovered via CDI. Two handlers claiming the same grant
 * type is a deployment error and fails startup.
 */
@ApplicationScoped
public class GrantHandlerRegistry {

    private static final Logger LOG = Logger.getLogger(GrantHandlerRegistry.class);

    static final String INTERNAL_ERROR_DESCRIPTION = "An internal error occurred";

    private final Map<String, GrantHandler> handlers;

    @Inject
    public GrantHandlerRegistry(Instance<GrantHandler> discovered) {
        final var byType = new HashMap<String, GrantHandler>();
        discovered.stream().forEach(handler -> {
            final var existing = byType.putIfAbsent(handler.grantType(), handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate grant handlers for " + handler.grantType() + ": "
                        + existing.getClass().getName() + ", " + handler.getClass().getName());
            }
        });
        this.handlers = Map.copyOf(byType);
        LOG.infof("Registered grant handlers: %s", handlers.keySet());
    }

    /**
     * Look up the handler for a grant type.
     */
    public Optional<GrantHandler> find(String grantType) {
        return Optional.ofNullable(grantType).map(handlers::get);
    }

    /**
     * Grant types with a registered handler.
     */
    public Set<String> supportedGrantTypes() {
        return handlers.keySet();
    }

    /**
     * Validate the grant type against the registry and the client, then run its handler.
     *
     * @return Uni with the grant outcome; never fails
     */
    public Uni<GrantResult> dispatch(TokenRequest request, Client client) {
        final var grantType = request.grantType();
        if (grantType == null || grantType.isBlank()) {
            return Uni.createFrom().item(GrantResult.failure(OAuthError.INVALID_REQUEST, "grant_type is required"));
        }

        final var handler = handlers.get(grantType);
        if (handler == null) {
            return Uni.createFrom()
                    .item(GrantResult.failure(
                            OAuthError.UNSUPPORTED_GRANT_TYPE, "Grant type " + grantType + " is not supported"));
        }
        if (!client.allowsGrantType(grantType)) {
            return Uni.createFrom()
                    .item(GrantResult.failure(
                            OAuthError.UNAUTHORIZED_CLIENT, "Client is not allowed to use grant type " + grantType));
        }

        final Uni<GrantResult> outcome;
        try {
            outcome = handler.handle(request, client);
        } catch (RuntimeException e) {
            return Uni.createFrom().item(internalError(grantType, client, e));
        }
        return outcome.onFailure().recoverWithItem(e -> internalError(grantType, client, e));
    }

    private static GrantResult internalError(String grantType, Client client, Throwable error) {
        LOG.errorf(error, "Grant handler for %s failed for client %s", grantType, client.clientId());
        return GrantResult.failure(OAuthError.SERVER_ERROR, INTERNAL_ERROR_DESCRIPTION);
    }
}
