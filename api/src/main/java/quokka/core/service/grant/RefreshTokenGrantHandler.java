package quokka.core.service.grant;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.client.Client;
import quokka.core.model.client.RefreshTokenExpiration;
import quokka.core.model.client.RefreshTokenUsage;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.TokenRequest;
import quokka.core.model.token.RefreshToken;
import quokka.core.port.out.RefreshTokenStore;
import quokka.core.util.SecureHash;

/**
 * Handles {@code grant_type=refresh_token}.
 *
 * <p>One-time tokens are consumed atomically once the request has passed
 * validation, so a rejected request leaves the token usable. Presenting a
 * consumed one revokes every refresh token of its session. Reusable tokens
 * are only read.
 */
@ApplicationScoped
public class RefreshTokenGrantHandler implements GrantHandler {

    private static final Logger LOG = Logger.getLogger(RefreshTokenGrantHandler.class);

    private final RefreshTokenStore store;
    private final Clock clock;

    @Inject
    public RefreshTokenGrantHandler(RefreshTokenStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public String grantType() {
        return GrantTypes.REFRESH_TOKEN;
    }

    @Override
    public Uni<GrantResult> handle(TokenRequest request, Client client) {
        final var handle = request.parameter("refresh_token");
        if (handle.isEmpty()) {
            return Uni.createFrom().item(GrantResult.failure(OAuthError.INVALID_REQUEST, "refresh_token is required"));
        }

        final var oneTime = client.refreshTokenUsage() == RefreshTokenUsage.ONE_TIME_ONLY;

        return store.find(handle.get()).flatMap(found -> {
            if (found.isEmpty()) {
                return oneTime ? handleMissingToken(handle.get()) : invalidGrant("Invalid refresh token");
            }
            final var result = validate(found.get(), request, client);
            if (!oneTime || !result.success()) {
                return Uni.createFrom().item(result);
            }
            return store.consume(handle.get()).map(consumed -> consumed.isPresent()
                    ? result
                    : GrantResult.failure(OAuthError.INVALID_GRANT, "Refresh token has already been used"));
        });
    }

    private Uni<GrantResult> handleMissingToken(String handle) {
        return store.findConsumed(handle).flatMap(previous -> {
            if (previous.isEmpty()) {
                return invalidGrant("Invalid refresh token");
            }
            final var token = previous.get();
            LOG.warnf(
                    "Consumed refresh token %s presented again for client %s; revoking session",
                    SecureHash.fingerprint(handle), token.clientId());
            final Uni<Integer> revoked =
                    token.sessionId() == null ? Uni.createFrom().item(0) : store.revokeSession(token.sessionId());
            return revoked.map(count -> {
                LOG.debugf("Revoked %d refresh tokens after refresh token replay", count);
                return GrantResult.failure(OAuthError.INVALID_GRANT, "Refresh token has already been used");
            });
        });
    }

    private GrantResult validate(RefreshToken token, TokenRequest request, Client client) {
        if (!token.clientId().equals(client.clientId())) {
            LOG.warnf("Client %s presented a refresh token issued to another client", client.clientId());
            return GrantResult.failure(OAuthError.INVALID_GRANT, "Refresh token was issued to another client");
        }
        if (token.isExpired(clock.instant())) {
            return GrantResult.failure(OAuthError.INVALID_GRANT, "Refresh token has expired");
        }

        final var requested = GrantScopes.requested(request);
        final var scopeError = GrantScopes.checkSubset(requested, token.scopes());
        if (scopeError.isPresent()) {
            return GrantResult.failure(OAuthError.INVALID_SCOPE, scopeError.get());
        }

        if (token.isDpopBound() && !token.dpopKeyThumbprint().equals(request.dpopThumbprint().orElse(null))) {
            return GrantResult.failure(OAuthError.INVALID_GRANT, "Refresh token is bound to a different DPoP key");
        }

        final var rotate = client.refreshTokenUsage() == RefreshTokenUsage.ONE_TIME_ONLY
                || client.refreshTokenExpiration() == RefreshTokenExpiration.SLIDING;

        return GrantResult.success(grantType(), client.clientId())
                .subjectId(token.subjectId())
                .scopes(requested.isEmpty() ? token.scopes() : requested)
                .claims(token.claims())
                .sessionId(token.sessionId())
                .authTime(token.authTime())
                .amr(token.amr())
                .acr(token.acr())
                .dpopKeyThumbprint(token.dpopKeyThumbprint())
                .presentedRefreshToken(token)
                .issueRefreshToken(rotate)
                .build();
    }

    private static Uni<GrantResult> invalidGrant(String description) {
        return Uni.createFrom().item(GrantResult.failure(OAuthError.INVALID_GRANT, description));
    }
}
