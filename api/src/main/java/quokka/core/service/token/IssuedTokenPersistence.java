package quokka.core.service.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import quokka.core.model.token.IssuedTokens;
import quokka.core.port.out.ReferenceTokenStore;
import quokka.core.port.out.RefreshTokenStore;

/**
 * Persists the refresh token and reference access token of a token response.
 */
@ApplicationScoped
public class IssuedTokenPersistence {

    private final RefreshTokenStore refreshTokens;
    private final ReferenceTokenStore referenceTokens;

    @Inject
    public IssuedTokenPersistence(RefreshTokenStore refreshTokens, ReferenceTokenStore referenceTokens) {
        this.refreshTokens = refreshTokens;
        this.referenceTokens = referenceTokens;
    }

    public Uni<IssuedTokens> persist(IssuedTokens tokens) {
        final Uni<Void> refresh = tokens.refreshTokenToStore()
                .map(refreshTokens::store)
                .orElseGet(() -> Uni.createFrom().voidItem());
        return refresh.flatMap(ignored -> tokens.referenceTokenToStore()
                        .map(referenceTokens::store)
                        .orElseGet(() -> Uni.createFrom().voidItem()))
                .replaceWith(tokens);
    }
}
