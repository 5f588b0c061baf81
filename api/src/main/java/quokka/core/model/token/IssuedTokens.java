package quokka.core.model.token;

import java.util.Objects;
import java.util.Optional;

/**
 * A token response plus the records the caller must persist before the
 * response is returned.
 *
 * @param response       the wire response
 * @param refreshToken   new refresh token record to store, or null
 * @param referenceToken reference token claims to store, or null
 */
public record IssuedTokens(TokenResponse response, RefreshToken refreshToken, ReferenceToken referenceToken) {

    public IssuedTokens {
        Objects.requireNonNull(response, "response cannot be null");
    }

    public Optional<RefreshToken> refreshTokenToStore() {
        return Optional.ofNullable(refreshToken);
    }

    public Optional<ReferenceToken> referenceTokenToStore() {
        return Optional.ofNullable(referenceToken);
    }
}
