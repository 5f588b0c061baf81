package quokka.core.model.token;

import java.util.Optional;

import quokka.core.model.grant.OAuthError;

/**
 * What the token endpoint answers.
 */
public sealed interface TokenEndpointResult {

    /**
     * Nonce for the {@code DPoP-Nonce} response header, or null.
     */
    String dpopNonce();

    default Optional<String> dpopNonceValue() {
        return Optional.ofNullable(dpopNonce());
    }

    record Issued(TokenResponse response, String dpopNonce) implements TokenEndpointResult {}

    record Failed(OAuthError error, String description, String dpopNonce) implements TokenEndpointResult {

        public static Failed of(OAuthError error, String description) {
            return new Failed(error, description, null);
        }
    }
}
