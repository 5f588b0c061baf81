package quokka.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.token.RefreshToken;

/**
 * Storage for refresh tokens.
 *
 * <p>{@link #consume} must be a single atomic retrieve-and-delete. One-time
 * tokens are redeemed through it, which guarantees that after a successful
 * refresh the old token is never accepted again.
 */
public interface RefreshTokenStore {

    Uni<Void> store(RefreshToken token);

    /**
     * Read a token without consuming it.
     */
    Uni<Optional<RefreshToken>> find(String handle);

    /**
     * Atomically retrieve and remove a token.
     *
     * @return the token, or empty if unknown or already consumed
     */
    Uni<Optional<RefreshToken>> consume(String handle);

    /**
     * Look up a one-time token that was already consumed.
     */
    Uni<Optional<RefreshToken>> findConsumed(String handle);

    /**
     * Remove every token issued for a session.
     *
     * @return number of tokens removed
     */
    Uni<Integer> revokeSession(String sessionId);
}
