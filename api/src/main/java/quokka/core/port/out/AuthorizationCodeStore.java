package quokka.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.token.AuthorizationCode;

/**
 * Storage for single-use authorization codes.
 *
 * <p>Implementations must ensure:
 * <ul>
 *   <li>{@link #consume} is an atomic retrieve-and-delete, so two concurrent
 *       redemptions of the same code cannot both succeed</li>
 *   <li>Codes expire automatically at {@link AuthorizationCode#expiresAt()}</li>
 *   <li>Consumed codes leave a tombstone until they would have expired, so
 *       replays can be detected</li>
 * </ul>
 */
public interface AuthorizationCodeStore {

    Uni<Void> store(AuthorizationCode code);

    /**
     * Atomically retrieve and remove a code.
     *
     * @param code the code value
     * @return the code, or empty if unknown or already consumed
     */
    Uni<Optional<AuthorizationCode>> consume(String code);

    /**
     * Look up a code that was already consumed.
     *
     * @param code the code value
     * @return the consumed code, or empty if it was never consumed or the
     *     tombstone has expired
     */
    Uni<Optional<AuthorizationCode>> findConsumed(String code);
}
