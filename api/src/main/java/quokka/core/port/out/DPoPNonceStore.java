package quokka.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Replay and nonce storage for DPoP proofs.
 */
public interface DPoPNonceStore {

    /**
     * Atomically record that a proof identifier has been used.
     *
     * @param proofId unique proof identifier (key thumbprint and {@code jti})
     * @param ttl     how long to remember the identifier
     * @return true if this is the first use, false on replay
     */
    Uni<Boolean> tryMarkAsUsed(String proofId, Duration ttl);

    /**
     * Issue a fresh server nonce.
     *
     * @param ttl nonce lifetime
     * @return the nonce value
     */
    Uni<String> issueNonce(Duration ttl);

    /**
     * Consume a server nonce. Each nonce is valid once.
     *
     * @return true if the nonce was issued, unexpired and unused
     */
    Uni<Boolean> consumeNonce(String nonce);
}
