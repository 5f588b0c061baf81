package quokka.core.model.dpop;

import quokka.core.model.grant.OAuthError;

/**
 * Result of validating a DPoP proof.
 */
public sealed interface DPoPValidationResult {

    /**
     * The proof is valid.
     *
     * @param thumbprint RFC 7638 SHA-256 thumbprint of the proof key
     * @param jti        the proof's unique identifier
     */
    record Valid(String thumbprint, String jti) implements DPoPValidationResult {}

    /**
     * The proof was rejected.
     *
     * @param error       {@code invalid_dpop_proof} or {@code use_dpop_nonce}
     * @param description client-safe description
     * @param freshNonce  nonce the client should use on retry, or null
     */
    record Invalid(OAuthError error, String description, String freshNonce) implements DPoPValidationResult {}
}
