package quokka.core.model.dpop;

import java.util.Objects;

/**
 * Input for validating a DPoP proof.
 *
 * @param proof              the compact proof JWT from the {@code DPoP} header
 * @param httpMethod         method of the request the proof accompanies
 * @param httpUri            URI of the request the proof accompanies
 * @param accessToken        access token the proof is bound to, or null
 * @param expectedThumbprint key thumbprint the proof must use, or null
 * @param nonceRequired      whether a server-issued nonce must be present
 */
public record DPoPValidationRequest(
        String proof,
        String httpMethod,
        String httpUri,
        String accessToken,
        String expectedThumbprint,
        boolean nonceRequired) {

    public DPoPValidationRequest {
        Objects.requireNonNull(proof, "proof cannot be null");
        Objects.requireNonNull(httpMethod, "httpMethod cannot be null");
        Objects.requireNonNull(httpUri, "httpUri cannot be null");
    }
}
