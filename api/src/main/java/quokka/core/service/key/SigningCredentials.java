package quokka.core.service.key;

import java.util.Map;

import io.smallrye.mutiny.Uni;

import quokka.core.model.key.SigningKey;
import quokka.spi.JwsSigner;

/**
 * The key selected to sign, together with its signer.
 *
 * @param key    the selected key record
 * @param signer signer bound to the key
 */
public record SigningCredentials(SigningKey key, JwsSigner signer) {

    public String keyId() {
        return key.keyId();
    }

    /**
     * Digest used for OIDC left-half hashes ({@code at_hash}, {@code c_hash}).
     */
    public String digestAlgorithm() {
        return key.algorithm().digestAlgorithm();
    }

    public Uni<String> sign(String payloadJson, Map<String, Object> headers) {
        return signer.sign(payloadJson, headers);
    }
}
