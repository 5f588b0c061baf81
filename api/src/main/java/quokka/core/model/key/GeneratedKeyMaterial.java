package quokka.core.model.key;

import java.util.Objects;

/**
 * What a key-material provider returns after generating a key.
 *
 * <p>Only public metadata and an opaque handle leave the provider. For the
 * local provider the handle is the encrypted private key; for remote
 * providers it is the remote key reference.
 *
 * @param keyId             identifier of the generated key
 * @param publicJwk         public JWK JSON, or null for symmetric keys
 * @param protectedMaterial provider-owned opaque value
 */
public record GeneratedKeyMaterial(String keyId, String publicJwk, String protectedMaterial) {

    public GeneratedKeyMaterial {
        Objects.requireNonNull(keyId, "keyId cannot be null");
        Objects.requireNonNull(protectedMaterial, "protectedMaterial cannot be null");
    }
}
