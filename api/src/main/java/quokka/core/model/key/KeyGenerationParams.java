package quokka.core.model.key;

import java.util.Objects;

/**
 * Parameters handed to a key-material provider when generating a key.
 *
 * @param keyId     the identifier to assign to the new key
 * @param algorithm the JWS algorithm
 * @param keySize   key size in bits
 * @param use       key use
 */
public record KeyGenerationParams(String keyId, SigningAlgorithm algorithm, int keySize, KeyUse use) {

    public KeyGenerationParams {
        Objects.requireNonNull(keyId, "keyId cannot be null");
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(use, "use cannot be null");
        if (keySize <= 0) {
            throw new IllegalArgumentException("keySize must be positive");
        }
    }

    public KeyType keyType() {
        return algorithm.keyType();
    }
}
