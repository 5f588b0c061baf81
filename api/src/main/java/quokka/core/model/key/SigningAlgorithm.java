package quokka.core.model.key;

import java.util.Arrays;
import java.util.Optional;

/**
 * JWS algorithms supported for token signing.
 *
 * <p>Each algorithm carries its key family, default key size (or curve size
 * for EC) and the digest used for OIDC left-half hashes such as
 * {@code at_hash}.
 */
public enum SigningAlgorithm {
    RS256(KeyType.RSA, 2048, "SHA-256"),
    RS384(KeyType.RSA, 3072, "SHA-384"),
    RS512(KeyType.RSA, 4096, "SHA-512"),
    PS256(KeyType.RSA, 2048, "SHA-256"),
    PS384(KeyType.RSA, 3072, "SHA-384"),
    PS512(KeyType.RSA, 4096, "SHA-512"),
    ES256(KeyType.EC, 256, "SHA-256"),
    ES384(KeyType.EC, 384, "SHA-384"),
    ES512(KeyType.EC, 521, "SHA-512"),
    HS256(KeyType.SYMMETRIC, 256, "SHA-256"),
    HS384(KeyType.SYMMETRIC, 384, "SHA-384"),
    HS512(KeyType.SYMMETRIC, 512, "SHA-512");

    private final KeyType keyType;
    private final int defaultKeySize;
    private final String digestAlgorithm;

    SigningAlgorithm(KeyType keyType, int defaultKeySize, String digestAlgorithm) {
        this.keyType = keyType;
        this.defaultKeySize = defaultKeySize;
        this.digestAlgorithm = digestAlgorithm;
    }

    public KeyType keyType() {
        return keyType;
    }

    public int defaultKeySize() {
        return defaultKeySize;
    }

    public String digestAlgorithm() {
        return digestAlgorithm;
    }

    /**
     * Whether the key material for this algorithm has a publishable public half.
     */
    public boolean isAsymmetric() {
        return keyType != KeyType.SYMMETRIC;
    }

    public static Optional<SigningAlgorithm> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(a -> a.name().equals(name)).findFirst();
    }
}
