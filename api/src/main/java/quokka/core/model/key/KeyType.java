package quokka.core.model.key;

/**
 * Cryptographic family of a signing key.
 */
public enum KeyType {
    RSA,
    EC,
    SYMMETRIC
}
