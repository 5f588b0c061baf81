package quokka.core.service.key;

/**
 * Thrown when no key can sign for a scope, or a requested key does not exist.
 */
public class SigningKeyNotFoundException extends RuntimeException {

    public SigningKeyNotFoundException(String message) {
        super(message);
    }
}
