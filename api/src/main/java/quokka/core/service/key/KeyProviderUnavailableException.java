package quokka.core.service.key;

/**
 * Thrown when a key-material provider cannot currently be reached.
 *
 * <p>Retryable. Distinct from {@link SigningKeyNotFoundException}, which means
 * no usable key exists at all.
 */
public class KeyProviderUnavailableException extends RuntimeException {

    private final String providerName;

    public KeyProviderUnavailableException(String providerName, String message) {
        super(message);
        this.providerName = providerName;
    }

    public KeyProviderUnavailableException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
