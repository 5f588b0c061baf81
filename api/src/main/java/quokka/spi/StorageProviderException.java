package quokka.spi;

/**
 * Thrown when a storage backend fails.
 *
 * <p>Surfaced to protocol clients only as {@code server_error}; the cause is
 * logged server-side.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
