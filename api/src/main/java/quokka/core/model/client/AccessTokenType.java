package quokka.core.model.client;

/**
 * Access token format issued to a client.
 */
public enum AccessTokenType {
    JWT,
    REFERENCE
}
