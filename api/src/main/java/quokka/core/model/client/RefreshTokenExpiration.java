package quokka.core.model.client;

/**
 * How a refresh token's lifetime is computed.
 */
public enum RefreshTokenExpiration {

    /**
     * Fixed lifetime from first issuance.
     */
    ABSOLUTE,

    /**
     * Lifetime renewed on every use, capped by the absolute lifetime.
     */
    SLIDING
}
