package quokka.core.model.client;

/**
 * Whether a refresh token may be presented more than once.
 */
public enum RefreshTokenUsage {

    /**
     * Each refresh consumes the token and issues a replacement.
     */
    ONE_TIME_ONLY,

    /**
     * The same token may be reused until it expires.
     */
    REUSE
}
