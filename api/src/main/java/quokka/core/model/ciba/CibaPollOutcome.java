package quokka.core.model.ciba;

/**
 * What a token-endpoint poll observed.
 */
public enum CibaPollOutcome {
    PENDING,
    SLOW_DOWN,
    APPROVED,
    DENIED,
    EXPIRED,
    UNKNOWN,
    CLIENT_MISMATCH
}
