package quokka.core.model.ciba;

/**
 * Status of a backchannel authentication request.
 *
 * <p>A request leaves PENDING exactly once; every other status is terminal.
 */
public enum CibaStatus {
    PENDING,
    APPROVED,
    DENIED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
