package quokka.core.model.key;

/**
 * Thrown when a signing key is asked to move to a status its current status
 * does not permit.
 */
public class InvalidKeyTransitionException extends IllegalStateException {

    private final KeyStatus from;
    private final KeyStatus to;

    public InvalidKeyTransitionException(KeyStatus from, KeyStatus to) {
        super("Cannot transition signing key from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public KeyStatus getFrom() {
        return from;
    }

    public KeyStatus getTo() {
        return to;
    }
}
