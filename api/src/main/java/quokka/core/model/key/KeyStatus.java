package quokka.core.model.key;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a signing key.
 *
 * <p>Transitions:
 * <pre>
 * PENDING ──activate──► ACTIVE ──expire──► EXPIRED ──archive──► ARCHIVED
 *    │                    │                   │
 *    └───────────────revoke───────────────────┴──────────────► REVOKED
 * </pre>
 *
 * <p>A superseded pending key may also be archived directly. REVOKED and
 * ARCHIVED are terminal.
 */
public enum KeyStatus {

    /**
     * Key generated and published in the JWKS but not yet used for signing.
     */
    PENDING,

    /**
     * Key eligible for signing new tokens and verifying existing ones.
     */
    ACTIVE,

    /**
     * Key past its expiry. Verification only, until the grace period ends.
     */
    EXPIRED,

    /**
     * Key withdrawn after a compromise or administrative action.
     */
    REVOKED,

    /**
     * Key retained for historical records only. Not published.
     */
    ARCHIVED;

    /**
     * Whether a key in this status may move to {@code target}.
     *
     * @param target the requested status
     * @return true if the transition is permitted
     */
    public boolean canTransitionTo(KeyStatus target) {
        return allowedTargets().contains(target);
    }

    /**
     * Validate a transition, throwing if it is not permitted.
     *
     * @param target the requested status
     * @return the target status
     * @throws InvalidKeyTransitionException if the transition is not permitted
     */
    public KeyStatus requireTransition(KeyStatus target) {
        if (!canTransitionTo(target)) {
            throw new InvalidKeyTransitionException(this, target);
        }
        return target;
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    private Set<KeyStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(ACTIVE, REVOKED, ARCHIVED);
            case ACTIVE -> EnumSet.of(EXPIRED, REVOKED);
            case EXPIRED -> EnumSet.of(ARCHIVED, REVOKED);
            case REVOKED, ARCHIVED -> EnumSet.noneOf(KeyStatus.class);
        };
    }
}
