package quokka.core.model.client;

import java.util.Locale;
import java.util.Optional;

/**
 * CIBA token delivery mode registered for a client.
 */
public enum CibaDeliveryMode {
    POLL,
    PING,
    PUSH;

    /**
     * Whether the client's notification endpoint is called in this mode.
     */
    public boolean notifiesClient() {
        return this != POLL;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CibaDeliveryMode> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (final var mode : values()) {
            if (mode.wireValue().equals(value)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
