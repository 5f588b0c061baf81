package quokka.core.model.device;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * An RFC 8628 device authorization.
 *
 * @param deviceCode   secret code the device polls with
 * @param userCode     short code the user types on a second device
 * @param clientId     requesting client
 * @param tenantId     tenant, or null
 * @param scopes       requested scopes
 * @param status       current status
 * @param createdAt    creation time
 * @param expiresAt    expiry time
 * @param interval     minimum seconds between polls
 * @param lastPolledAt time of the previous poll, or null
 * @param subjectId    approving subject, or null
 * @param sessionId    session created on approval, or null
 * @param authTime     approval time, or null
 */
public record DeviceAuthorization(
        String deviceCode,
        String userCode,
        String clientId,
        String tenantId,
        Set<String> scopes,
        DeviceAuthorizationStatus status,
        Instant createdAt,
        Instant expiresAt,
        int interval,
        Instant lastPolledAt,
        String subjectId,
        String sessionId,
        Instant authTime) {

    public DeviceAuthorization {
        Objects.requireNonNull(deviceCode, "deviceCode cannot be null");
        Objects.requireNonNull(userCode, "userCode cannot be null");
        Objects.requireNonNull(clientId, "clientId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        scopes = scopes == null ? Set.of() : scopes;
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isPolledTooSoon(Instant now) {
        return lastPolledAt != null && lastPolledAt.plusSeconds(interval).isAfter(now);
    }

    public DeviceAuthorization authorize(String approvingSubject, String newSessionId, Instant now) {
        return with(DeviceAuthorizationStatus.AUTHORIZED, lastPolledAt, approvingSubject, newSessionId, now);
    }

    public DeviceAuthorization deny() {
        return with(DeviceAuthorizationStatus.DENIED, lastPolledAt, subjectId, sessionId, authTime);
    }

    public DeviceAuthorization withLastPolledAt(Instant polledAt) {
        return with(status, polledAt, subjectId, sessionId, authTime);
    }

    private DeviceAuthorization with(
            DeviceAuthorizationStatus newStatus,
            Instant polledAt,
            String newSubject,
            String newSession,
            Instant newAuthTime) {
        return new DeviceAuthorization(
                deviceCode,
                userCode,
                clientId,
                tenantId,
                scopes,
                newStatus,
                createdAt,
                expiresAt,
                interval,
                polledAt,
                newSubject,
                newSession,
                newAuthTime);
    }
}
