package quokka.core.model.ciba;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

import quokka.core.model.client.CibaDeliveryMode;

/**
 * A backchannel authentication request.
 *
 * @param authReqId               opaque, unguessable request id
 * @param clientId                requesting client
 * @param tenantId                tenant, or null
 * @param scopes                  requested scopes
 * @param bindingMessage          message shown on both devices, or null
 * @param userCode                user code supplied by the client, or null
 * @param subjectHint             the raw hint the user was identified by
 * @param hintSubjectId           subject the hint resolved to
 * @param acrValues               requested ACR values, or null
 * @param status                  current status
 * @param createdAt               creation time
 * @param expiresAt               expiry time
 * @param interval                minimum seconds between polls
 * @param lastPolledAt            time of the previous poll, or null
 * @param subjectId               approving subject, set on approval
 * @param sessionId               session created on approval, or null
 * @param authTime                approval time, or null
 * @param deliveryMode            token delivery mode
 * @param clientNotificationToken bearer token for client notifications, or null
 * @param correlationId           protocol state handle used by the approval UI
 * @param redeemedAt              time the approved request yielded tokens, or null
 */
public record CibaRequest(
        String authReqId,
        String clientId,
        String tenantId,
        Set<String> scopes,
        String bindingMessage,
        String userCode,
        String subjectHint,
        String hintSubjectId,
        String acrValues,
        CibaStatus status,
        Instant createdAt,
        Instant expiresAt,
        int interval,
        Instant lastPolledAt,
        String subjectId,
        String sessionId,
        Instant authTime,
        CibaDeliveryMode deliveryMode,
        String clientNotificationToken,
        String correlationId,
        Instant redeemedAt) {

    public CibaRequest {
        Objects.requireNonNull(authReqId, "authReqId cannot be null");
        Objects.requireNonNull(clientId, "clientId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        Objects.requireNonNull(deliveryMode, "deliveryMode cannot be null");
        scopes = scopes == null ? Set.of() : scopes;
        if (interval < 0) {
            throw new IllegalArgumentException("interval cannot be negative");
        }
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public long expiresInSeconds(Instant now) {
        return Math.max(0, expiresAt.getEpochSecond() - now.getEpochSecond());
    }

    /**
     * Whether a poll at {@code now} arrives sooner than the polling interval
     * allows.
     */
    public boolean isPolledTooSoon(Instant now) {
        return lastPolledAt != null && lastPolledAt.plusSeconds(interval).isAfter(now);
    }

    public CibaRequest approve(String approvingSubject, String newSessionId, Instant now) {
        return transition(CibaStatus.APPROVED, approvingSubject, newSessionId, now, lastPolledAt);
    }

    public CibaRequest deny() {
        return transition(CibaStatus.DENIED, subjectId, sessionId, authTime, lastPolledAt);
    }

    public CibaRequest expire() {
        return transition(CibaStatus.EXPIRED, subjectId, sessionId, authTime, lastPolledAt);
    }

    public CibaRequest withLastPolledAt(Instant polledAt) {
        return transition(status, subjectId, sessionId, authTime, polledAt);
    }

    public boolean isRedeemed() {
        return redeemedAt != null;
    }

    /**
     * Mark an approved request as having yielded its tokens.
     */
    public CibaRequest redeem(Instant now) {
        if (status != CibaStatus.APPROVED) {
            throw new IllegalStateException("Only approved requests can be redeemed");
        }
        return new CibaRequest(
                authReqId,
                clientId,
                tenantId,
                scopes,
                bindingMessage,
                userCode,
                subjectHint,
                hintSubjectId,
                acrValues,
                status,
                createdAt,
                expiresAt,
                interval,
                lastPolledAt,
                subjectId,
                sessionId,
                authTime,
                deliveryMode,
                clientNotificationToken,
                correlationId,
                now);
    }

    private CibaRequest transition(
            CibaStatus newStatus, String newSubject, String newSession, Instant newAuthTime, Instant polledAt) {
        return new CibaRequest(
                authReqId,
                clientId,
                tenantId,
                scopes,
                bindingMessage,
                userCode,
                subjectHint,
                hintSubjectId,
                acrValues,
                newStatus,
                createdAt,
                expiresAt,
                interval,
                polledAt,
                newSubject,
                newSession,
                newAuthTime,
                deliveryMode,
                clientNotificationToken,
                correlationId,
                redeemedAt);
    }
}
