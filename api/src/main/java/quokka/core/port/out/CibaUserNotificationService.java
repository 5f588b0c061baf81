package quokka.core.port.out;

import io.smallrye.mutiny.Uni;

import quokka.core.model.ciba.CibaRequest;

/**
 * Tells the end user that a backchannel authentication request awaits them.
 *
 * <p>The call is awaited by the caller, but a failure never fails the
 * authentication request; the user may still approve out of band.
 */
public interface CibaUserNotificationService {

    /**
     * Notify the user.
     *
     * @param request       the pending request
     * @param correlationId handle the approval UI resolves the request by
     * @return Uni completing when the notification was handed off
     */
    Uni<Void> notifyUser(CibaRequest request, String correlationId);
}
