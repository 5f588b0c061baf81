package quokka.adapter.out.notification;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.ciba.CibaRequest;
import quokka.core.port.out.CibaUserNotificationService;
import quokka.core.util.SecureHash;

/**
 * Default user notification for CIBA: logs the request so that a developer
 * can approve it through the admin surface.
 *
 * <p>Deployments provide their own {@link CibaUserNotificationService} bean
 * (push notification, SMS, email) which replaces this one.
 */
@DefaultBean
@ApplicationScoped
public class LoggingCibaUserNotificationService implements CibaUserNotificationService {

    private static final Logger LOG = Logger.getLogger(LoggingCibaUserNotificationService.class);

    @Override
    public Uni<Void> notifyUser(CibaRequest request, String correlationId) {
        LOG.infof(
                "CIBA authentication requested: client=%s, subject=%s, correlation=%s, binding_message=%s",
                request.clientId(),
                SecureHash.fingerprint(request.hintSubjectId()),
                correlationId,
                request.bindingMessage());
        return Uni.createFrom().voidItem();
    }
}
