package quokka.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import quokka.core.model.key.InvalidKeyTransitionException;
import quokka.core.service.ciba.CibaRequestNotFoundException;
import quokka.core.service.key.KeyProviderUnavailableException;
import quokka.core.service.key.SigningKeyNotFoundException;
import quokka.spi.StorageProviderException;

/**
 * Maps domain exceptions escaping the admin surface to RFC 7807 responses.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapSigningKeyNotFound(SigningKeyNotFoundException e) {
        LOG.debugv("Signing key not found: {0}", e.getMessage());
        return toResponse(QuokkaProblem.resourceNotFound("Signing Key", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapCibaRequestNotFound(CibaRequestNotFoundException e) {
        return toResponse(QuokkaProblem.resourceNotFound("CIBA Request", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapInvalidKeyTransition(InvalidKeyTransitionException e) {
        LOG.debugv("Rejected key transition: {0}", e.getMessage());
        return toResponse(QuokkaProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapKeyProviderUnavailable(KeyProviderUnavailableException e) {
        LOG.warnv("Key provider {0} unavailable: {1}", e.getProviderName(), e.getMessage());
        return toResponse(QuokkaProblem.serviceUnavailable("Key provider unavailable: " + e.getProviderName()));
    }

    @ServerExceptionMapper
    public Response mapStorageProviderException(StorageProviderException e) {
        LOG.errorf(e, "Storage failure");
        return toResponse(QuokkaProblem.serviceUnavailable("Storage unavailable"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(QuokkaProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus()).type(PROBLEM_JSON).entity(problem).build();
    }
}
