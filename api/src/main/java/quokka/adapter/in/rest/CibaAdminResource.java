package quokka.adapter.in.rest;

import java.time.Instant;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import quokka.adapter.in.problem.QuokkaProblem;
import quokka.core.model.ciba.CibaRequest;
import quokka.core.model.ciba.CibaStatus;
import quokka.core.port.in.BackchannelAuthentication;

/**
 * Decision surface for the external CIBA approval journey.
 *
 * <p>The journey receives a correlation id with the user notification,
 * looks the request up, and records the user's decision.
 */
@Path("/admin/ciba")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(CibaAdminResource.ROLE_CIBA_APPROVER)
public class CibaAdminResource {

    static final String ROLE_CIBA_APPROVER = "ciba-approver";

    private final BackchannelAuthentication backchannel;

    @Inject
    public CibaAdminResource(BackchannelAuthentication backchannel) {
        this.backchannel = backchannel;
    }

    /**
     * What the approval UI shows the user.
     */
    @GET
    @Path("/correlation/{correlationId}")
    public Uni<PendingRequestResponse> findByCorrelation(@PathParam("correlationId") String correlationId) {
        return backchannel.findByCorrelation(correlationId).map(found -> found.map(PendingRequestResponse::from)
                .orElseThrow(() -> QuokkaProblem.resourceNotFound("CIBA Request", correlationId)));
    }

    @POST
    @Path("/{authReqId}/approve")
    public Uni<DecisionResponse> approve(@PathParam("authReqId") String authReqId, ApproveRequest request) {
        if (request == null || request.subjectId() == null || request.subjectId().isBlank()) {
            throw QuokkaProblem.validationError("subjectId is required");
        }
        return backchannel
                .approve(authReqId, request.subjectId(), request.sessionId())
                .map(DecisionResponse::new);
    }

    @POST
    @Path("/{authReqId}/deny")
    public Uni<DecisionResponse> deny(@PathParam("authReqId") String authReqId) {
        return backchannel.deny(authReqId).map(DecisionResponse::new);
    }

    // ========================================================================
    // Request/Response DTOs
    // ========================================================================

    public record ApproveRequest(String subjectId, String sessionId) {}

    public record DecisionResponse(CibaStatus status) {}

    public record PendingRequestResponse(
            String authReqId,
            String clientId,
            String scope,
            String bindingMessage,
            String subjectId,
            CibaStatus status,
            Instant expiresAt) {

        static PendingRequestResponse from(CibaRequest request) {
            return new PendingRequestResponse(
                    request.authReqId(),
                    request.clientId(),
                    String.join(" ", request.scopes()),
                    request.bindingMessage(),
                    request.hintSubjectId(),
                    request.status(),
                    request.expiresAt());
        }
    }
}
