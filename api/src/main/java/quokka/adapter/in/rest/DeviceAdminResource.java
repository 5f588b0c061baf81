package quokka.adapter.in.rest;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import quokka.adapter.in.problem.QuokkaProblem;
import quokka.core.model.device.DeviceAuthorizationStatus;
import quokka.core.port.in.DeviceAuthorizationManagement;

/**
 * Decision surface for the external device verification page.
 */
@Path("/admin/device")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(DeviceAdminResource.ROLE_DEVICE_APPROVER)
public class DeviceAdminResource {

    static final String ROLE_DEVICE_APPROVER = "device-approver";

    private final DeviceAuthorizationManagement deviceAuthorizations;

    @Inject
    public DeviceAdminResource(DeviceAuthorizationManagement deviceAuthorizations) {
        this.deviceAuthorizations = deviceAuthorizations;
    }

    @POST
    @Path("/{userCode}/approve")
    public Uni<DecisionResponse> approve(@PathParam("userCode") String userCode, ApproveRequest request) {
        if (request == null || request.subjectId() == null || request.subjectId().isBlank()) {
            throw QuokkaProblem.validationError("subjectId is required");
        }
        return deviceAuthorizations
                .approve(userCode, request.subjectId(), request.sessionId())
                .map(status -> new DecisionResponse(status.orElseThrow(
                        () -> QuokkaProblem.resourceNotFound("Device Authorization", userCode))));
    }

    @POST
    @Path("/{userCode}/deny")
    public Uni<DecisionResponse> deny(@PathParam("userCode") String userCode) {
        return deviceAuthorizations
                .deny(userCode)
                .map(status -> new DecisionResponse(status.orElseThrow(
                        () -> QuokkaProblem.resourceNotFound("Device Authorization", userCode))));
    }

    public record ApproveRequest(String subjectId, String sessionId) {}

    public record DecisionResponse(DeviceAuthorizationStatus status) {}
}
