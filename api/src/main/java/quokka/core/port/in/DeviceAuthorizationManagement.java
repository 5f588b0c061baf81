package quokka.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.client.Client;
import quokka.core.model.device.DeviceAuthorization;
import quokka.core.model.device.DeviceAuthorizationResponse;
import quokka.core.model.device.DeviceAuthorizationStatus;

/**
 * Use case for the device authorization flow (RFC 8628).
 */
public interface DeviceAuthorizationManagement {

    /**
     * Start a device authorization for an authenticated client.
     *
     * @param client   the requesting client
     * @param scope    space-delimited requested scopes, or null for the client's allowed scopes
     * @param tenantId resolved tenant, or null
     * @return Uni with the endpoint response
     * @throws IllegalArgumentException (as a failed Uni) when a scope is not allowed
     */
    Uni<DeviceAuthorizationResponse> start(Client client, String scope, String tenantId);

    Uni<Optional<DeviceAuthorization>> findByUserCode(String userCode);

    /**
     * Record approval by the user who entered {@code userCode}. Idempotent once decided.
     *
     * @return Uni with the resulting status, empty when the code is unknown or expired
     */
    Uni<Optional<DeviceAuthorizationStatus>> approve(String userCode, String subjectId, String sessionId);

    /**
     * Record denial. Idempotent once decided.
     *
     * @return Uni with the resulting status, empty when the code is unknown or expired
     */
    Uni<Optional<DeviceAuthorizationStatus>> deny(String userCode);
}
