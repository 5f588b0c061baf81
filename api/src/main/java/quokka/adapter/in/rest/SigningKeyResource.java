package quokka.adapter.in.rest;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

import jakarta.annotation.security.RolesAllowed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import quokka.adapter.in.problem.QuokkaProblem;
import quokka.core.model.key.KeyGenerationRequest;
import quokka.core.model.key.KeyStatus;
import quokka.core.model.key.SigningAlgorithm;
import quokka.core.model.key.SigningKey;
import quokka.core.port.in.SigningKeyManagement;

/**
 * REST resource for signing key administration.
 *
 * <p>Provides endpoints for:
 * <ul>
 *   <li>Listing keys, optionally by tenant and client</li>
 *   <li>Viewing a key</li>
 *   <li>Generating a key</li>
 *   <li>Rotating the keys of a scope</li>
 *   <li>Revoking a key</li>
 * </ul>
 *
 * <p>Responses carry key metadata only. Provider-owned material never leaves
 * the service.
 */
@Path("/admin/keys")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RolesAllowed(SigningKeyResource.ROLE_KEY_ADMIN)
public class SigningKeyResource {

    static final String ROLE_KEY_ADMIN = "key-admin";

    private final SigningKeyManagement keyManagement;

    @Inject
    public SigningKeyResource(SigningKeyManagement keyManagement) {
        this.keyManagement = keyManagement;
    }

    @GET
    public Uni<List<KeySummaryResponse>> listKeys(
            @QueryParam("tenantId") String tenantId, @QueryParam("clientId") String clientId) {
        return keyManagement
                .listKeys(tenantId, clientId)
                .map(keys -> keys.stream().map(KeySummaryResponse::from).toList());
    }

    @GET
    @Path("/{keyId}")
    public Uni<KeySummaryResponse> getKey(@PathParam("keyId") String keyId) {
        return keyManagement.getKey(keyId).map(key -> key.map(KeySummaryResponse::from)
                .orElseThrow(() -> QuokkaProblem.resourceNotFound("Signing Key", keyId)));
    }

    /**
     * Generate a key. Unset fields use the configured defaults.
     *
     * @return 201 with the new key
     */
    @POST
    public Uni<Response> generateKey(GenerateKeyRequest request) {
        final var generation = request == null
                ? KeyGenerationRequest.forScope(null, null)
                : request.toGenerationRequest();
        return keyManagement.generateKey(generation).map(key -> Response.status(Response.Status.CREATED)
                .entity(KeySummaryResponse.from(key))
                .build());
    }

    /**
     * Generate a replacement key for a scope and demote the keys it replaces.
     *
     * @return 201 with the new key
     */
    @POST
    @Path("/rotate")
    public Uni<Response> rotateKeys(RotateKeyRequest request) {
        final var tenantId = request == null ? null : request.tenantId();
        final var clientId = request == null ? null : request.clientId();
        final var reason =
                request != null && request.reason() != null ? request.reason() : "Manual rotation via admin API";

        return keyManagement
                .rotateKeys(tenantId, clientId, reason)
                .map(key -> Response.status(Response.Status.CREATED)
                        .entity(KeySummaryResponse.from(key))
                        .build());
    }

    /**
     * Revoke a key. It leaves the JWKS immediately.
     */
    @POST
    @Path("/{keyId}/revoke")
    public Uni<KeySummaryResponse> revokeKey(@PathParam("keyId") String keyId, RevokeKeyRequest request) {
        final var reason = request != null && request.reason() != null ? request.reason() : "Revoked via admin API";
        return keyManagement.revokeKey(keyId, reason).map(KeySummaryResponse::from);
    }

    // ========================================================================
    // Request/Response DTOs
    // ========================================================================

    public record GenerateKeyRequest(
            String tenantId,
            String clientId,
            String algorithm,
            Integer keySize,
            String provider,
            String lifetime,
            Instant activateAt,
            Integer priority) {

        KeyGenerationRequest toGenerationRequest() {
            final var parsedAlgorithm = algorithm == null
                    ? null
                    : SigningAlgorithm.fromName(algorithm)
                            .orElseThrow(() -> QuokkaProblem.validationError("Unsupported algorithm: " + algorithm));
            return new KeyGenerationRequest(
                    tenantId, clientId, parsedAlgorithm, keySize, provider, parseLifetime(), activateAt, priority);
        }

        private Duration parseLifetime() {
            if (lifetime == null) {
                return null;
            }
            try {
                return Duration.parse(lifetime);
            } catch (DateTimeParseException e) {
                throw QuokkaProblem.validationError("lifetime must be an ISO-8601 duration, for example P90D");
            }
        }
    }

    public record RotateKeyRequest(String tenantId, String clientId, String reason) {}

    public record RevokeKeyRequest(String reason) {}

    public record KeySummaryResponse(
            String keyId,
            String tenantId,
            String clientId,
            String algorithm,
            int keySize,
            String use,
            KeyStatus status,
            Instant createdAt,
            Instant activateAt,
            Instant expiresAt,
            int priority,
            long signatureCount,
            Instant lastUsedAt,
            String provider,
            Instant revokedAt,
            String revocationReason) {

        public static KeySummaryResponse from(SigningKey key) {
            return new KeySummaryResponse(
                    key.keyId(),
                    key.tenantId(),
                    key.clientId(),
                    key.algorithm().name(),
                    key.keySize(),
                    key.use().jwkValue(),
                    key.status(),
                    key.createdAt(),
                    key.activateAt(),
                    key.expiresAt(),
                    key.priority(),
                    key.signatureCount(),
                    key.lastUsedAt(),
                    key.providerName(),
                    key.revokedAt(),
                    key.revocationReason());
        }
    }
}
