package quokka.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.key.KeyGenerationRequest;
import quokka.core.model.key.SigningKey;

/**
 * Port for administering signing keys.
 *
 * <p>Key records returned through this port still carry provider-owned
 * protected material; adapters must render metadata only.
 */
public interface SigningKeyManagement {

    /**
     * Generate a key. The key starts ACTIVE, or PENDING when the request
     * names a future activation time.
     *
     * @param request generation parameters; unset values use configured defaults
     * @return Uni with the stored key
     */
    Uni<SigningKey> generateKey(KeyGenerationRequest request);

    /**
     * Generate a new key for a scope and demote the keys it replaces.
     *
     * <p>The new key signs immediately. Replaced keys stay ACTIVE at a lower
     * priority so tokens they signed keep verifying until they expire.
     *
     * @param tenantId owning tenant, or null for the default tenant
     * @param clientId owning client, or null for tenant-wide keys
     * @param reason   audit reason
     * @return Uni with the new key
     */
    Uni<SigningKey> rotateKeys(String tenantId, String clientId, String reason);

    /**
     * Revoke a key. Revoked keys leave the JWKS at once and never sign again.
     *
     * @param keyId  key to revoke
     * @param reason audit reason
     * @return Uni with the revoked key; fails with
     *     {@link quokka.core.service.key.SigningKeyNotFoundException} if unknown
     */
    Uni<SigningKey> revokeKey(String keyId, String reason);

    /**
     * List keys, optionally filtered by tenant and client.
     */
    Uni<List<SigningKey>> listKeys(String tenantId, String clientId);

    Uni<Optional<SigningKey>> getKey(String keyId);
}
