package quokka.core.model.key;

import java.time.Duration;
import java.time.Instant;

/**
 * Administrative request to generate a signing key.
 *
 * <p>Every field except the scope is optional; unset values fall back to the
 * configured defaults.
 *
 * @param tenantId     owning tenant, or null for the default tenant
 * @param clientId     owning client, or null for tenant-wide keys
 * @param algorithm    JWS algorithm, or null for the configured default
 * @param keySize      key size in bits, or null for the algorithm default
 * @param providerName key-material provider, or null for the default provider
 * @param lifetime     key lifetime, or null for the configured default
 * @param activateAt   activation time; null or past means active immediately
 * @param priority     signing priority, or null for the default
 */
public record KeyGenerationRequest(
        String tenantId,
        String clientId,
        SigningAlgorithm algorithm,
        Integer keySize,
        String providerName,
        Duration lifetime,
        Instant activateAt,
        Integer priority) {

    public static KeyGenerationRequest forScope(String tenantId, String clientId) {
        return new KeyGenerationRequest(tenantId, clientId, null, null, null, null, null, null);
    }

    public KeyGenerationRequest withPriority(int newPriority) {
        return new KeyGenerationRequest(
                tenantId, clientId, algorithm, keySize, providerName, lifetime, activateAt, newPriority);
    }

    public KeyGenerationRequest withActivateAt(Instant newActivateAt) {
        return new KeyGenerationRequest(
                tenantId, clientId, algorithm, keySize, providerName, lifetime, newActivateAt, priority);
    }
}
