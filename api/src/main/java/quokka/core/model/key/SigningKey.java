package quokka.core.model.key;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A signing key record.
 *
 * <p>The record holds public metadata only. Private material is kept in
 * {@code protectedMaterial}, an opaque value that only the owning
 * {@link quokka.spi.KeyMaterialProvider} can interpret (an encrypted private
 * key for the local provider, a remote key reference for a KMS). It is never
 * returned by the admin surface.
 *
 * <p>Status changes go through {@link KeyStatus#requireTransition(KeyStatus)},
 * so an invalid lifecycle move fails loudly instead of silently corrupting the
 * key set.
 *
 * @param keyId              unique key identifier ({@code kid})
 * @param tenantId           owning tenant, or null for the default tenant
 * @param clientId           owning client, or null for tenant-wide keys
 * @param keyType            key family
 * @param algorithm          JWS algorithm
 * @param keySize            modulus size, curve size or secret size in bits
 * @param use                key use
 * @param status             lifecycle status
 * @param createdAt          creation timestamp
 * @param activateAt         when the key becomes eligible to sign
 * @param expiresAt          when the key stops signing
 * @param priority           signing preference, highest wins
 * @param signatureCount     number of signatures produced
 * @param lastUsedAt         last signature timestamp, or null
 * @param providerName       name of the owning key-material provider
 * @param publicJwk          public JWK JSON, or null for symmetric keys
 * @param protectedMaterial  provider-owned opaque material
 * @param rotationWindow     idempotency tag for scheduled generation, or null
 * @param revokedAt          revocation timestamp, or null
 * @param revocationReason   revocation reason, or null
 */
public record SigningKey(
        String keyId,
        String tenantId,
        String clientId,
        KeyType keyType,
        SigningAlgorithm algorithm,
        int keySize,
        KeyUse use,
        KeyStatus status,
        Instant createdAt,
        Instant activateAt,
        Instant expiresAt,
        int priority,
        long signatureCount,
        Instant lastUsedAt,
        String providerName,
        String publicJwk,
        String protectedMaterial,
        String rotationWindow,
        Instant revokedAt,
        String revocationReason) {

    public static final int DEFAULT_PRIORITY = 100;
    public static final int ROTATED_IN_PRIORITY = 200;
    public static final int DEMOTED_PRIORITY = 50;

    public SigningKey {
        Objects.requireNonNull(keyId, "keyId cannot be null");
        Objects.requireNonNull(keyType, "keyType cannot be null");
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(use, "use cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        Objects.requireNonNull(activateAt, "activateAt cannot be null");
        Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        Objects.requireNonNull(providerName, "providerName cannot be null");
        if (keyId.isBlank()) {
            throw new IllegalArgumentException("keyId cannot be blank");
        }
        if (algorithm.keyType() != keyType) {
            throw new IllegalArgumentException(
                    "Algorithm %s does not match key type %s".formatted(algorithm, keyType));
        }
        if (!expiresAt.isAfter(activateAt)) {
            throw new IllegalArgumentException("expiresAt must be after activateAt");
        }
    }

    /**
     * Move a pending key to ACTIVE.
     */
    public SigningKey activate() {
        return withStatus(status.requireTransition(KeyStatus.ACTIVE));
    }

    /**
     * Move an active key to EXPIRED.
     */
    public SigningKey expire() {
        return withStatus(status.requireTransition(KeyStatus.EXPIRED));
    }

    /**
     * Move a pending or expired key to ARCHIVED.
     */
    public SigningKey archive() {
        return withStatus(status.requireTransition(KeyStatus.ARCHIVED));
    }

    /**
     * Revoke the key.
     *
     * @param reason why the key was revoked
     * @param now    revocation time
     */
    public SigningKey revoke(String reason, Instant now) {
        status.requireTransition(KeyStatus.REVOKED);
        return new SigningKey(
                keyId,
                tenantId,
                clientId,
                keyType,
                algorithm,
                keySize,
                use,
                KeyStatus.REVOKED,
                createdAt,
                activateAt,
                expiresAt,
                priority,
                signatureCount,
                lastUsedAt,
                providerName,
                publicJwk,
                protectedMaterial,
                rotationWindow,
                now,
                reason);
    }

    public SigningKey withPriority(int newPriority) {
        return new SigningKey(
                keyId,
                tenantId,
                clientId,
                keyType,
                algorithm,
                keySize,
                use,
                status,
                createdAt,
                activateAt,
                expiresAt,
                newPriority,
                signatureCount,
                lastUsedAt,
                providerName,
                publicJwk,
                protectedMaterial,
                rotationWindow,
                revokedAt,
                revocationReason);
    }

    /**
     * Record one signature.
     *
     * @param now signature time
     */
    public SigningKey recordUsage(Instant now) {
        return new SigningKey(
                keyId,
                tenantId,
                clientId,
                keyType,
                algorithm,
                keySize,
                use,
                status,
                createdAt,
                activateAt,
                expiresAt,
                priority,
                signatureCount + 1,
                now,
                providerName,
                publicJwk,
                protectedMaterial,
                rotationWindow,
                revokedAt,
                revocationReason);
    }

    /**
     * Whether this key may sign a new token at {@code now}.
     */
    public boolean canSign(Instant now) {
        return status == KeyStatus.ACTIVE
                && use == KeyUse.SIGNING
                && !activateAt.isAfter(now)
                && expiresAt.isAfter(now);
    }

    /**
     * Whether a pending key has reached its activation time.
     */
    public boolean isDueForActivation(Instant now) {
        return status == KeyStatus.PENDING && !activateAt.isAfter(now);
    }

    public boolean isPastExpiry(Instant now) {
        return !expiresAt.isAfter(now);
    }

    /**
     * Whether this key belongs in the published JWKS.
     *
     * <p>Pending, active and expired-within-grace asymmetric keys are
     * published. Revoked and archived keys never are.
     *
     * @param now         evaluation time
     * @param gracePeriod how long an expired key stays verifiable
     */
    public boolean isPublishable(Instant now, Duration gracePeriod) {
        if (publicJwk == null || !algorithm.isAsymmetric()) {
            return false;
        }
        return switch (status) {
            case PENDING, ACTIVE -> true;
            case EXPIRED -> expiresAt.plus(gracePeriod).isAfter(now);
            case REVOKED, ARCHIVED -> false;
        };
    }

    /**
     * Whether this key is scoped to the given tenant and client.
     *
     * <p>Null values match the default (tenant-wide or global) scope only.
     */
    public boolean belongsTo(String tenant, String client) {
        return Objects.equals(tenantId, tenant) && Objects.equals(clientId, client);
    }

    public Optional<String> publicJwkJson() {
        return Optional.ofNullable(publicJwk);
    }

    private SigningKey withStatus(KeyStatus newStatus) {
        return new SigningKey(
                keyId,
                tenantId,
                clientId,
                keyType,
                algorithm,
                keySize,
                use,
                newStatus,
                createdAt,
                activateAt,
                expiresAt,
                priority,
                signatureCount,
                lastUsedAt,
                providerName,
                publicJwk,
                protectedMaterial,
                rotationWindow,
                revokedAt,
                revocationReason);
    }
}
