package quokka.spi;

import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jose4j.jwk.PublicJsonWebKey;

import quokka.core.model.key.GeneratedKeyMaterial;
import quokka.core.model.key.KeyGenerationParams;
import quokka.core.model.key.SigningKey;

/**
 * SPI for signing key material backends.
 *
 * <p>A provider generates, holds and signs with key material for one storage
 * backend. Private key material never leaves a provider: generation returns
 * public metadata plus an opaque handle, and signing is offered as a
 * {@link JwsSigner} capability.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>local (priority: 0) - keys generated in-process, private half kept
 *       AES-256-GCM encrypted in the key record</li>
 *   <li>vault (priority: 100) - HashiCorp Vault Transit; keys never leave
 *       Vault</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Provider named in the request or key record</li>
 *   <li>Configured default provider (quokka.keys.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 *
 * <h2>Custom Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class CloudKmsKeyMaterialProvider implements KeyMaterialProvider {
 *
 *     @Override
 *     public String name() {
 *         return "cloud-kms";
 *     }
 *
 *     @Override
 *     public int priority() {
 *         return 150;
 *     }
 *
 *     // ...
 * }
 * }</pre>
 */
public interface KeyMaterialProvider {

    /**
     * Provider name, stored on every key record it generates.
     */
    String name();

    /**
     * Priority for automatic selection. Higher is preferred.
     */
    int priority();

    /**
     * Whether the backend can currently be used.
     *
     * <p>Called frequently; should return quickly.
     */
    boolean isAvailable();

    /**
     * Generate new key material.
     *
     * @param params generation parameters
     * @return public metadata and the provider-owned handle
     * @throws quokka.core.service.key.KeyProviderUnavailableException (as a
     *     failed Uni) if the backend cannot be reached
     */
    Uni<GeneratedKeyMaterial> generate(KeyGenerationParams params);

    /**
     * Produce a signer for a key this provider owns.
     *
     * @param key the key record
     * @return a signer bound to the key
     */
    Uni<JwsSigner> signer(SigningKey key);

    /**
     * The public verification key for an asymmetric key.
     *
     * @param key the key record
     * @return the public key, or empty for symmetric keys
     */
    Optional<PublicJsonWebKey> publicKey(SigningKey key);

    /**
     * Destroy key material held by the backend. Local keys have nothing to
     * destroy beyond the record itself.
     */
    Uni<Void> destroy(SigningKey key);

    /**
     * Health indicator for the readiness check.
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
