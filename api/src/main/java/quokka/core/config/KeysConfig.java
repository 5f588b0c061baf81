package quokka.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import quokka.core.model.key.SigningAlgorithm;

/**
 * Configuration mapping for signing key management.
 *
 * <p>Configuration prefix: {@code quokka.keys}
 *
 * <p>Example configuration:
 * <pre>{@code
 * quokka.keys.algorithm=ES256
 * quokka.keys.provider=vault
 * quokka.keys.lifetime=P90D
 * quokka.keys.rotation-lead=P14D
 * quokka.keys.grace-period=P7D
 * quokka.keys.vault.address=https://vault.internal:8200
 * }</pre>
 */
@ConfigMapping(prefix = "quokka.keys")
public interface KeysConfig {

    /**
     * Default signing algorithm for generated keys.
     */
    @WithDefault("RS256")
    SigningAlgorithm algorithm();

    /**
     * Default key-material provider. Falls back to the highest priority
     * available provider when the named one is unavailable.
     */
    @WithDefault("local")
    String provider();

    /**
     * How long a generated key signs before it expires.
     */
    @WithDefault("P90D")
    Duration lifetime();

    /**
     * How long before expiry the scheduled sweep generates a successor.
     */
    @WithDefault("P14D")
    Duration rotationLead();

    /**
     * How long an expired key stays published for verification.
     */
    @WithDefault("P7D")
    Duration gracePeriod();

    /**
     * Maximum keys retained per (tenant, client) scope. Oldest archived and
     * expired keys go first.
     */
    @WithDefault("10")
    int maxKeys();

    /**
     * JWKS cache lifetime, also published as the endpoint's max-age.
     */
    @WithDefault("PT10M")
    Duration jwksCacheDuration();

    /**
     * Generate and activate a key automatically when none can sign.
     */
    @WithDefault("true")
    boolean autoGenerate();

    /**
     * Whether signatures made by a revoked key still verify.
     *
     * <p>Revoked keys are always removed from the JWKS and never sign new
     * tokens. This flag only governs verification of tokens already issued.
     */
    @WithDefault("false")
    boolean honorRevokedSignatures();

    /**
     * Interval of the scheduled rotation sweep.
     */
    @WithDefault("1h")
    String schedule();

    /**
     * Local provider configuration.
     */
    LocalConfig local();

    /**
     * Vault Transit provider configuration.
     */
    VaultConfig vault();

    interface LocalConfig {

        /**
         * Base64-encoded 256-bit AES key protecting local private keys.
         *
         * <p>When absent an ephemeral key is generated at startup and local
         * keys do not survive a restart.
         */
        Optional<String> masterKey();

        /**
         * Identifier of the master key, embedded in every ciphertext.
         */
        @WithDefault("v1")
        String masterKeyId();
    }

    interface VaultConfig {

        /**
         * Vault address. The provider is unavailable when unset.
         */
        Optional<String> address();

        /**
         * Vault token.
         */
        Optional<String> token();

        /**
         * Optional namespace for Vault Enterprise.
         */
        Optional<String> namespace();

        /**
         * Mount path of the Transit secrets engine.
         */
        @WithDefault("transit")
        String mount();

        /**
         * Request timeout.
         */
        @WithDefault("PT5S")
        Duration timeout();
    }
}
