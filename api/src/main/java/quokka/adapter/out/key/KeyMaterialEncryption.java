package quokka.adapter.out.key;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import quokka.core.config.KeysConfig;

/**
 * Encrypts locally generated private keys at rest.
 *
 * <p>Uses AES-256-GCM with a unique IV per operation. When no master key is
 * configured an ephemeral one is generated, so local keys cannot be
 * decrypted after a restart.
 *
 * <h2>Configuration</h2>
 * <pre>
 * quokka.keys.local.master-key=${KEY_MASTER_KEY}  # Base64-encoded 256-bit key
 * quokka.keys.local.master-key-id=v1              # For future master key rotation
 * </pre>
 *
 * <h2>Encrypted Data Format</h2>
 * <pre>
 * [keyIdLength (1 byte)][keyId (variable)][IV (12 bytes)][ciphertext][authTag (16 bytes)]
 * </pre>
 */
@ApplicationScoped
public class KeyMaterialEncryption {

    private static final Logger LOG = Logger.getLogger(KeyMaterialEncryption.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int MASTER_KEY_BYTES = 32;

    private final SecretKey secretKey;
    private final String masterKeyId;
    private final SecureRandom secureRandom = new SecureRandom();

    @Inject
    public KeyMaterialEncryption(KeysConfig config) {
        this(config.local().masterKey().filter(k -> !k.isBlank()).orElse(null), config.local().masterKeyId());
    }

    KeyMaterialEncryption(String base64MasterKey, String masterKeyId) {
        this.masterKeyId = masterKeyId;
        if (base64MasterKey != null) {
            final var keyBytes = Base64.getDecoder().decode(base64MasterKey);
            if (keyBytes.length != MASTER_KEY_BYTES) {
                throw new IllegalArgumentException(
                        "Master key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
            }
            this.secretKey = new SecretKeySpec(keyBytes, "AES");
            LOG.infof("Local key material encryption using master key ID: %s", masterKeyId);
        } else {
            final var keyBytes = new byte[MASTER_KEY_BYTES];
            secureRandom.nextBytes(keyBytes);
            this.secretKey = new SecretKeySpec(keyBytes, "AES");
            LOG.warn("No quokka.keys.local.master-key configured. Using an ephemeral master key; "
                    + "locally generated signing keys will be unusable after a restart.");
        }
    }

    /**
     * Encrypt private key material.
     *
     * @param plaintext serialized private JWK
     * @return Base64-encoded envelope
     */
    public String encrypt(String plaintext) {
        try {
            final var iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            final var ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            final var keyIdBytes = masterKeyId.getBytes(StandardCharsets.UTF_8);

            final var buffer = ByteBuffer.allocate(1 + keyIdBytes.length + IV_LENGTH + ciphertext.length);
            buffer.put((byte) keyIdBytes.length);
            buffer.put(keyIdBytes);
            buffer.put(iv);
            buffer.put(ciphertext);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt key material", e);
        }
    }

    /**
     * Decrypt private key material.
     *
     * @param envelope Base64-encoded envelope produced by {@link #encrypt}
     * @return serialized private JWK
     * @throws IllegalStateException if the envelope cannot be decrypted
     */
    public String decrypt(String envelope) {
        try {
            final var buffer = ByteBuffer.wrap(Base64.getDecoder().decode(envelope));

            final var keyIdBytes = new byte[buffer.get() & 0xFF];
            buffer.get(keyIdBytes);
            final var dataKeyId = new String(keyIdBytes, StandardCharsets.UTF_8);
            if (!masterKeyId.equals(dataKeyId)) {
                LOG.warnf("Master key ID mismatch: expected %s, got %s", masterKeyId, dataKeyId);
            }

            final var iv = new byte[IV_LENGTH];
            buffer.get(iv);
            final var ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);

            final var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | RuntimeException e) {
            throw new IllegalStateException("Failed to decrypt key material", e);
        }
    }
}
