package quokka.adapter.out.key;

import java.security.Key;
import java.security.spec.ECParameterSpec;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;
import org.jose4j.jwk.EcJwkGenerator;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKey.OutputControlLevel;
import org.jose4j.jwk.OctJwkGenerator;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jwk.RsaJwkGenerator;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.keys.EllipticCurves;
import org.jose4j.lang.JoseException;

import quokka.core.cache.CaffeineLocalCache;
import quokka.core.cache.LocalCache;
import quokka.core.model.key.GeneratedKeyMaterial;
import quokka.core.model.key.KeyGenerationParams;
import quokka.core.model.key.SigningAlgorithm;
import quokka.core.model.key.SigningKey;
import quokka.spi.JwsSigner;
import quokka.spi.KeyMaterialProvider;

/**
 * Key-material provider that generates keys in-process.
 *
 * <p>The private half is serialized as a JWK and kept AES-256-GCM encrypted
 * in the key record's protected material. Decrypted keys are cached briefly
 * so signing does not decrypt on every token.
 */
@ApplicationScoped
public class LocalKeyMaterialProvider implements KeyMaterialProvider {

    private static final Logger LOG = Logger.getLogger(LocalKeyMaterialProvider.class);
    static final String NAME = "local";
    private static final int PRIORITY = 0;

    private final KeyMaterialEncryption encryption;
    private final LocalCache<String, JsonWebKey> decryptedKeys =
            new CaffeineLocalCache<>(Duration.ofMinutes(10), 1_000);

    @Inject
    public LocalKeyMaterialProvider(KeyMaterialEncryption encryption) {
        this.encryption = encryption;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("key-provider-local")
                .up()
                .withData("provider", NAME)
                .build());
    }

    @Override
    public Uni<GeneratedKeyMaterial> generate(KeyGenerationParams params) {
        return Uni.createFrom()
                .item(() -> generateJwk(params))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .map(jwk -> {
                    jwk.setKeyId(params.keyId());
                    jwk.setUse(params.use().jwkValue());
                    jwk.setAlgorithm(params.algorithm().name());

                    final var publicJwk = jwk instanceof PublicJsonWebKey
                            ? jwk.toJson(OutputControlLevel.PUBLIC_ONLY)
                            : null;
                    final var protectedMaterial = encryption.encrypt(jwk.toJson(OutputControlLevel.INCLUDE_PRIVATE));
                    decryptedKeys.put(params.keyId(), jwk);

                    LOG.debugf("Generated local %s key %s", params.algorithm(), params.keyId());
                    return new GeneratedKeyMaterial(params.keyId(), publicJwk, protectedMaterial);
                });
    }

    private static JsonWebKey generateJwk(KeyGenerationParams params) {
        try {
            return switch (params.keyType()) {
                case RSA -> RsaJwkGenerator.generateJwk(params.keySize());
                case EC -> EcJwkGenerator.generateJwk(curveFor(params.algorithm()));
                case SYMMETRIC -> OctJwkGenerator.generateJwk(params.keySize());
            };
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to generate " + params.algorithm() + " key", e);
        }
    }

    private static ECParameterSpec curveFor(SigningAlgorithm algorithm) {
        return switch (algorithm) {
            case ES256 -> EllipticCurves.P256;
            case ES384 -> EllipticCurves.P384;
            case ES512 -> EllipticCurves.P521;
            default -> throw new IllegalArgumentException("Not an EC algorithm: " + algorithm);
        };
    }

    @Override
    public Uni<JwsSigner> signer(SigningKey key) {
        return Uni.createFrom().item(() -> new LocalJwsSigner(key.keyId(), key.algorithm(), signingKeyFor(key)));
    }

    private Key signingKeyFor(SigningKey key) {
        final var jwk = decryptedKeys.get(key.keyId(), id -> {
            try {
                return JsonWebKey.Factory.newJwk(encryption.decrypt(key.protectedMaterial()));
            } catch (JoseException e) {
                throw new IllegalStateException("Stored key material is unreadable for key " + id, e);
            }
        });
        return jwk instanceof PublicJsonWebKey publicJwk ? publicJwk.getPrivateKey() : jwk.getKey();
    }

    @Override
    public Optional<PublicJsonWebKey> publicKey(SigningKey key) {
        return key.publicJwkJson().map(json -> {
            try {
                return PublicJsonWebKey.Factory.newPublicJwk(json);
            } catch (JoseException e) {
                throw new IllegalStateException("Stored public JWK is unreadable for key " + key.keyId(), e);
            }
        });
    }

    @Override
    public Uni<Void> destroy(SigningKey key) {
        decryptedKeys.invalidate(key.keyId());
        return Uni.createFrom().voidItem();
    }

    private record LocalJwsSigner(String keyId, SigningAlgorithm signingAlgorithm, Key key) implements JwsSigner {

        @Override
        public String algorithm() {
            return signingAlgorithm.name();
        }

        @Override
        public Uni<String> sign(String payloadJson, Map<String, Object> headers) {
            return Uni.createFrom().item(() -> {
                final var jws = new JsonWebSignature();
                headers.forEach((name, value) -> jws.getHeaders().setObjectHeaderValue(name, value));
                jws.setAlgorithmHeaderValue(signingAlgorithm.name());
                jws.setKeyIdHeaderValue(keyId);
                jws.setPayload(payloadJson);
                jws.setKey(key);
                try {
                    return jws.getCompactSerialization();
                } catch (JoseException e) {
                    throw new IllegalStateException("Failed to sign with key " + keyId, e);
                }
            });
        }
    }
}
