package quokka.adapter.out.key;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;
import org.jose4j.base64url.Base64Url;
import org.jose4j.jwk.JsonWebKey.OutputControlLevel;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jwx.Headers;
import org.jose4j.lang.JoseException;

import quokka.core.config.KeysConfig;
import quokka.core.model.key.GeneratedKeyMaterial;
import quokka.core.model.key.KeyGenerationParams;
import quokka.core.model.key.KeyType;
import quokka.core.model.key.SigningAlgorithm;
import quokka.core.model.key.SigningKey;
import quokka.core.service.key.KeyProviderUnavailableException;
import quokka.spi.JwsSigner;
import quokka.spi.KeyMaterialProvider;

/**
 * Key-material provider backed by the HashiCorp Vault Transit engine.
 *
 * <p>Keys are created and used inside Vault; only the public half ever
 * reaches this process. The protected material stored on the key record is
 * the Transit key name.
 *
 * <h2>Calls</h2>
 * <pre>{@code
 * POST   /v1/{mount}/keys/{name}          create key
 * GET    /v1/{mount}/keys/{name}          read public key
 * POST   /v1/{mount}/sign/{name}/{hash}   sign (JWS marshaling)
 * POST   /v1/{mount}/keys/{name}/config   allow deletion
 * DELETE /v1/{mount}/keys/{name}          delete key
 * }</pre>
 *
 * <p>Signatures are requested with {@code marshaling_algorithm=jws}, so ECDSA
 * signatures already come back in the JWS R||S form.
 */
@ApplicationScoped
public class VaultTransitKeyMaterialProvider implements KeyMaterialProvider {

    private static final Logger LOG = Logger.getLogger(VaultTransitKeyMaterialProvider.class);
    static final String NAME = "vault";
    private static final int PRIORITY = 100;
    private static final String KEY_NAME_PREFIX = "quokka-";
    private static final String SIGNATURE_PREFIX = "vault:v";

    private final WebClient webClient;
    private final KeysConfig.VaultConfig config;

    @Inject
    public VaultTransitKeyMaterialProvider(Vertx vertx, KeysConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config.vault();
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
        return config.address().filter(a -> !a.isBlank()).isPresent()
                && config.token().filter(t -> !t.isBlank()).isPresent();
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        if (!isAvailable()) {
            return Optional.empty();
        }
        return Optional.of(HealthCheckResponse.named("key-provider-vault")
                .up()
                .withData("provider", NAME)
                .withData("address", config.address().orElse(""))
                .withData("mount", config.mount())
                .build());
    }

    @Override
    public Uni<GeneratedKeyMaterial> generate(KeyGenerationParams params) {
        if (params.keyType() == KeyType.SYMMETRIC) {
            return Uni.createFrom()
                    .failure(new IllegalArgumentException("Vault Transit signing supports asymmetric algorithms only"));
        }

        final var transitKey = KEY_NAME_PREFIX + params.keyId();
        final var body = new JsonObject().put("type", transitKeyType(params)).put("exportable", false);

        return send(request("POST", "/keys/" + transitKey), body)
                .flatMap(ignored -> readPublicKey(transitKey))
                .map(publicKey -> {
                    final var jwk = toJwk(publicKey);
                    jwk.setKeyId(params.keyId());
                    jwk.setUse(params.use().jwkValue());
                    jwk.setAlgorithm(params.algorithm().name());
                    LOG.infof("Created Vault Transit key %s", transitKey);
                    return new GeneratedKeyMaterial(
                            params.keyId(), jwk.toJson(OutputControlLevel.PUBLIC_ONLY), transitKey);
                });
    }

    private static String transitKeyType(KeyGenerationParams params) {
        return switch (params.algorithm()) {
            case RS256, RS384, RS512, PS256, PS384, PS512 -> "rsa-" + params.keySize();
            case ES256 -> "ecdsa-p256";
            case ES384 -> "ecdsa-p384";
            case ES512 -> "ecdsa-p521";
            default -> throw new IllegalArgumentException("Unsupported algorithm: " + params.algorithm());
        };
    }

    private Uni<PublicKey> readPublicKey(String transitKey) {
        return send(request("GET", "/keys/" + transitKey), null).map(json -> {
            final var versions = json.getJsonObject("data").getJsonObject("keys");
            final var latest = versions.getJsonObject(String.valueOf(versions.size()));
            return parsePem(latest.getString("public_key"));
        });
    }

    private static PublicKey parsePem(String pem) {
        final var base64 = pem.replaceAll("-----(BEGIN|END) PUBLIC KEY-----", "").replaceAll("\\s", "");
        final var spec = new X509EncodedKeySpec(Base64.getDecoder().decode(base64));
        for (final var family : new String[] {"RSA", "EC"}) {
            try {
                return KeyFactory.getInstance(family).generatePublic(spec);
            } catch (GeneralSecurityException e) {
                LOG.tracef("Public key is not %s: %s", family, e.getMessage());
            }
        }
        throw new IllegalStateException("Unsupported public key returned by Vault");
    }

    private static PublicJsonWebKey toJwk(PublicKey publicKey) {
        try {
            return PublicJsonWebKey.Factory.newPublicJwk(publicKey);
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to convert Vault public key to JWK", e);
        }
    }

    @Override
    public Uni<JwsSigner> signer(SigningKey key) {
        return Uni.createFrom().item(new VaultJwsSigner(key.keyId(), key.algorithm(), key.protectedMaterial()));
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
        final var transitKey = key.protectedMaterial();
        return send(request("POST", "/keys/" + transitKey + "/config"), new JsonObject().put("deletion_allowed", true))
                .flatMap(ignored -> send(request("DELETE", "/keys/" + transitKey), null))
                .invoke(() -> LOG.infof("Deleted Vault Transit key %s", transitKey))
                .replaceWithVoid();
    }

    private HttpRequest<Buffer> request(String method, String path) {
        final var address = config.address()
                .orElseThrow(() -> new KeyProviderUnavailableException(NAME, "Vault address not configured"));
        final var url = stripTrailingSlash(address) + "/v1/" + config.mount() + path;
        final var request =
                switch (method) {
                    case "GET" -> webClient.getAbs(url);
                    case "DELETE" -> webClient.deleteAbs(url);
                    default -> webClient.postAbs(url);
                };
        request.timeout(config.timeout().toMillis())
                .putHeader("X-Vault-Token", config.token().orElse(""))
                .putHeader("Accept", "application/json");
        config.namespace().ifPresent(ns -> request.putHeader("X-Vault-Namespace", ns));
        return request;
    }

    private Uni<JsonObject> send(HttpRequest<Buffer> request, JsonObject body) {
        final Uni<HttpResponse<Buffer>> response = body == null ? request.send() : request.sendJsonObject(body);
        return response.onFailure()
                .transform(e -> new KeyProviderUnavailableException(NAME, "Vault request failed: " + e.getMessage(), e))
                .map(VaultTransitKeyMaterialProvider::requireSuccess);
    }

    private static JsonObject requireSuccess(HttpResponse<Buffer> response) {
        final var status = response.statusCode();
        if (status >= 500) {
            throw new KeyProviderUnavailableException(NAME, "Vault returned status " + status);
        }
        if (status >= 400) {
            throw new IllegalStateException("Vault rejected request with status " + status + ": " + response.bodyAsString());
        }
        return status == 204 || response.body() == null ? new JsonObject() : response.bodyAsJsonObject();
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static String hashAlgorithm(SigningAlgorithm algorithm) {
        return switch (algorithm.digestAlgorithm()) {
            case "SHA-384" -> "sha2-384";
            case "SHA-512" -> "sha2-512";
            default -> "sha2-256";
        };
    }

    private final class VaultJwsSigner implements JwsSigner {

        private final String keyId;
        private final SigningAlgorithm signingAlgorithm;
        private final String transitKey;

        VaultJwsSigner(String keyId, SigningAlgorithm signingAlgorithm, String transitKey) {
            this.keyId = keyId;
            this.signingAlgorithm = signingAlgorithm;
            this.transitKey = transitKey;
        }

        @Override
        public String keyId() {
            return keyId;
        }

        @Override
        public String algorithm() {
            return signingAlgorithm.name();
        }

        @Override
        public Uni<String> sign(String payloadJson, Map<String, Object> headers) {
            final var jwsHeaders = new Headers();
            headers.forEach(jwsHeaders::setObjectHeaderValue);
            jwsHeaders.setStringHeaderValue("alg", signingAlgorithm.name());
            jwsHeaders.setStringHeaderValue("kid", keyId);
            final var signingInput =
                    jwsHeaders.getEncodedHeader() + "." + Base64Url.encodeUtf8ByteRepresentation(payloadJson);

            final var body = new JsonObject()
                    .put("input", Base64.getEncoder().encodeToString(signingInput.getBytes(StandardCharsets.US_ASCII)))
                    .put("marshaling_algorithm", "jws");
            if (signingAlgorithm.keyType() == KeyType.RSA) {
                body.put("signature_algorithm", signingAlgorithm.name().startsWith("PS") ? "pss" : "pkcs1v15");
            }

            return send(request("POST", "/sign/" + transitKey + "/" + hashAlgorithm(signingAlgorithm)), body)
                    .map(json -> signingInput + "." + stripVersion(json.getJsonObject("data").getString("signature")));
        }

        private String stripVersion(String signature) {
            if (!signature.startsWith(SIGNATURE_PREFIX)) {
                throw new IllegalStateException("Unexpected Vault signature format");
            }
            return signature.substring(signature.indexOf(':', SIGNATURE_PREFIX.length()) + 1);
        }
    }
}
