package quokka.adapter.out.key;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.nio.charset.StandardCharsets;
import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jws.JsonWebSignature;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import quokka.core.config.KeysConfig;
import quokka.core.model.key.KeyGenerationParams;
import quokka.core.model.key.KeyStatus;
import quokka.core.model.key.KeyType;
import quokka.core.model.key.KeyUse;
import quokka.core.model.key.SigningAlgorithm;
import quokka.core.model.key.SigningKey;
import quokka.core.service.key.KeyProviderUnavailableException;

@DisplayName("VaultTransitKeyMaterialProvider")
@ExtendWith(MockitoExtension.class)
class VaultTransitKeyMaterialProviderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String TOKEN = "vault-test-token";
    private static final String TRANSIT_KEY = "quokka-kid-1";

    @Mock
    private KeysConfig config;

    @Mock
    private KeysConfig.VaultConfig vaultConfig;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private VaultTransitKeyMaterialProvider provider;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        lenient().when(config.vault()).thenReturn(vaultConfig);
        lenient().when(vaultConfig.address()).thenReturn(Optional.of(wireMockServer.baseUrl() + "/"));
        lenient().when(vaultConfig.token()).thenReturn(Optional.of(TOKEN));
        lenient().when(vaultConfig.namespace()).thenReturn(Optional.empty());
        lenient().when(vaultConfig.mount()).thenReturn("transit");
        lenient().when(vaultConfig.timeout()).thenReturn(Duration.ofSeconds(2));
        provider = new VaultTransitKeyMaterialProvider(vertx, config);
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private static String publicKeyPem() throws Exception {
        final var generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        final var encoded = Base64.getMimeEncoder().encodeToString(generator.generateKeyPair().getPublic().getEncoded());
        return "-----BEGIN PUBLIC KEY-----\n" + encoded + "\n-----END PUBLIC KEY-----\n";
    }

    private static SigningKey vaultKey(String publicJwk) {
        final var now = Instant.parse("2026-03-01T10:00:00Z");
        return new SigningKey(
                "kid-1",
                null,
                null,
                KeyType.EC,
                SigningAlgorithm.ES256,
                256,
                KeyUse.SIGNING,
                KeyStatus.ACTIVE,
                now,
                now,
                now.plus(Duration.ofDays(90)),
                SigningKey.DEFAULT_PRIORITY,
                0,
                null,
                VaultTransitKeyMaterialProvider.NAME,
                publicJwk,
                TRANSIT_KEY,
                null,
                null,
                null);
    }

    @Nested
    @DisplayName("availability")
    class AvailabilityTests {

        @Test
        @DisplayName("should outrank the local provider")
        void shouldHaveHigherPriority() {
            assertEquals("vault", provider.name());
            assertEquals(100, provider.priority());
        }

        @Test
        @DisplayName("should be available with an address and a token")
        void shouldBeAvailableWhenConfigured() {
            assertTrue(provider.isAvailable());
            assertTrue(provider.healthCheck().isPresent());
        }

        @Test
        @DisplayName("should be unavailable without a token")
        void shouldBeUnavailableWithoutToken() {
            lenient().when(vaultConfig.token()).thenReturn(Optional.empty());

            assertFalse(provider.isAvailable());
            assertTrue(provider.healthCheck().isEmpty());
        }
    }

    @Nested
    @DisplayName("generate()")
    class GenerateTests {

        @Test
        @DisplayName("should create a Transit key and publish its public half")
        void shouldGenerate() throws Exception {
            wireMockServer.stubFor(post(urlEqualTo("/v1/transit/keys/" + TRANSIT_KEY))
                    .withHeader("X-Vault-Token", equalTo(TOKEN))
                    .withRequestBody(equalToJson("{\"type\":\"ecdsa-p256\",\"exportable\":false}"))
                    .willReturn(aResponse().withStatus(204)));
            final var readBody = new JsonObject()
                    .put("data", new JsonObject()
                            .put("keys", new JsonObject().put("1", new JsonObject().put("public_key", publicKeyPem()))));
            wireMockServer.stubFor(get(urlEqualTo("/v1/transit/keys/" + TRANSIT_KEY))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody(readBody.encode())));

            final var material = provider.generate(
                            new KeyGenerationParams("kid-1", SigningAlgorithm.ES256, 256, KeyUse.SIGNING))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(TRANSIT_KEY, material.protectedMaterial());
            final var jwk = PublicJsonWebKey.Factory.newPublicJwk(material.publicJwk());
            assertEquals("kid-1", jwk.getKeyId());
            assertEquals("ES256", jwk.getAlgorithm());
            assertEquals("sig", jwk.getUse());
        }

        @Test
        @DisplayName("should refuse symmetric algorithms")
        void shouldRejectSymmetric() {
            final var params = new KeyGenerationParams("kid-1", SigningAlgorithm.HS256, 256, KeyUse.SIGNING);

            assertThrows(
                    IllegalArgumentException.class,
                    () -> provider.generate(params).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should report Vault outages as an unavailable provider")
        void shouldMapServerErrors() {
            wireMockServer.stubFor(post(urlEqualTo("/v1/transit/keys/" + TRANSIT_KEY))
                    .willReturn(aResponse().withStatus(503)));
            final var params = new KeyGenerationParams("kid-1", SigningAlgorithm.ES256, 256, KeyUse.SIGNING);

            assertThrows(
                    KeyProviderUnavailableException.class,
                    () -> provider.generate(params).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should surface rejected requests as errors")
        void shouldMapClientErrors() {
            wireMockServer.stubFor(post(urlEqualTo("/v1/transit/keys/" + TRANSIT_KEY))
                    .willReturn(aResponse().withStatus(403).withBody("{\"errors\":[\"permission denied\"]}")));
            final var params = new KeyGenerationParams("kid-1", SigningAlgorithm.ES256, 256, KeyUse.SIGNING);

            assertThrows(IllegalStateException.class, () -> provider.generate(params).await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("signer()")
    class SignerTests {

        @Test
        @DisplayName("should sign through Transit with JWS marshaling")
        void shouldSign() throws Exception {
            wireMockServer.stubFor(post(urlEqualTo("/v1/transit/sign/" + TRANSIT_KEY + "/sha2-256"))
                    .withRequestBody(matchingJsonPath("$.marshaling_algorithm", equalTo("jws")))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withBody("{\"data\":{\"signature\":\"vault:v1:c2lnbmF0dXJl\"}}")));

            final var signer = provider.signer(vaultKey(null)).await().atMost(TIMEOUT);
            final var compact = signer.sign("{\"sub\":\"user-1\"}", Map.of("typ", "at+jwt"))
                    .await()
                    .atMost(TIMEOUT);

            final var parts = compact.split("\\.");
            assertEquals(3, parts.length);
            assertEquals("c2lnbmF0dXJl", parts[2]);
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(compact);
            assertEquals("ES256", jws.getAlgorithmHeaderValue());
            assertEquals("kid-1", jws.getKeyIdHeaderValue());
            assertEquals("at+jwt", jws.getHeader("typ"));
            assertEquals("{\"sub\":\"user-1\"}", jws.getUnverifiedPayload());

            final var signingInput = parts[0] + "." + parts[1];
            final var expectedInput =
                    Base64.getEncoder().encodeToString(signingInput.getBytes(StandardCharsets.US_ASCII));
            wireMockServer.verify(postRequestedFor(urlEqualTo("/v1/transit/sign/" + TRANSIT_KEY + "/sha2-256"))
                    .withRequestBody(matchingJsonPath("$.input", equalTo(expectedInput))));
        }
    }

    @Nested
    @DisplayName("destroy()")
    class DestroyTests {

        @Test
        @DisplayName("should allow deletion before deleting the Transit key")
        void shouldDestroy() {
            wireMockServer.stubFor(post(urlEqualTo("/v1/transit/keys/" + TRANSIT_KEY + "/config"))
                    .willReturn(aResponse().withStatus(204)));
            wireMockServer.stubFor(delete(urlEqualTo("/v1/transit/keys/" + TRANSIT_KEY))
                    .willReturn(aResponse().withStatus(204)));

            provider.destroy(vaultKey(null)).await().atMost(TIMEOUT);

            wireMockServer.verify(postRequestedFor(urlEqualTo("/v1/transit/keys/" + TRANSIT_KEY + "/config"))
                    .withRequestBody(equalToJson("{\"deletion_allowed\":true}")));
            wireMockServer.verify(deleteRequestedFor(urlEqualTo("/v1/transit/keys/" + TRANSIT_KEY)));
        }
    }
}
