package quokka.core.service.dpop;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

import org.jose4j.jwk.EcJwkGenerator;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.keys.EllipticCurves;
import org.jose4j.lang.JoseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import quokka.adapter.out.storage.memory.InMemoryDPoPNonceStore;
import quokka.core.config.DPoPConfig;
import quokka.core.model.dpop.DPoPValidationRequest;
import quokka.core.model.dpop.DPoPValidationResult;
import quokka.core.model.grant.OAuthError;
import quokka.core.util.SecureHash;

@DisplayName("DPoPProofValidator")
@ExtendWith(MockitoExtension.class)
class DPoPProofValidatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String TOKEN_URI = "https://issuer.test/connect/token";

    @Mock
    private DPoPConfig config;

    @Mock
    private DPoPConfig.NonceConfig nonceConfig;

    private InMemoryDPoPNonceStore nonceStore;
    private DPoPProofValidator validator;
    private PublicJsonWebKey key;

    @BeforeEach
    void setUp() throws JoseException {
        lenient().when(config.proofLifetime()).thenReturn(Duration.ofSeconds(60));
        lenient().when(config.clockSkew()).thenReturn(Duration.ofSeconds(5));
        lenient().when(config.nonce()).thenReturn(nonceConfig);
        lenient().when(nonceConfig.lifetime()).thenReturn(Duration.ofMinutes(5));

        final var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        nonceStore = new InMemoryDPoPNonceStore(clock);
        validator = new DPoPProofValidator(nonceStore, config, clock);
        key = EcJwkGenerator.generateJwk(EllipticCurves.P256);
    }

    private String proof(String typ, String htm, String htu, Instant iat, String jti, String nonce, String ath)
            throws JoseException {
        final var claims = new JwtClaims();
        claims.setJwtId(jti);
        claims.setClaim("htm", htm);
        claims.setClaim("htu", htu);
        claims.setIssuedAt(NumericDate.fromSeconds(iat.getEpochSecond()));
        if (nonce != null) {
            claims.setClaim("nonce", nonce);
        }
        if (ath != null) {
            claims.setClaim("ath", ath);
        }
        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256);
        jws.setHeader("typ", typ);
        jws.setJwkHeader(key);
        jws.setKey(key.getPrivateKey());
        return jws.getCompactSerialization();
    }

    private String validProof() throws JoseException {
        return proof("dpop+jwt", "POST", TOKEN_URI, NOW, UUID.randomUUID().toString(), null, null);
    }

    private DPoPValidationResult validate(String proof) {
        return validator.validate(new DPoPValidationRequest(proof, "POST", TOKEN_URI, null, null, false))
                .await()
                .atMost(TIMEOUT);
    }

    private static String invalidDescription(DPoPValidationResult result) {
        final var invalid = assertInstanceOf(DPoPValidationResult.Invalid.class, result);
        assertEquals(OAuthError.INVALID_DPOP_PROOF, invalid.error());
        return invalid.description();
    }

    @Nested
    @DisplayName("valid proofs")
    class ValidProofTests {

        @Test
        @DisplayName("should return the RFC 7638 thumbprint of the proof key")
        void shouldReturnThumbprint() throws JoseException {
            final var result = validate(validProof());

            final var valid = assertInstanceOf(DPoPValidationResult.Valid.class, result);
            assertEquals(key.calculateBase64urlEncodedThumbprint("SHA-256"), valid.thumbprint());
        }

        @Test
        @DisplayName("should ignore query strings when matching htu")
        void shouldIgnoreQuery() throws JoseException {
            final var proof = proof("dpop+jwt", "post", TOKEN_URI, NOW, "jti-1", null, null);

            final var result = validator.validate(
                            new DPoPValidationRequest(proof, "POST", TOKEN_URI + "?x=1", null, null, false))
                    .await()
                    .atMost(TIMEOUT);

            assertInstanceOf(DPoPValidationResult.Valid.class, result);
        }

        @Test
        @DisplayName("should accept a proof bound to the presented access token")
        void shouldCheckAth() throws JoseException {
            final var proof = proof(
                    "dpop+jwt", "GET", TOKEN_URI, NOW, "jti-2", null, SecureHash.sha256Base64Url("access-token"));

            final var result = validator.validate(
                            new DPoPValidationRequest(proof, "GET", TOKEN_URI, "access-token", null, false))
                    .await()
                    .atMost(TIMEOUT);

            assertInstanceOf(DPoPValidationResult.Valid.class, result);
        }
    }

    @Nested
    @DisplayName("rejected proofs")
    class RejectedProofTests {

        @Test
        @DisplayName("should reject a replayed proof")
        void shouldRejectReplay() throws JoseException {
            final var proof = validProof();

            assertInstanceOf(DPoPValidationResult.Valid.class, validate(proof));
            assertEquals("proof has already been used", invalidDescription(validate(proof)));
        }

        @Test
        @DisplayName("should reject a replay for as long as a future-dated proof stays acceptable")
        void shouldRejectReplayOfFutureDatedProof() throws JoseException {
            final var clock = new AdjustableClock(NOW);
            final var movingValidator = new DPoPProofValidator(new InMemoryDPoPNonceStore(clock), config, clock);
            final var proof = proof("dpop+jwt", "POST", TOKEN_URI, NOW.plusSeconds(5), "jti-future", null, null);
            final var request = new DPoPValidationRequest(proof, "POST", TOKEN_URI, null, null, false);

            assertInstanceOf(
                    DPoPValidationResult.Valid.class,
                    movingValidator.validate(request).await().atMost(TIMEOUT));

            clock.set(NOW.plusSeconds(67));
            assertEquals(
                    "proof has already been used",
                    invalidDescription(movingValidator.validate(request).await().atMost(TIMEOUT)));

            clock.set(NOW.plusSeconds(70));
            assertEquals(
                    "proof has already been used",
                    invalidDescription(movingValidator.validate(request).await().atMost(TIMEOUT)));

            clock.set(NOW.plusSeconds(71));
            assertEquals(
                    "proof has expired",
                    invalidDescription(movingValidator.validate(request).await().atMost(TIMEOUT)));
        }

        @Test
        @DisplayName("should reject the wrong typ")
        void shouldRejectWrongType() throws JoseException {
            final var proof = proof("JWT", "POST", TOKEN_URI, NOW, "jti-1", null, null);

            assertTrue(invalidDescription(validate(proof)).startsWith("typ"));
        }

        @Test
        @DisplayName("should reject a method mismatch")
        void shouldRejectMethodMismatch() throws JoseException {
            final var proof = proof("dpop+jwt", "GET", TOKEN_URI, NOW, "jti-1", null, null);

            assertTrue(invalidDescription(validate(proof)).startsWith("htm"));
        }

        @Test
        @DisplayName("should reject a URI mismatch")
        void shouldRejectUriMismatch() throws JoseException {
            final var proof = proof("dpop+jwt", "POST", "https://other.test/connect/token", NOW, "jti-1", null, null);

            assertTrue(invalidDescription(validate(proof)).startsWith("htu"));
        }

        @Test
        @DisplayName("should reject stale proofs")
        void shouldRejectStaleProof() throws JoseException {
            final var proof = proof("dpop+jwt", "POST", TOKEN_URI, NOW.minusSeconds(120), "jti-1", null, null);

            assertEquals("proof has expired", invalidDescription(validate(proof)));
        }

        @Test
        @DisplayName("should reject proofs issued in the future")
        void shouldRejectFutureProof() throws JoseException {
            final var proof = proof("dpop+jwt", "POST", TOKEN_URI, NOW.plusSeconds(30), "jti-1", null, null);

            assertEquals("iat is in the future", invalidDescription(validate(proof)));
        }

        @Test
        @DisplayName("should reject a key other than the bound one")
        void shouldRejectUnboundKey() throws JoseException {
            final var result = validator.validate(
                            new DPoPValidationRequest(validProof(), "POST", TOKEN_URI, null, "other-thumb", false))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("proof key does not match the bound key", invalidDescription(result));
        }

        @Test
        @DisplayName("should reject garbage")
        void shouldRejectGarbage() {
            assertTrue(invalidDescription(validate("not-a-jwt")).startsWith("malformed"));
        }

        @Test
        @DisplayName("should not burn the jti of a proof rejected for another reason")
        void shouldNotBurnJtiOnFailure() throws JoseException {
            final var thumbprint = key.calculateBase64urlEncodedThumbprint("SHA-256");
            final var bad = proof("dpop+jwt", "GET", TOKEN_URI, NOW, "jti-shared", null, null);

            invalidDescription(validate(bad));

            assertTrue(nonceStore.tryMarkAsUsed(thumbprint + ":jti-shared", Duration.ofSeconds(60))
                    .await()
                    .atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("server nonces")
    class NonceTests {

        @Test
        @DisplayName("should demand a nonce and hand out a fresh one")
        void shouldDemandNonce() throws JoseException {
            final var result = validator.validate(
                            new DPoPValidationRequest(validProof(), "POST", TOKEN_URI, null, null, true))
                    .await()
                    .atMost(TIMEOUT);

            final var invalid = assertInstanceOf(DPoPValidationResult.Invalid.class, result);
            assertEquals(OAuthError.USE_DPOP_NONCE, invalid.error());
            assertNotNull(invalid.freshNonce());
        }

        @Test
        @DisplayName("should accept an issued nonce exactly once")
        void shouldAcceptIssuedNonceOnce() throws JoseException {
            final var nonce = validator.issueNonce().await().atMost(TIMEOUT);
            final var first = proof("dpop+jwt", "POST", TOKEN_URI, NOW, "jti-a", nonce, null);
            final var second = proof("dpop+jwt", "POST", TOKEN_URI, NOW, "jti-b", nonce, null);

            final var accepted = validator.validate(new DPoPValidationRequest(first, "POST", TOKEN_URI, null, null, true))
                    .await()
                    .atMost(TIMEOUT);
            final var reused = validator.validate(new DPoPValidationRequest(second, "POST", TOKEN_URI, null, null, true))
                    .await()
                    .atMost(TIMEOUT);

            assertInstanceOf(DPoPValidationResult.Valid.class, accepted);
            final var invalid = assertInstanceOf(DPoPValidationResult.Invalid.class, reused);
            assertEquals(OAuthError.USE_DPOP_NONCE, invalid.error());
            assertFalse(nonce.equals(invalid.freshNonce()));
        }
    }

    @Test
    @DisplayName("sameTarget() should compare default ports")
    void shouldCompareDefaultPorts() {
        assertTrue(DPoPProofValidator.sameTarget("https://issuer.test:443/token", "https://issuer.test/token"));
        assertFalse(DPoPProofValidator.sameTarget("https://issuer.test:8443/token", "https://issuer.test/token"));
    }

    private static final class AdjustableClock extends Clock {

        private volatile Instant instant;

        AdjustableClock(Instant instant) {
            this.instant = instant;
        }

        void set(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
