package quokka.core.service.dpop;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.lang.JoseException;

import quokka.core.config.DPoPConfig;
import quokka.core.model.dpop.DPoPValidationRequest;
import quokka.core.model.dpop.DPoPValidationResult;
import quokka.core.model.grant.OAuthError;
import quokka.core.port.out.DPoPNonceStore;
import quokka.core.util.SecureHash;

/**
 * Validates DPoP proofs (RFC 9449).
 *
 * <p>Checks run cheapest first; the replay check is last so that a proof
 * rejected for another reason does not burn its {@code jti}.
 */
@ApplicationScoped
public class DPoPProofValidator {

    private static final Logger LOG = Logger.getLogger(DPoPProofValidator.class);

    static final String PROOF_TYPE = "dpop+jwt";

    private static final AlgorithmConstraints ALLOWED_ALGORITHMS = new AlgorithmConstraints(
            ConstraintType.PERMIT,
            AlgorithmIdentifiers.RSA_USING_SHA256,
            AlgorithmIdentifiers.RSA_USING_SHA384,
            AlgorithmIdentifiers.RSA_USING_SHA512,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA256,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA384,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA512,
            AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256,
            AlgorithmIdentifiers.ECDSA_USING_P384_CURVE_AND_SHA384,
            AlgorithmIdentifiers.ECDSA_USING_P521_CURVE_AND_SHA512);

    private final DPoPNonceStore nonceStore;
    private final DPoPConfig config;
    private final Clock clock;

    @Inject
    public DPoPProofValidator(DPoPNonceStore nonceStore, DPoPConfig config, Clock clock) {
        this.nonceStore = nonceStore;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Whether the token endpoint requires a server nonce in every proof.
     */
    public boolean noncesEnabled() {
        return config.nonce().enabled();
    }

    /**
     * Issue a fresh server nonce for a {@code DPoP-Nonce} response header.
     */
    public Uni<String> issueNonce() {
        return nonceStore.issueNonce(config.nonce().lifetime());
    }

    /**
     * Validate a proof.
     *
     * @return Uni with the proof key thumbprint, or the error to return to the client
     */
    public Uni<DPoPValidationResult> validate(DPoPValidationRequest request) {
        final ParsedProof proof;
        try {
            proof = parse(request);
        } catch (ProofRejectedException e) {
            LOG.debugf("DPoP proof rejected: %s", e.getMessage());
            return invalid(e.getMessage());
        }

        if (request.nonceRequired()) {
            return checkNonce(proof).flatMap(nonceError -> nonceError != null
                    ? Uni.createFrom().item(nonceError)
                    : checkReplay(proof));
        }
        return checkReplay(proof);
    }

    private record ParsedProof(String thumbprint, String jti, String nonce, long issuedAt) {}

    private ParsedProof parse(DPoPValidationRequest request) {
        final var jws = new JsonWebSignature();
        final PublicJsonWebKey jwk;
        try {
            jws.setCompactSerialization(request.proof());
            jws.setAlgorithmConstraints(ALLOWED_ALGORITHMS);
            if (!PROOF_TYPE.equals(jws.getHeader("typ"))) {
                throw new ProofRejectedException("typ must be " + PROOF_TYPE);
            }
            jwk = jws.getJwkHeader();
            if (jwk == null) {
                throw new ProofRejectedException("jwk header is required");
            }
            if (jwk.getPrivateKey() != null) {
                throw new ProofRejectedException("jwk must not contain private key material");
            }
            jws.setKey(jwk.getPublicKey());
            if (!jws.verifySignature()) {
                throw new ProofRejectedException("signature does not verify");
            }
        } catch (JoseException e) {
            throw new ProofRejectedException("malformed proof: " + e.getMessage());
        }

        try {
            final var claims = JwtClaims.parse(jws.getPayload());
            final var jti = claims.getJwtId();
            if (jti == null || jti.isBlank()) {
                throw new ProofRejectedException("jti is required");
            }
            final var htm = claims.getStringClaimValue("htm");
            if (htm == null || !htm.equalsIgnoreCase(request.httpMethod())) {
                throw new ProofRejectedException("htm does not match the request method");
            }
            final var htu = claims.getStringClaimValue("htu");
            if (htu == null || !sameTarget(htu, request.httpUri())) {
                throw new ProofRejectedException("htu does not match the request URI");
            }
            final var issuedAt = checkIssuedAt(claims.getIssuedAt());

            if (request.accessToken() != null) {
                final var ath = claims.getStringClaimValue("ath");
                if (!SecureHash.sha256Base64Url(request.accessToken()).equals(ath)) {
                    throw new ProofRejectedException("ath does not match the access token");
                }
            }

            final var thumbprint = jwk.calculateBase64urlEncodedThumbprint("SHA-256");
            if (request.expectedThumbprint() != null && !request.expectedThumbprint().equals(thumbprint)) {
                throw new ProofRejectedException("proof key does not match the bound key");
            }
            return new ParsedProof(thumbprint, jti, claims.getStringClaimValue("nonce"), issuedAt);
        } catch (JoseException | InvalidJwtException | MalformedClaimException e) {
            throw new ProofRejectedException("malformed claims: " + e.getMessage());
        }
    }

    private long checkIssuedAt(NumericDate issuedAt) {
        if (issuedAt == null) {
            throw new ProofRejectedException("iat is required");
        }
        final var now = clock.instant().getEpochSecond();
        final var iat = issuedAt.getValue();
        if (iat > now + config.clockSkew().toSeconds()) {
            throw new ProofRejectedException("iat is in the future");
        }
        if (iat < now - config.proofLifetime().toSeconds() - config.clockSkew().toSeconds()) {
            throw new ProofRejectedException("proof has expired");
        }
        return iat;
    }

    private Uni<DPoPValidationResult> checkNonce(ParsedProof proof) {
        if (proof.nonce() == null) {
            return nonceRequired("nonce is required");
        }
        return nonceStore.consumeNonce(proof.nonce())
                .flatMap(valid -> valid
                        ? Uni.createFrom().<DPoPValidationResult>nullItem()
                        : nonceRequired("nonce is invalid or used"));
    }

    private Uni<DPoPValidationResult> nonceRequired(String description) {
        return issueNonce()
                .map(nonce -> new DPoPValidationResult.Invalid(OAuthError.USE_DPOP_NONCE, description, nonce));
    }

    private Uni<DPoPValidationResult> checkReplay(ParsedProof proof) {
        // The proof stays acceptable through iat + lifetime + skew, and iat may lie in the future.
        final var acceptableUntil =
                proof.issuedAt() + config.proofLifetime().toSeconds() + config.clockSkew().toSeconds();
        final var ttl = Duration.ofSeconds(Math.max(1, acceptableUntil - clock.instant().getEpochSecond() + 1));
        return nonceStore.tryMarkAsUsed(proof.thumbprint() + ":" + proof.jti(), ttl).map(first -> {
            if (!first) {
                LOG.warnf("DPoP proof replay detected for key %s", SecureHash.fingerprint(proof.thumbprint()));
                return new DPoPValidationResult.Invalid(
                        OAuthError.INVALID_DPOP_PROOF, "proof has already been used", null);
            }
            return new DPoPValidationResult.Valid(proof.thumbprint(), proof.jti());
        });
    }

    /**
     * Compare scheme, host, port and path, ignoring query and fragment.
     */
    static boolean sameTarget(String htu, String requestUri) {
        try {
            final var claimed = new URI(htu);
            final var actual = new URI(requestUri);
            return claimed.getScheme() != null
                    && claimed.getScheme().equalsIgnoreCase(actual.getScheme())
                    && claimed.getHost() != null
                    && claimed.getHost().equalsIgnoreCase(actual.getHost())
                    && effectivePort(claimed) == effectivePort(actual)
                    && Objects.equals(normalizedPath(claimed), normalizedPath(actual));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equals(uri.getScheme().toLowerCase(Locale.ROOT)) ? 443 : 80;
    }

    private static String normalizedPath(URI uri) {
        final var path = uri.getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    private static Uni<DPoPValidationResult> invalid(String description) {
        return Uni.createFrom().item(new DPoPValidationResult.Invalid(OAuthError.INVALID_DPOP_PROOF, description, null));
    }

    private static final class ProofRejectedException extends RuntimeException {

        ProofRejectedException(String message) {
            super(message, null, false, false);
        }
    }
}
