package quokka.core.service.token;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwt.consumer.JwtContext;

import quokka.core.config.TokenConfig;
import quokka.core.service.key.SigningKeyService;

/**
 * Verifies JWTs this server issued: signature through the published
 * verification keys, issuer and, optionally, expiry and audience.
 *
 * <p>Used for token exchange subject and actor tokens and for CIBA
 * {@code id_token_hint} / {@code login_hint_token} values.
 */
@ApplicationScoped
public class IssuedTokenVerifier {

    private static final Logger LOG = Logger.getLogger(IssuedTokenVerifier.class);
    private static final int ALLOWED_CLOCK_SKEW_SECONDS = 30;

    private final SigningKeyService signingKeys;
    private final TokenConfig config;
    private final Clock clock;

    @Inject
    public IssuedTokenVerifier(SigningKeyService signingKeys, TokenConfig config, Clock clock) {
        this.signingKeys = signingKeys;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Verify a token including its expiry.
     *
     * @return Uni with the claims, or empty when the token does not verify
     */
    public Uni<Optional<JwtClaims>> verify(String token) {
        return verify(token, true, null);
    }

    /**
     * Verify a token.
     *
     * @param requireUnexpired whether an expired token is rejected
     * @param audience         required audience, or null to skip the check
     * @return Uni with the claims, or empty when the token does not verify
     */
    public Uni<Optional<JwtClaims>> verify(String token, boolean requireUnexpired, String audience) {
        final JwtContext unverified;
        try {
            unverified = new JwtConsumerBuilder()
                    .setSkipAllValidators()
                    .setDisableRequireSignature()
                    .setSkipSignatureVerification()
                    .build()
                    .process(token);
        } catch (InvalidJwtException e) {
            LOG.debugf("Token is not a parseable JWT: %s", e.getMessage());
            return Uni.createFrom().item(Optional.empty());
        }

        final var keyId = unverified.getJoseObjects().get(0).getKeyIdHeaderValue();
        return signingKeys.verificationKey(keyId).map(key -> key.flatMap(jwk -> {
            final var builder = new JwtConsumerBuilder()
                    .setVerificationKey(jwk.getPublicKey())
                    .setEvaluationTime(NumericDate.fromSeconds(clock.instant().getEpochSecond()))
                    .setAllowedClockSkewInSeconds(ALLOWED_CLOCK_SKEW_SECONDS)
                    .setSkipDefaultAudienceValidation();
            if (requireUnexpired) {
                builder.setRequireExpirationTime().setExpectedIssuer(config.issuer());
            } else {
                // Claim validators all check time as well, so issuer is checked below.
                builder.setSkipAllValidators();
            }
            try {
                final var claims = builder.build().processToClaims(token);
                if (!config.issuer().equals(claims.getIssuer())) {
                    LOG.debugf("Token %s has foreign issuer", keyId);
                    return Optional.empty();
                }
                if (audience != null && !claims.getAudience().contains(audience)) {
                    LOG.debugf("Token %s is not addressed to %s", keyId, audience);
                    return Optional.empty();
                }
                return Optional.of(claims);
            } catch (InvalidJwtException | MalformedClaimException e) {
                LOG.debugf("Token %s failed verification: %s", keyId, e.getMessage());
                return Optional.empty();
            }
        }));
    }
}
