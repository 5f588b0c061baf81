package quokka.core.service.token;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;

import quokka.core.config.TokenConfig;
import quokka.core.model.client.AccessTokenType;
import quokka.core.model.client.Client;
import quokka.core.model.client.RefreshTokenExpiration;
import quokka.core.model.client.RefreshTokenUsage;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.Scopes;
import quokka.core.model.token.IssuedTokens;
import quokka.core.model.token.ReferenceToken;
import quokka.core.model.token.RefreshToken;
import quokka.core.model.token.TokenCreationRequest;
import quokka.core.model.token.TokenIssueContext;
import quokka.core.model.token.TokenResponse;
import quokka.core.model.token.TokenTypes;
import quokka.core.service.key.SigningCredentials;
import quokka.core.service.key.SigningKeyService;
import quokka.core.util.RandomValues;
import quokka.core.util.SecureHash;

/**
 * Builds access, ID and refresh tokens from a successful grant.
 *
 * <p>This service only signs. Persisting refresh tokens and reference tokens
 * is the caller's job, driven by the returned {@link IssuedTokens}.
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    static final String ACCESS_TOKEN_TYPE_HEADER = "at+jwt";
    static final String ID_TOKEN_TYPE_HEADER = "JWT";

    private final SigningKeyService signingKeys;
    private final TokenConfig config;
    private final Clock clock;

    @Inject
    public TokenService(SigningKeyService signingKeys, TokenConfig config, Clock clock) {
        this.signingKeys = signingKeys;
        this.config = config;
        this.clock = clock;
    }

    /**
     * An access token and, in reference mode, the claims to persist under its handle.
     */
    public record AccessToken(String value, ReferenceToken reference) {}

    /**
     * Create the full token response for a successful grant.
     *
     * @param result  successful grant outcome
     * @param context client, tenant and DPoP binding of the request
     * @return Uni with the response plus the records the caller must persist
     */
    public Uni<IssuedTokens> createTokenResponse(GrantResult result, TokenIssueContext context) {
        if (!result.success()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Cannot issue tokens for a failed grant"));
        }

        final var client = context.client();
        final var request = toCreationRequest(result, context);

        return signingKeys.getSigningCredentials(context.tenantId(), client.clientId()).flatMap(credentials -> {
            final var refreshToken = createRefreshToken(result, client, context, result.presentedRefreshToken());
            return createAccessToken(request, credentials).flatMap(accessToken -> {
                final Uni<String> idToken = shouldIssueIdToken(result)
                        ? createIdToken(request, accessToken.value(), result.authorizationCode(), credentials)
                        : Uni.createFrom().nullItem();
                return idToken.map(idTokenValue -> {
                    final var response = new TokenResponse(
                            accessToken.value(),
                            request.dpopKeyThumbprint() != null ? TokenTypes.DPOP : TokenTypes.BEARER,
                            request.accessTokenLifetime(),
                            refreshToken.handle(),
                            idTokenValue,
                            Scopes.join(result.scopes()),
                            result.issuedTokenType());
                    LOG.debugf(
                            "Issued tokens: grant=%s, client=%s, kid=%s, refresh=%s, id_token=%s",
                            result.grantType(),
                            client.clientId(),
                            credentials.keyId(),
                            refreshToken.handle() != null,
                            idTokenValue != null);
                    return new IssuedTokens(response, refreshToken.toStore(), accessToken.reference());
                });
            });
        });
    }

    /**
     * Create an access token, resolving signing credentials for the client.
     */
    public Uni<AccessToken> createAccessToken(TokenCreationRequest request) {
        return signingKeys
                .getSigningCredentials(request.tenantId(), request.client().clientId())
                .flatMap(credentials -> createAccessToken(request, credentials));
    }

    private Uni<AccessToken> createAccessToken(TokenCreationRequest request, SigningCredentials credentials) {
        final var client = request.client();
        final var now = clock.instant();
        final var claims = new JwtClaims();
        request.claims().forEach(claims::setClaim);

        claims.setIssuer(config.issuer());
        if (request.audiences().isEmpty()) {
            claims.setAudience(client.clientId());
        } else {
            claims.setAudience(request.audiences());
        }
        claims.setClaim("client_id", client.clientId());
        claims.setIssuedAt(numericDate(now));
        claims.setNotBefore(numericDate(now));
        claims.setExpirationTime(numericDate(now.plusSeconds(request.accessTokenLifetime())));
        claims.setJwtId(RandomValues.base64Url(16));
        if (request.hasSubject()) {
            claims.setSubject(subjectFor(request));
        }
        if (!request.scopes().isEmpty()) {
            claims.setClaim("scope", Scopes.join(request.scopes()));
        }
        if (request.sessionId() != null) {
            claims.setClaim("sid", request.sessionId());
        }
        if (request.authTime() != null) {
            claims.setClaim("auth_time", request.authTime().getEpochSecond());
        }
        if (request.tenantId() != null) {
            claims.setClaim("tenant_id", request.tenantId());
        }
        if (request.dpopKeyThumbprint() != null) {
            claims.setClaim("cnf", Map.of("jkt", request.dpopKeyThumbprint()));
        }

        if (request.reference()) {
            final var handle = RandomValues.handle();
            final var expiresAt = now.plusSeconds(request.accessTokenLifetime());
            return Uni.createFrom()
                    .item(new AccessToken(
                            handle, new ReferenceToken(handle, client.clientId(), claims.getClaimsMap(), expiresAt)));
        }

        return credentials
                .sign(claims.toJson(), Map.of("typ", ACCESS_TOKEN_TYPE_HEADER))
                .map(jws -> new AccessToken(jws, null));
    }

    /**
     * Create an ID token, resolving signing credentials for the client.
     *
     * @param accessToken access token issued alongside, or null
     * @param code        authorization code redeemed, or null
     */
    public Uni<String> createIdToken(TokenCreationRequest request, String accessToken, String code) {
        return signingKeys
                .getSigningCredentials(request.tenantId(), request.client().clientId())
                .flatMap(credentials -> createIdToken(request, accessToken, code, credentials));
    }

    private Uni<String> createIdToken(
            TokenCreationRequest request, String accessToken, String code, SigningCredentials credentials) {
        if (!request.hasSubject()) {
            return Uni.createFrom().failure(new IllegalArgumentException("An ID token requires a subject"));
        }

        final var now = clock.instant();
        final var claims = new JwtClaims();
        claims.setIssuer(config.issuer());
        claims.setSubject(subjectFor(request));
        claims.setAudience(request.client().clientId());
        claims.setIssuedAt(numericDate(now));
        claims.setExpirationTime(numericDate(now.plusSeconds(request.identityLifetime())));
        claims.setClaim("auth_time", (request.authTime() != null ? request.authTime() : now).getEpochSecond());
        if (request.nonce() != null) {
            claims.setClaim("nonce", request.nonce());
        }
        if (request.sessionId() != null) {
            claims.setClaim("sid", request.sessionId());
        }
        if (!request.amr().isEmpty()) {
            claims.setStringListClaim("amr", request.amr());
        }
        if (request.acr() != null) {
            claims.setClaim("acr", request.acr());
        }
        if (accessToken != null) {
            claims.setClaim("at_hash", SecureHash.leftHalfHash(accessToken, credentials.digestAlgorithm()));
        }
        if (code != null) {
            claims.setClaim("c_hash", SecureHash.leftHalfHash(code, credentials.digestAlgorithm()));
        }

        return credentials.sign(claims.toJson(), Map.of("typ", ID_TOKEN_TYPE_HEADER));
    }

    /**
     * The refresh token a grant yields.
     *
     * @param handle  value returned to the client, or null when none is issued
     * @param toStore record to persist, or null when nothing changed
     */
    public record RefreshTokenOutcome(String handle, RefreshToken toStore) {

        static RefreshTokenOutcome none() {
            return new RefreshTokenOutcome(null, null);
        }
    }

    /**
     * Decide and build the refresh token for a grant.
     *
     * <p>Outside the refresh grant a token is issued when {@code offline_access}
     * was granted to a client that allows it and a subject exists. On the
     * refresh grant a new handle is minted only when the handler asks for
     * rotation; otherwise the presented handle is returned unchanged.
     *
     * @param previous refresh token presented on a refresh grant, or null
     */
    public RefreshTokenOutcome createRefreshToken(
            GrantResult result, Client client, TokenIssueContext context, RefreshToken previous) {
        final var now = clock.instant();

        if (previous != null) {
            if (!result.issueRefreshToken()) {
                return new RefreshTokenOutcome(previous.handle(), null);
            }
            final var expiresAt = slidingExpiry(client, now, previous.absoluteExpiresAt());
            final var handle =
                    client.refreshTokenUsage() == RefreshTokenUsage.REUSE ? previous.handle() : RandomValues.handle();
            final var renewed = new RefreshToken(
                    handle,
                    previous.clientId(),
                    previous.subjectId(),
                    previous.scopes(),
                    previous.sessionId(),
                    previous.claims(),
                    previous.authTime(),
                    previous.amr(),
                    previous.acr(),
                    previous.tenantId(),
                    previous.dpopKeyThumbprint(),
                    now,
                    previous.absoluteExpiresAt(),
                    expiresAt);
            return new RefreshTokenOutcome(handle, renewed);
        }

        if (!result.issueRefreshToken()
                || !result.hasScope(Scopes.OFFLINE_ACCESS)
                || !client.allowOfflineAccess()
                || result.subjectId() == null) {
            return RefreshTokenOutcome.none();
        }

        final var absoluteExpiresAt =
                now.plusSeconds(positive(client.refreshTokenLifetime(), "refreshTokenLifetime"));
        final var token = new RefreshToken(
                RandomValues.handle(),
                client.clientId(),
                result.subjectId(),
                result.scopes(),
                result.sessionId(),
                result.claims(),
                result.authTime(),
                result.amr(),
                result.acr(),
                context.tenantId(),
                thumbprintFor(result, context),
                now,
                absoluteExpiresAt,
                slidingExpiry(client, now, absoluteExpiresAt));
        return new RefreshTokenOutcome(token.handle(), token);
    }

    private static Instant slidingExpiry(Client client, Instant now, Instant absoluteExpiresAt) {
        if (client.refreshTokenExpiration() != RefreshTokenExpiration.SLIDING) {
            return absoluteExpiresAt;
        }
        final var sliding =
                now.plusSeconds(positive(client.slidingRefreshTokenLifetime(), "slidingRefreshTokenLifetime"));
        return sliding.isBefore(absoluteExpiresAt) ? sliding : absoluteExpiresAt;
    }

    private static boolean shouldIssueIdToken(GrantResult result) {
        return result.hasScope(Scopes.OPENID)
                && result.subjectId() != null
                && !GrantTypes.CLIENT_CREDENTIALS.equals(result.grantType())
                && !GrantTypes.TOKEN_EXCHANGE.equals(result.grantType());
    }

    private TokenCreationRequest toCreationRequest(GrantResult result, TokenIssueContext context) {
        final var client = context.client();
        final Map<String, Object> claims = new HashMap<>(result.claims());
        return new TokenCreationRequest(
                result.subjectId(),
                client,
                result.scopes(),
                claims,
                client.accessTokenLifetime(),
                client.identityTokenLifetime(),
                result.sessionId(),
                result.nonce(),
                thumbprintFor(result, context),
                client.pairwiseSalt().orElse(null),
                client.accessTokenType() == AccessTokenType.REFERENCE,
                context.tenantId(),
                result.audiences(),
                result.authTime(),
                result.amr(),
                result.acr());
    }

    private static String thumbprintFor(GrantResult result, TokenIssueContext context) {
        return result.dpopKeyThumbprint() != null ? result.dpopKeyThumbprint() : context.dpopKeyThumbprint();
    }

    private static String subjectFor(TokenCreationRequest request) {
        if (request.pairwiseSubjectSalt() == null) {
            return request.subjectId();
        }
        return SecureHash.hmacSha256Base64Url(
                request.pairwiseSubjectSalt(), request.client().clientId() + request.subjectId());
    }

    private static NumericDate numericDate(Instant instant) {
        return NumericDate.fromSeconds(instant.getEpochSecond());
    }

    private static int positive(int seconds, String name) {
        if (seconds <= 0) {
            throw new IllegalArgumentException(name + " must be positive seconds");
        }
        return seconds;
    }
}
