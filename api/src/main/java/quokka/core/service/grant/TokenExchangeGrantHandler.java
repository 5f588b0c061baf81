package quokka.core.service.grant;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;

import quokka.core.model.client.Client;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.Scopes;
import quokka.core.model.grant.TokenRequest;
import quokka.core.model.token.TokenTypes;
import quokka.core.port.out.ReferenceTokenStore;
import quokka.core.port.out.RefreshTokenStore;
import quokka.core.service.token.IssuedTokenVerifier;

/**
 * Handles OAuth 2.0 Token Exchange (RFC 8693).
 *
 * <p>JWT subject and actor tokens must verify against this server's keys.
 * Refresh tokens and reference access tokens are looked up in their stores
 * and never consumed. When an actor token is present the issued token
 * carries an {@code act} claim naming the actor, chained to any earlier
 * delegation.
 */
@ApplicationScoped
public class TokenExchangeGrantHandler implements GrantHandler {

    private static final Logger LOG = Logger.getLogger(TokenExchangeGrantHandler.class);

    static final Set<String> DROPPED_CLAIMS =
            Set.of("iat", "exp", "nbf", "jti", "iss", "aud", "cnf", "scope", "client_id", "act", "sub", "sid");

    private final IssuedTokenVerifier verifier;
    private final RefreshTokenStore refreshTokens;
    private final ReferenceTokenStore referenceTokens;
    private final Clock clock;

    @Inject
    public TokenExchangeGrantHandler(
            IssuedTokenVerifier verifier,
            RefreshTokenStore refreshTokens,
            ReferenceTokenStore referenceTokens,
            Clock clock) {
        this.verifier = verifier;
        this.refreshTokens = refreshTokens;
        this.referenceTokens = referenceTokens;
        this.clock = clock;
    }

    @Override
    public String grantType() {
        return GrantTypes.TOKEN_EXCHANGE;
    }

    /**
     * What a validated input token says about its subject.
     */
    record TokenSubject(String subjectId, Set<String> scopes, String sessionId, Map<String, Object> claims) {

        Optional<Object> act() {
            return Optional.ofNullable(claims.get("act"));
        }
    }

    @Override
    public Uni<GrantResult> handle(TokenRequest request, Client client) {
        final var subjectToken = request.parameter("subject_token");
        final var subjectTokenType = request.parameter("subject_token_type");
        if (subjectToken.isEmpty() || subjectTokenType.isEmpty()) {
            return failure(OAuthError.INVALID_REQUEST, "subject_token and subject_token_type are required");
        }
        if (!TokenTypes.EXCHANGEABLE.contains(subjectTokenType.get())) {
            return failure(OAuthError.INVALID_REQUEST, "Unsupported subject_token_type");
        }

        final var actorToken = request.parameter("actor_token");
        final var actorTokenType = request.parameter("actor_token_type");
        if (actorToken.isPresent() && actorTokenType.isEmpty()) {
            return failure(OAuthError.INVALID_REQUEST, "actor_token_type is required with actor_token");
        }
        if (actorTokenType.isPresent() && !TokenTypes.EXCHANGEABLE.contains(actorTokenType.get())) {
            return failure(OAuthError.INVALID_REQUEST, "Unsupported actor_token_type");
        }

        return resolve(subjectToken.get(), subjectTokenType.get(), client).flatMap(subject -> {
            if (subject.isEmpty()) {
                return failure(OAuthError.INVALID_GRANT, "Invalid subject token");
            }
            if (actorToken.isEmpty()) {
                return Uni.createFrom().item(exchange(request, client, subject.get(), null));
            }
            return resolve(actorToken.get(), actorTokenType.get(), client).map(actor -> actor
                    .map(a -> exchange(request, client, subject.get(), a))
                    .orElseGet(() -> GrantResult.failure(OAuthError.INVALID_GRANT, "Invalid actor token")));
        });
    }

    private GrantResult exchange(TokenRequest request, Client client, TokenSubject subject, TokenSubject actor) {
        final var requested = GrantScopes.requested(request);
        if (!requested.isEmpty() && !subject.scopes().isEmpty()) {
            final var subsetError = GrantScopes.checkSubset(requested, subject.scopes());
            if (subsetError.isPresent()) {
                return GrantResult.failure(OAuthError.INVALID_SCOPE, subsetError.get());
            }
        }
        final var scopes = requested.isEmpty() ? subject.scopes() : requested;
        final var allowedError = GrantScopes.checkAllowed(scopes, client);
        if (allowedError.isPresent()) {
            return GrantResult.failure(OAuthError.INVALID_SCOPE, allowedError.get());
        }

        final Map<String, Object> claims = new HashMap<>();
        subject.claims().forEach((name, value) -> {
            if (!DROPPED_CLAIMS.contains(name)) {
                claims.put(name, value);
            }
        });
        if (actor != null) {
            final Map<String, Object> act = new LinkedHashMap<>();
            act.put("sub", actor.subjectId());
            actor.act().or(subject::act).ifPresent(previous -> act.put("act", previous));
            claims.put("act", act);
            LOG.infof("Token exchange with delegation for client %s", client.clientId());
        }

        final var audiences = new ArrayList<String>();
        request.parameter("audience").ifPresent(audiences::add);
        request.parameter("resource").ifPresent(audiences::add);

        return GrantResult.success(grantType(), client.clientId())
                .subjectId(subject.subjectId())
                .scopes(scopes)
                .claims(claims)
                .sessionId(subject.sessionId())
                .audiences(audiences)
                .issuedTokenType(TokenTypes.ACCESS_TOKEN)
                .issueRefreshToken(false)
                .build();
    }

    private Uni<Optional<TokenSubject>> resolve(String token, String tokenType, Client client) {
        if (TokenTypes.REFRESH_TOKEN.equals(tokenType)) {
            return refreshTokens.find(token).map(found -> found
                    .filter(rt -> rt.clientId().equals(client.clientId()))
                    .filter(rt -> !rt.isExpired(clock.instant()))
                    .map(rt -> new TokenSubject(rt.subjectId(), rt.scopes(), rt.sessionId(), rt.claims())));
        }
        if (TokenTypes.ACCESS_TOKEN.equals(tokenType) && !looksLikeJwt(token)) {
            return referenceTokens.find(token).map(found -> found
                    .filter(ref -> ref.expiresAt().isAfter(clock.instant()))
                    .map(ref -> fromClaims(ref.claims())));
        }
        return verifier.verify(token).map(verified -> verified.map(JwtClaims::getClaimsMap).map(this::fromClaims));
    }

    private TokenSubject fromClaims(Map<String, Object> claims) {
        final var subject = claims.get("sub");
        final var scope = claims.get("scope");
        final var sid = claims.get("sid");
        return new TokenSubject(
                subject == null ? null : subject.toString(),
                Scopes.parse(scope == null ? null : scope.toString()),
                sid == null ? null : sid.toString(),
                claims);
    }

    private static boolean looksLikeJwt(String token) {
        return token.chars().filter(c -> c == '.').count() == 2;
    }

    private static Uni<GrantResult> failure(OAuthError error, String description) {
        return Uni.createFrom().item(GrantResult.failure(error, description));
    }
}
