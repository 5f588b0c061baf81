package quokka.core.service.grant;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.client.Client;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.TokenRequest;
import quokka.core.model.token.AuthorizationCode;
import quokka.core.port.out.AuthorizationCodeStore;
import quokka.core.port.out.RefreshTokenStore;
import quokka.core.util.SecureHash;

/**
 * Handles {@code grant_type=authorization_code}.
 *
 * <p>The code is consumed before any other check, so a code can be redeemed
 * at most once even under concurrent requests. Presenting a code that was
 * already redeemed is treated as a leak: the refresh tokens of that code's
 * session are revoked.
 */
@ApplicationScoped
public class AuthorizationCodeGrantHandler implements GrantHandler {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeGrantHandler.class);

    private final AuthorizationCodeStore codes;
    private final RefreshTokenStore refreshTokens;
    private final Clock clock;

    @Inject
    public AuthorizationCodeGrantHandler(AuthorizationCodeStore codes, RefreshTokenStore refreshTokens, Clock clock) {
        this.codes = codes;
        this.refreshTokens = refreshTokens;
        this.clock = clock;
    }

    @Override
    public String grantType() {
        return GrantTypes.AUTHORIZATION_CODE;
    }

    @Override
    public Uni<GrantResult> handle(TokenRequest request, Client client) {
        final var codeValue = request.parameter("code");
        if (codeValue.isEmpty()) {
            return Uni.createFrom().item(GrantResult.failure(OAuthError.INVALID_REQUEST, "code is required"));
        }

        return codes.consume(codeValue.get()).flatMap(consumed -> {
            if (consumed.isEmpty()) {
                return handleMissingCode(codeValue.get());
            }
            return Uni.createFrom().item(validate(consumed.get(), request, client));
        });
    }

    private Uni<GrantResult> handleMissingCode(String code) {
        return codes.findConsumed(code).flatMap(previous -> {
            if (previous.isEmpty()) {
                return Uni.createFrom().item(GrantResult.failure(OAuthError.INVALID_GRANT, "Invalid authorization code"));
            }
            final var sessionId = previous.get().sessionId();
            LOG.warnf(
                    "Authorization code %s presented again for client %s; revoking session tokens",
                    SecureHash.fingerprint(code), previous.get().clientId());
            final Uni<Integer> revoked = sessionId == null
                    ? Uni.createFrom().item(0)
                    : refreshTokens.revokeSession(sessionId);
            return revoked.map(count -> {
                LOG.debugf("Revoked %d refresh tokens after code replay", count);
                return GrantResult.failure(OAuthError.INVALID_GRANT, "Authorization code has already been used");
            });
        });
    }

    private GrantResult validate(AuthorizationCode code, TokenRequest request, Client client) {
        if (!code.clientId().equals(client.clientId())) {
            LOG.warnf("Client %s presented a code issued to another client", client.clientId());
            return GrantResult.failure(OAuthError.INVALID_GRANT, "Authorization code was issued to another client");
        }
        if (code.isExpired(clock.instant())) {
            return GrantResult.failure(OAuthError.INVALID_GRANT, "Authorization code has expired");
        }
        if (code.redirectUri() != null
                && !code.redirectUri().equals(request.parameter("redirect_uri").orElse(null))) {
            return GrantResult.failure(OAuthError.INVALID_GRANT, "redirect_uri does not match");
        }

        final var pkceError = PkceValidator.validate(code, request.parameter("code_verifier").orElse(null), client);
        if (pkceError.isPresent()) {
            return GrantResult.failure(OAuthError.INVALID_GRANT, pkceError.get());
        }

        return GrantResult.success(grantType(), client.clientId())
                .subjectId(code.subjectId())
                .scopes(code.scopes())
                .sessionId(code.sessionId())
                .authTime(code.authTime())
                .amr(code.amr())
                .acr(code.acr())
                .nonce(code.nonce())
                .authorizationCode(code.code())
                .build();
    }
}
