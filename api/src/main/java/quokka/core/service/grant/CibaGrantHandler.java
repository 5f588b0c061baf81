package quokka.core.service.grant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import quokka.core.model.ciba.CibaRequest;
import quokka.core.model.client.CibaDeliveryMode;
import quokka.core.model.client.Client;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.TokenRequest;
import quokka.core.service.ciba.CibaService;

/**
 * Handles the CIBA grant (OpenID Connect CIBA Core 1.0 section 10.1).
 *
 * <p>An approved request is removed when it is redeemed, so each
 * {@code auth_req_id} yields tokens at most once. Push-mode clients receive
 * their tokens at the notification endpoint and may not poll.
 */
@ApplicationScoped
public class CibaGrantHandler implements GrantHandler {

    private final CibaService cibaService;

    @Inject
    public CibaGrantHandler(CibaService cibaService) {
        this.cibaService = cibaService;
    }

    @Override
    public String grantType() {
        return GrantTypes.CIBA;
    }

    @Override
    public Uni<GrantResult> handle(TokenRequest request, Client client) {
        final var authReqId = request.parameter("auth_req_id");
        if (authReqId.isEmpty()) {
            return failure(OAuthError.INVALID_REQUEST, "auth_req_id is required");
        }
        if (client.cibaDeliveryMode() == CibaDeliveryMode.PUSH) {
            return failure(OAuthError.UNAUTHORIZED_CLIENT, "Push mode clients cannot poll the token endpoint");
        }

        return cibaService.pollStatus(authReqId.get(), client.clientId()).flatMap(poll -> switch (poll.outcome()) {
            case PENDING -> failure(OAuthError.AUTHORIZATION_PENDING, "The user has not yet responded");
            case SLOW_DOWN -> failure(OAuthError.SLOW_DOWN, "Polling too frequently");
            case DENIED -> failure(OAuthError.ACCESS_DENIED, "The user denied the request");
            case EXPIRED, UNKNOWN -> failure(OAuthError.EXPIRED_TOKEN, "The auth_req_id has expired");
            case CLIENT_MISMATCH -> failure(OAuthError.INVALID_GRANT, "auth_req_id was issued to another client");
            case APPROVED -> redeem(poll.request(), client);
        });
    }

    private Uni<GrantResult> redeem(CibaRequest approved, Client client) {
        return cibaService.complete(approved.authReqId()).map(removed -> {
            if (!removed) {
                return GrantResult.failure(OAuthError.INVALID_GRANT, "auth_req_id has already been used");
            }
            return GrantResult.success(grantType(), client.clientId())
                    .subjectId(approved.subjectId())
                    .scopes(approved.scopes())
                    .sessionId(approved.sessionId())
                    .authTime(approved.authTime())
                    .acr(approved.acrValues())
                    .build();
        });
    }

    private static Uni<GrantResult> failure(OAuthError error, String description) {
        return Uni.createFrom().item(GrantResult.failure(error, description));
    }
}
