package quokka.core.service.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.config.TokenConfig;
import quokka.core.model.client.Client;
import quokka.core.model.client.ClientCredentials;
import quokka.core.model.dpop.DPoPValidationRequest;
import quokka.core.model.dpop.DPoPValidationResult;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.TokenRequest;
import quokka.core.model.token.TokenEndpointResult;
import quokka.core.model.token.TokenIssueContext;
import quokka.core.port.in.TokenIssuance;
import quokka.core.port.out.TokenMetrics;
import quokka.core.service.client.ClientAuthenticator;
import quokka.core.service.dpop.DPoPProofValidator;
import quokka.core.service.grant.GrantHandlerRegistry;

/**
 * Orchestrates one token endpoint request.
 *
 * <ol>
 *   <li>Authenticate the client.</li>
 *   <li>Validate the DPoP proof, when one is presented or the client requires one.</li>
 *   <li>Dispatch the grant.</li>
 *   <li>Create tokens and persist the refresh and reference tokens before answering.</li>
 * </ol>
 *
 * <p>The whole request is bounded by {@code quokka.token.operation-timeout}.
 * Unexpected failures are logged here in full and answered with a generic
 * {@code server_error}.
 */
@ApplicationScoped
public class AuthenticationCoordinator implements TokenIssuance {

    private static final Logger LOG = Logger.getLogger(AuthenticationCoordinator.class);
    static final String INTERNAL_ERROR_DESCRIPTION = "An internal error occurred";

    private final ClientAuthenticator clientAuthenticator;
    private final DPoPProofValidator dpopValidator;
    private final GrantHandlerRegistry grants;
    private final TokenService tokenService;
    private final IssuedTokenPersistence persistence;
    private final TokenMetrics metrics;
    private final TokenConfig config;

    @Inject
    public AuthenticationCoordinator(
            ClientAuthenticator clientAuthenticator,
            DPoPProofValidator dpopValidator,
            GrantHandlerRegistry grants,
            TokenService tokenService,
            IssuedTokenPersistence persistence,
            TokenMetrics metrics,
            TokenConfig config) {
        this.clientAuthenticator = clientAuthenticator;
        this.dpopValidator = dpopValidator;
        this.grants = grants;
        this.tokenService = tokenService;
        this.persistence = persistence;
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public Uni<TokenEndpointResult> token(ClientCredentials credentials, TokenRequest request) {
        final var grantType = request.grantType();
        return clientAuthenticator
                .authenticate(credentials)
                .flatMap(client -> {
                    if (client.isEmpty()) {
                        metrics.recordGrantFailure(grantType, OAuthError.INVALID_CLIENT.code());
                        return Uni.createFrom()
                                .<TokenEndpointResult>item(TokenEndpointResult.Failed.of(
                                        OAuthError.INVALID_CLIENT, "Client authentication failed"));
                    }
                    return withDPoP(request, client.get());
                })
                .ifNoItem()
                .after(config.operationTimeout())
                .fail()
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.errorf(e, "Token request for grant %s by client %s failed", grantType, request.clientId());
                    metrics.recordGrantFailure(grantType, OAuthError.SERVER_ERROR.code());
                    return TokenEndpointResult.Failed.of(OAuthError.SERVER_ERROR, INTERNAL_ERROR_DESCRIPTION);
                });
    }

    private Uni<TokenEndpointResult> withDPoP(TokenRequest request, Client client) {
        final var proof = request.dpopProof();
        if (proof == null || proof.isBlank()) {
            if (client.requireDpop()) {
                metrics.recordGrantFailure(request.grantType(), OAuthError.INVALID_DPOP_PROOF.code());
                return Uni.createFrom()
                        .<TokenEndpointResult>item(TokenEndpointResult.Failed.of(
                                OAuthError.INVALID_DPOP_PROOF, "A DPoP proof is required for this client"));
            }
            return issue(request, client, null);
        }

        final var validation = new DPoPValidationRequest(
                proof, request.httpMethod(), request.requestUri(), null, null, dpopValidator.noncesEnabled());
        return dpopValidator.validate(validation).flatMap(result -> {
            if (result instanceof DPoPValidationResult.Invalid invalid) {
                metrics.recordGrantFailure(request.grantType(), invalid.error().code());
                return Uni.createFrom()
                        .<TokenEndpointResult>item(new TokenEndpointResult.Failed(
                                invalid.error(), invalid.description(), invalid.freshNonce()));
            }
            final var thumbprint = ((DPoPValidationResult.Valid) result).thumbprint();
            final Uni<String> nonce = dpopValidator.noncesEnabled()
                    ? dpopValidator.issueNonce()
                    : Uni.createFrom().nullItem();
            return nonce.flatMap(next -> issue(request.withDpopKeyThumbprint(thumbprint), client, next));
        });
    }

    private Uni<TokenEndpointResult> issue(TokenRequest request, Client client, String dpopNonce) {
        return grants.dispatch(request, client).flatMap(result -> {
            if (!result.success()) {
                logFailure(request, client, result);
                metrics.recordGrantFailure(request.grantType(), result.error().code());
                return Uni.createFrom()
                        .<TokenEndpointResult>item(
                                new TokenEndpointResult.Failed(result.error(), result.errorDescription(), dpopNonce));
            }
            final var context = new TokenIssueContext(client, request.tenantId(), request.dpopKeyThumbprint());
            return tokenService
                    .createTokenResponse(result, context)
                    .flatMap(persistence::persist)
                    .map(tokens -> {
                        metrics.recordTokensIssued(result.grantType());
                        LOG.debugf("Issued tokens for grant %s to client %s", result.grantType(), client.clientId());
                        return (TokenEndpointResult) new TokenEndpointResult.Issued(tokens.response(), dpopNonce);
                    });
        });
    }

    private static void logFailure(TokenRequest request, Client client, GrantResult result) {
        if (result.error() == OAuthError.AUTHORIZATION_PENDING || result.error() == OAuthError.SLOW_DOWN) {
            LOG.tracef("Grant %s for client %s still pending", request.grantType(), client.clientId());
            return;
        }
        LOG.debugf(
                "Grant %s rejected for client %s: %s",
                request.grantType(),
                client.clientId(),
                result.error().code());
    }
}
