package quokka.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.client.ClientCredentials;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.TokenRequest;
import quokka.core.model.token.TokenEndpointResult;
import quokka.core.port.in.TokenIssuance;

/**
 * OAuth2 token endpoint (RFC 6749 section 3.2).
 *
 * <p>Every response carries {@code Cache-Control: no-store}. Errors use the
 * {@code {error, error_description}} shape; {@code invalid_client} is a 401.
 */
@Path("/connect/token")
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

    private static final Logger LOG = Logger.getLogger(TokenResource.class);

    private final TokenIssuance tokenIssuance;

    @Inject
    public TokenResource(TokenIssuance tokenIssuance) {
        this.tokenIssuance = tokenIssuance;
    }

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> token(
            MultivaluedMap<String, String> form,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @HeaderParam("DPoP") String dpopProof,
            @HeaderParam(OAuthResponses.TENANT_HEADER) String tenantId,
            @Context UriInfo uriInfo) {
        if (OAuthResponses.hasRepeatedParameter(form)) {
            return Uni.createFrom()
                    .item(OAuthResponses.error(OAuthError.INVALID_REQUEST, "Parameters must not be repeated"));
        }
        final var parameters = OAuthResponses.singleValued(form);
        final var credentials = ClientCredentials.extract(authorization, parameters);
        if (credentials.isEmpty()) {
            LOG.debug("Token request without usable client credentials");
            return Uni.createFrom()
                    .item(OAuthResponses.error(OAuthError.INVALID_CLIENT, "Client authentication failed"));
        }

        final var request = new TokenRequest(
                parameters.get("grant_type"),
                credentials.get().clientId(),
                tenantId,
                parameters,
                dpopProof,
                "POST",
                uriInfo.getAbsolutePath().toString(),
                null);
        return tokenIssuance.token(credentials.get(), request).map(TokenResource::toResponse);
    }

    private static Response toResponse(TokenEndpointResult result) {
        final Response.ResponseBuilder builder;
        if (result instanceof TokenEndpointResult.Issued issued) {
            builder = OAuthResponses.noStore(Response.ok(issued.response(), MediaType.APPLICATION_JSON_TYPE));
        } else {
            final var failed = (TokenEndpointResult.Failed) result;
            builder = OAuthResponses.errorBuilder(failed.error(), failed.description());
        }
        result.dpopNonceValue().ifPresent(nonce -> builder.header(OAuthResponses.DPOP_NONCE_HEADER, nonce));
        return builder.build();
    }
}
