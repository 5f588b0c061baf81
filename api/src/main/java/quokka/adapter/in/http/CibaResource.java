package quokka.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import quokka.core.model.ciba.CibaAuthenticationRequest;
import quokka.core.model.ciba.CibaResult;
import quokka.core.model.client.ClientCredentials;
import quokka.core.model.grant.OAuthError;
import quokka.core.port.in.BackchannelAuthentication;
import quokka.core.service.client.ClientAuthenticator;

/**
 * Backchannel authentication endpoint (OpenID Connect CIBA Core 1.0 section 7).
 */
@Path("/connect/ciba")
@Produces(MediaType.APPLICATION_JSON)
public class CibaResource {

    private final ClientAuthenticator clientAuthenticator;
    private final BackchannelAuthentication backchannel;

    @Inject
    public CibaResource(ClientAuthenticator clientAuthenticator, BackchannelAuthentication backchannel) {
        this.clientAuthenticator = clientAuthenticator;
        this.backchannel = backchannel;
    }

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> authenticate(
            MultivaluedMap<String, String> form,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @HeaderParam(OAuthResponses.TENANT_HEADER) String tenantId) {
        if (OAuthResponses.hasRepeatedParameter(form)) {
            return Uni.createFrom()
                    .item(OAuthResponses.error(OAuthError.INVALID_REQUEST, "Parameters must not be repeated"));
        }
        final var parameters = OAuthResponses.singleValued(form);

        final Integer requestedExpiry;
        try {
            requestedExpiry = parameters.containsKey("requested_expiry")
                    ? Integer.valueOf(parameters.get("requested_expiry").trim())
                    : null;
        } catch (NumberFormatException e) {
            return Uni.createFrom()
                    .item(OAuthResponses.error(OAuthError.INVALID_REQUEST, "requested_expiry must be an integer"));
        }

        final var credentials = ClientCredentials.extract(authorization, parameters);
        if (credentials.isEmpty()) {
            return Uni.createFrom()
                    .item(OAuthResponses.error(OAuthError.INVALID_CLIENT, "Client authentication failed"));
        }

        final var request = new CibaAuthenticationRequest(
                parameters.get("scope"),
                parameters.get("login_hint"),
                parameters.get("login_hint_token"),
                parameters.get("id_token_hint"),
                parameters.get("binding_message"),
                parameters.get("user_code"),
                requestedExpiry,
                parameters.get("client_notification_token"),
                parameters.get("acr_values"),
                tenantId);

        return clientAuthenticator.authenticate(credentials.get()).flatMap(client -> {
            if (client.isEmpty()) {
                return Uni.createFrom()
                        .item(OAuthResponses.error(OAuthError.INVALID_CLIENT, "Client authentication failed"));
            }
            return backchannel.authenticate(request, client.get()).map(result -> {
                if (result instanceof CibaResult.Accepted accepted) {
                    return OAuthResponses.ok(accepted.response());
                }
                final var rejected = (CibaResult.Rejected) result;
                return OAuthResponses.error(rejected.error(), rejected.description());
            });
        });
    }
}
