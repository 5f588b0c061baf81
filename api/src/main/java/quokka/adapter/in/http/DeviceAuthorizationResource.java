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

import quokka.core.model.client.ClientCredentials;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.port.in.DeviceAuthorizationManagement;
import quokka.core.service.client.ClientAuthenticator;

/**
 * Device authorization endpoint (RFC 8628 section 3.1).
 */
@Path("/connect/deviceauthorization")
@Produces(MediaType.APPLICATION_JSON)
public class DeviceAuthorizationResource {

    private final ClientAuthenticator clientAuthenticator;
    private final DeviceAuthorizationManagement deviceAuthorizations;

    @Inject
    public DeviceAuthorizationResource(
            ClientAuthenticator clientAuthenticator, DeviceAuthorizationManagement deviceAuthorizations) {
        this.clientAuthenticator = clientAuthenticator;
        this.deviceAuthorizations = deviceAuthorizations;
    }

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Uni<Response> authorize(
            MultivaluedMap<String, String> form,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @HeaderParam(OAuthResponses.TENANT_HEADER) String tenantId) {
        final var parameters = OAuthResponses.singleValued(form);
        final var credentials = ClientCredentials.extract(authorization, parameters);
        if (credentials.isEmpty()) {
            return Uni.createFrom()
                    .item(OAuthResponses.error(OAuthError.INVALID_CLIENT, "Client authentication failed"));
        }

        return clientAuthenticator.authenticate(credentials.get()).flatMap(client -> {
            if (client.isEmpty()) {
                return Uni.createFrom()
                        .item(OAuthResponses.error(OAuthError.INVALID_CLIENT, "Client authentication failed"));
            }
            if (!client.get().allowsGrantType(GrantTypes.DEVICE_CODE)) {
                return Uni.createFrom()
                        .item(OAuthResponses.error(
                                OAuthError.UNAUTHORIZED_CLIENT, "Client is not allowed to use the device code grant"));
            }
            return deviceAuthorizations
                    .start(client.get(), parameters.get("scope"), tenantId)
                    .map(OAuthResponses::ok)
                    .onFailure(IllegalArgumentException.class)
                    .recoverWithItem(e -> OAuthResponses.error(OAuthError.INVALID_SCOPE, e.getMessage()));
        });
    }
}
