package quokka.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.config.KeysConfig;
import quokka.core.service.key.SigningKeyService;

/**
 * JWKS (JSON Web Key Set) endpoint exposing the public signing keys.
 *
 * <p>Lists pending and active keys plus expired keys still inside the grace
 * period. Revoked keys are never listed.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7517">RFC 7517 - JSON Web Key (JWK)</a>
 */
@Path("/.well-known/jwks.json")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class JwksResource {

    private static final Logger LOG = Logger.getLogger(JwksResource.class);

    private final SigningKeyService signingKeys;
    private final KeysConfig config;

    @Inject
    public JwksResource(SigningKeyService signingKeys, KeysConfig config) {
        this.signingKeys = signingKeys;
        this.config = config;
    }

    @GET
    public Uni<Response> getJwks(@HeaderParam(OAuthResponses.TENANT_HEADER) String tenantId) {
        return signingKeys.getJwks(tenantId).map(jwks -> {
            LOG.debugv("Returning JWKS for tenant {0}", tenantId == null ? "default" : tenantId);
            return Response.ok(jwks)
                    .header("Cache-Control", "public, max-age=" + config.jwksCacheDuration().toSeconds())
                    .build();
        });
    }
}
