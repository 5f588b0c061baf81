package quokka.core.model.grant;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A token endpoint request after client authentication.
 *
 * <p>Grant-specific parameters are kept in the flat {@code parameters} map so
 * each handler reads only what its grant defines. The tenant is an already
 * resolved input; this component does no tenant resolution of its own.
 *
 * @param grantType         the literal {@code grant_type} parameter
 * @param clientId          the authenticated client
 * @param tenantId          resolved tenant, or null for the default tenant
 * @param parameters        all form parameters, single-valued
 * @param dpopProof         the {@code DPoP} header, or null
 * @param httpMethod        request method, used for DPoP {@code htm}
 * @param requestUri        request URI, used for DPoP {@code htu}
 * @param dpopKeyThumbprint thumbprint of a validated DPoP proof key, or null
 */
public record TokenRequest(
        String grantType,
        String clientId,
        String tenantId,
        Map<String, String> parameters,
        String dpopProof,
        String httpMethod,
        String requestUri,
        String dpopKeyThumbprint) {

    public TokenRequest {
        Objects.requireNonNull(clientId, "clientId cannot be null");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * Read a parameter, treating blank values as absent.
     */
    public Optional<String> parameter(String name) {
        return Optional.ofNullable(parameters.get(name)).filter(v -> !v.isBlank());
    }

    public Optional<String> dpopThumbprint() {
        return Optional.ofNullable(dpopKeyThumbprint);
    }

    public TokenRequest withDpopKeyThumbprint(String thumbprint) {
        return new TokenRequest(
                grantType, clientId, tenantId, parameters, dpopProof, httpMethod, requestUri, thumbprint);
    }
}
