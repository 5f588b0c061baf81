package quokka.adapter.in.http;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;

import quokka.core.model.grant.OAuthError;

/**
 * Response and request helpers shared by the protocol endpoints.
 *
 * <p>Protocol endpoints always answer with the OAuth JSON shape and are never
 * cached.
 */
final class OAuthResponses {

    static final String DPOP_NONCE_HEADER = "DPoP-Nonce";
    static final String TENANT_HEADER = "X-Quokka-Tenant";

    private OAuthResponses() {}

    static Response ok(Object body) {
        return noStore(Response.ok(body, MediaType.APPLICATION_JSON_TYPE)).build();
    }

    static Response error(OAuthError error, String description) {
        return errorBuilder(error, description).build();
    }

    static Response.ResponseBuilder errorBuilder(OAuthError error, String description) {
        final var body = new LinkedHashMap<String, String>();
        body.put("error", error.code());
        if (description != null) {
            body.put("error_description", description);
        }
        final var builder = noStore(Response.status(error.httpStatus()).type(MediaType.APPLICATION_JSON_TYPE))
                .entity(body);
        if (error == OAuthError.INVALID_CLIENT) {
            builder.header("WWW-Authenticate", "Basic realm=\"quokka\"");
        }
        return builder;
    }

    static Response.ResponseBuilder noStore(Response.ResponseBuilder builder) {
        return builder.header("Cache-Control", "no-store").header("Pragma", "no-cache");
    }

    /**
     * Flatten a form to its first values. Repeated parameters are rejected by the caller.
     */
    static Map<String, String> singleValued(MultivaluedMap<String, String> form) {
        final var result = new LinkedHashMap<String, String>();
        if (form != null) {
            form.forEach((name, values) -> {
                if (values != null && !values.isEmpty()) {
                    result.put(name, values.get(0));
                }
            });
        }
        return result;
    }

    /**
     * RFC 6749 section 3.2: request parameters must not be included more than once.
     */
    static boolean hasRepeatedParameter(MultivaluedMap<String, String> form) {
        return form != null && form.values().stream().anyMatch(values -> values != null && values.size() > 1);
    }
}
