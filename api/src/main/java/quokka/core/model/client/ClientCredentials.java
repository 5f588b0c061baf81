package quokka.core.model.client;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

/**
 * Client credentials as presented at a protocol endpoint.
 *
 * @param clientId claimed client id
 * @param secret   presented secret, or null for public clients
 * @param method   how the credentials were presented
 */
public record ClientCredentials(String clientId, String secret, Method method) {

    public enum Method {
        CLIENT_SECRET_BASIC,
        CLIENT_SECRET_POST,
        NONE
    }

    /**
     * Extract credentials from the {@code Authorization} header or the form.
     *
     * <p>Presenting credentials both ways, or a malformed Basic header,
     * yields empty.
     *
     * @param authorization the raw {@code Authorization} header, or null
     * @param form          the form parameters
     */
    public static Optional<ClientCredentials> extract(String authorization, Map<String, String> form) {
        final var formId = nonBlank(form.get("client_id"));
        final var formSecret = nonBlank(form.get("client_secret"));

        if (authorization != null && authorization.regionMatches(true, 0, "Basic ", 0, 6)) {
            if (formSecret.isPresent()) {
                return Optional.empty();
            }
            return decodeBasic(authorization.substring(6).trim()).filter(basic -> formId.isEmpty()
                    || formId.get().equals(basic.clientId()));
        }
        if (formId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(formSecret
                .map(secret -> new ClientCredentials(formId.get(), secret, Method.CLIENT_SECRET_POST))
                .orElseGet(() -> new ClientCredentials(formId.get(), null, Method.NONE)));
    }

    private static Optional<ClientCredentials> decodeBasic(String encoded) {
        final String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        final var colon = decoded.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        // RFC 6749 section 2.3.1: both halves are form-urlencoded.
        final var clientId = URLDecoder.decode(decoded.substring(0, colon), StandardCharsets.UTF_8);
        final var secret = URLDecoder.decode(decoded.substring(colon + 1), StandardCharsets.UTF_8);
        return Optional.of(new ClientCredentials(clientId, secret, Method.CLIENT_SECRET_BASIC));
    }

    private static Optional<String> nonBlank(String value) {
        return Optional.ofNullable(value).filter(v -> !v.isBlank());
    }

    @Override
    public String toString() {
        return "ClientCredentials[clientId=" + clientId + ", method=" + method + "]";
    }
}
