package quokka.core.model.token;

import java.util.Set;

/**
 * Token type identifiers from RFC 8693 and the {@code token_type} values of
 * token responses.
 */
public final class TokenTypes {

    public static final String ACCESS_TOKEN = "urn:ietf:params:oauth:token-type:access_token";
    public static final String REFRESH_TOKEN = "urn:ietf:params:oauth:token-type:refresh_token";
    public static final String ID_TOKEN = "urn:ietf:params:oauth:token-type:id_token";
    public static final String JWT = "urn:ietf:params:oauth:token-type:jwt";

    public static final Set<String> EXCHANGEABLE = Set.of(ACCESS_TOKEN, REFRESH_TOKEN, ID_TOKEN, JWT);

    public static final String BEARER = "Bearer";
    public static final String DPOP = "DPoP";

    private TokenTypes() {}
}
