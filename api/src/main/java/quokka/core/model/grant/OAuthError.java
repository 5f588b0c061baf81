package quokka.core.model.grant;

/**
 * OAuth2, OIDC, CIBA and DPoP error codes.
 *
 * <p>The wire value is used verbatim as the {@code error} member of error
 * responses.
 */
public enum OAuthError {
    INVALID_REQUEST("invalid_request", 400),
    INVALID_CLIENT("invalid_client", 401),
    INVALID_GRANT("invalid_grant", 400),
    UNAUTHORIZED_CLIENT("unauthorized_client", 400),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", 400),
    INVALID_SCOPE("invalid_scope", 400),
    ACCESS_DENIED("access_denied", 400),
    AUTHORIZATION_PENDING("authorization_pending", 400),
    SLOW_DOWN("slow_down", 400),
    EXPIRED_TOKEN("expired_token", 400),
    SERVER_ERROR("server_error", 500),
    INVALID_DPOP_PROOF("invalid_dpop_proof", 400),
    USE_DPOP_NONCE("use_dpop_nonce", 400),
    UNKNOWN_USER_ID("unknown_user_id", 400),
    MISSING_USER_CODE("missing_user_code", 400),
    INVALID_USER_CODE("invalid_user_code", 400),
    INVALID_BINDING_MESSAGE("invalid_binding_message", 400),
    EXPIRED_LOGIN_HINT_TOKEN("expired_login_hint_token", 400);

    private final String code;
    private final int httpStatus;

    OAuthError(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    @Override
    public String toString() {
        return code;
    }
}
