package quokka.core.model.token;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful token endpoint response body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") int expiresIn,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("id_token") String idToken,
        @JsonProperty("scope") String scope,
        @JsonProperty("issued_token_type") String issuedTokenType) {

    public TokenResponse {
        Objects.requireNonNull(accessToken, "accessToken cannot be null");
        Objects.requireNonNull(tokenType, "tokenType cannot be null");
    }

    @JsonIgnore
    public Optional<String> refreshTokenValue() {
        return Optional.ofNullable(refreshToken);
    }

    @JsonIgnore
    public Optional<String> idTokenValue() {
        return Optional.ofNullable(idToken);
    }
}
