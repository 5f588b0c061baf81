package quokka.core.model.ciba;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful backchannel authentication response.
 */
public record CibaAuthenticationResponse(
        @JsonProperty("auth_req_id") String authReqId,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("interval") int interval) {}
