package quokka.core.model.ciba;

import quokka.core.model.grant.OAuthError;

/**
 * Result of initiating a backchannel authentication request.
 */
public sealed interface CibaResult {

    /**
     * The request was accepted and is now pending.
     *
     * @param response the response returned to the client
     * @param request  the stored request
     */
    record Accepted(CibaAuthenticationResponse response, CibaRequest request) implements CibaResult {}

    /**
     * The request was rejected.
     *
     * @param error       the error code
     * @param description a client-safe description
     */
    record Rejected(OAuthError error, String description) implements CibaResult {}
}
