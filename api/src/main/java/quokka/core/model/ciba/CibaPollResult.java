package quokka.core.model.ciba;

import java.util.Optional;

/**
 * Result of polling a backchannel authentication request.
 *
 * @param outcome what the poll observed
 * @param request the request as of the poll, or null when unknown
 */
public record CibaPollResult(CibaPollOutcome outcome, CibaRequest request) {

    public static CibaPollResult of(CibaPollOutcome outcome) {
        return new CibaPollResult(outcome, null);
    }

    public Optional<CibaRequest> requestValue() {
        return Optional.ofNullable(request);
    }
}
