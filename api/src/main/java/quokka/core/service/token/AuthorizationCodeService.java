package quokka.core.service.token;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.config.TokenConfig;
import quokka.core.model.token.AuthorizationCode;
import quokka.core.port.out.AuthorizationCodeStore;
import quokka.core.util.RandomValues;
import quokka.core.util.SecureHash;

/**
 * Issues single-use authorization codes on behalf of the external login journey.
 */
@ApplicationScoped
public class AuthorizationCodeService {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeService.class);

    private final AuthorizationCodeStore store;
    private final TokenConfig config;
    private final Clock clock;

    @Inject
    public AuthorizationCodeService(AuthorizationCodeStore store, TokenConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Details of an authenticated authorization request, captured when the journey completes.
     */
    public record CodeIssueRequest(
            String clientId,
            String subjectId,
            String redirectUri,
            Set<String> scopes,
            String codeChallenge,
            String codeChallengeMethod,
            String nonce,
            String sessionId,
            Instant authTime,
            List<String> amr,
            String acr,
            String tenantId) {}

    /**
     * Mint and store a code.
     *
     * @return Uni with the code value to hand back through the redirect
     */
    public Uni<String> issue(CodeIssueRequest request) {
        final var now = clock.instant();
        final var code = new AuthorizationCode(
                RandomValues.handle(),
                request.clientId(),
                request.subjectId(),
                request.redirectUri(),
                request.scopes(),
                request.codeChallenge(),
                request.codeChallengeMethod(),
                request.nonce(),
                request.sessionId(),
                request.authTime() != null ? request.authTime() : now,
                request.amr(),
                request.acr(),
                request.tenantId(),
                now,
                now.plus(config.authorizationCodeLifetime()));

        return store.store(code).map(ignored -> {
            LOG.debugf(
                    "Issued authorization code %s for client %s",
                    SecureHash.fingerprint(code.code()), request.clientId());
            return code.code();
        });
    }
}
