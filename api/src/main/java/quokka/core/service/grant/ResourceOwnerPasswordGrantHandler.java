package quokka.core.service.grant;

import java.time.Clock;
import java.util.List;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.client.Client;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.TokenRequest;
import quokka.core.model.user.PasswordValidationResult;
import quokka.core.port.out.ResourceOwnerPasswordValidator;
import quokka.core.util.RandomValues;
import quokka.core.util.SecureHash;

/**
 * Handles {@code grant_type=password} by delegating credential checks to
 * the {@link ResourceOwnerPasswordValidator} port.
 */
@ApplicationScoped
public class ResourceOwnerPasswordGrantHandler implements GrantHandler {

    private static final Logger LOG = Logger.getLogger(ResourceOwnerPasswordGrantHandler.class);

    private final ResourceOwnerPasswordValidator validator;
    private final Clock clock;

    @Inject
    public ResourceOwnerPasswordGrantHandler(ResourceOwnerPasswordValidator validator, Clock clock) {
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public String grantType() {
        return GrantTypes.PASSWORD;
    }

    @Override
    public Uni<GrantResult> handle(TokenRequest request, Client client) {
        final var username = request.parameter("username");
        final var password = request.parameter("password");
        if (username.isEmpty() || password.isEmpty()) {
            return Uni.createFrom()
                    .item(GrantResult.failure(OAuthError.INVALID_REQUEST, "username and password are required"));
        }

        final var requested = GrantScopes.requested(request);
        final Set<String> scopes = requested.isEmpty() ? client.allowedScopes() : requested;
        final var scopeError = GrantScopes.checkAllowed(scopes, client);
        if (scopeError.isPresent()) {
            return Uni.createFrom().item(GrantResult.failure(OAuthError.INVALID_SCOPE, scopeError.get()));
        }

        return validator.validate(username.get(), password.get(), client).map(result -> {
            if (result instanceof PasswordValidationResult.Valid valid) {
                return GrantResult.success(grantType(), client.clientId())
                        .subjectId(valid.account().subjectId())
                        .scopes(scopes)
                        .sessionId(RandomValues.base64Url(16))
                        .authTime(clock.instant())
                        .amr(List.of("pwd"))
                        .build();
            }

            final var reason = ((PasswordValidationResult.Invalid) result).reason();
            LOG.debugf("Password grant rejected for user %s: %s", SecureHash.fingerprint(username.get()), reason);
            return GrantResult.failure(OAuthError.INVALID_GRANT, describe(reason));
        });
    }

    private static String describe(PasswordValidationResult.Reason reason) {
        return switch (reason) {
            case INVALID_CREDENTIALS -> "Invalid username or password";
            case LOCKED_OUT -> "User account is locked";
            case INACTIVE -> "User account is not active";
            case MFA_REQUIRED -> "User requires multi-factor authentication";
        };
    }
}
