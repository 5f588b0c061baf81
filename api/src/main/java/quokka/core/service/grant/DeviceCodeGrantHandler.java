package quokka.core.service.grant;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import quokka.core.model.client.Client;
import quokka.core.model.device.DeviceAuthorization;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.TokenRequest;
import quokka.core.port.out.DeviceCodeStore;

/**
 * Handles the device authorization grant (RFC 8628 section 3.4).
 *
 * <p>Every pending poll records its time with a conditional replace; a poll
 * that arrives within the interval, or loses that race, gets
 * {@code slow_down}. An authorized code is removed on redemption.
 */
@ApplicationScoped
public class DeviceCodeGrantHandler implements GrantHandler {

    private final DeviceCodeStore store;
    private final Clock clock;

    @Inject
    public DeviceCodeGrantHandler(DeviceCodeStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public String grantType() {
        return GrantTypes.DEVICE_CODE;
    }

    @Override
    public Uni<GrantResult> handle(TokenRequest request, Client client) {
        final var deviceCode = request.parameter("device_code");
        if (deviceCode.isEmpty()) {
            return failure(OAuthError.INVALID_REQUEST, "device_code is required");
        }

        return store.findByDeviceCode(deviceCode.get()).flatMap(found -> {
            if (found.isEmpty() || !found.get().clientId().equals(client.clientId())) {
                return failure(OAuthError.INVALID_GRANT, "Invalid device code");
            }
            final var authorization = found.get();
            final var now = clock.instant();

            if (authorization.isExpired(now)) {
                return store.remove(authorization.deviceCode())
                        .replaceWith(GrantResult.failure(OAuthError.EXPIRED_TOKEN, "Device code has expired"));
            }

            return switch (authorization.status()) {
                case PENDING -> poll(authorization);
                case DENIED -> store.remove(authorization.deviceCode())
                        .replaceWith(GrantResult.failure(OAuthError.ACCESS_DENIED, "The user denied the request"));
                case AUTHORIZED -> redeem(authorization, client);
            };
        });
    }

    private Uni<GrantResult> poll(DeviceAuthorization authorization) {
        final var now = clock.instant();
        if (authorization.isPolledTooSoon(now)) {
            return failure(OAuthError.SLOW_DOWN, "Polling too frequently");
        }
        return store.compareAndSet(authorization, authorization.withLastPolledAt(now))
                .map(updated -> updated
                        ? GrantResult.failure(OAuthError.AUTHORIZATION_PENDING, "The user has not yet responded")
                        : GrantResult.failure(OAuthError.SLOW_DOWN, "Polling too frequently"));
    }

    private Uni<GrantResult> redeem(DeviceAuthorization authorization, Client client) {
        return store.remove(authorization.deviceCode()).map(removed -> {
            if (!removed) {
                return GrantResult.failure(OAuthError.INVALID_GRANT, "Device code has already been used");
            }
            return GrantResult.success(grantType(), client.clientId())
                    .subjectId(authorization.subjectId())
                    .scopes(authorization.scopes())
                    .sessionId(authorization.sessionId())
                    .authTime(authorization.authTime())
                    .build();
        });
    }

    private static Uni<GrantResult> failure(OAuthError error, String description) {
        return Uni.createFrom().item(GrantResult.failure(error, description));
    }
}
