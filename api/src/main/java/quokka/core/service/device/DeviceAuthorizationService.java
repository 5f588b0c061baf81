package quokka.core.service.device;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.config.DeviceConfig;
import quokka.core.model.client.Client;
import quokka.core.model.device.DeviceAuthorization;
import quokka.core.model.device.DeviceAuthorizationResponse;
import quokka.core.model.device.DeviceAuthorizationStatus;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.Scopes;
import quokka.core.port.in.DeviceAuthorizationManagement;
import quokka.core.port.out.DeviceCodeStore;
import quokka.core.service.grant.GrantScopes;
import quokka.core.util.RandomValues;
import quokka.core.util.SecureHash;

/**
 * Issues and decides device authorizations.
 *
 * <p>User codes are short, so a freshly drawn code can collide with a live
 * one. The store rejects the duplicate and a new code is drawn.
 */
@ApplicationScoped
public class DeviceAuthorizationService implements DeviceAuthorizationManagement {

    private static final Logger LOG = Logger.getLogger(DeviceAuthorizationService.class);
    private static final int MAX_USER_CODE_ATTEMPTS = 5;

    private final DeviceCodeStore store;
    private final DeviceConfig config;
    private final Clock clock;

    @Inject
    public DeviceAuthorizationService(DeviceCodeStore store, DeviceConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<DeviceAuthorizationResponse> start(Client client, String scope, String tenantId) {
        if (!client.allowsGrantType(GrantTypes.DEVICE_CODE)) {
            return Uni.createFrom()
                    .failure(new IllegalArgumentException("Client is not allowed to use the device code grant"));
        }
        final var requested = Scopes.parse(scope);
        final var scopeError = GrantScopes.checkAllowed(requested, client);
        if (scopeError.isPresent()) {
            return Uni.createFrom().failure(new IllegalArgumentException(scopeError.get()));
        }
        final var scopes = requested.isEmpty() ? Scopes.ordered(new TreeSet<>(client.allowedScopes())) : requested;

        final var now = clock.instant();
        return Uni.createFrom()
                .item(() -> new DeviceAuthorization(
                        RandomValues.handle(),
                        RandomValues.userCode(),
                        client.clientId(),
                        tenantId,
                        scopes,
                        DeviceAuthorizationStatus.PENDING,
                        now,
                        now.plusSeconds(client.deviceCodeLifetime()),
                        client.devicePollingInterval(),
                        null,
                        null,
                        null,
                        null))
                .call(store::store)
                .onFailure(IllegalStateException.class)
                .retry()
                .atMost(MAX_USER_CODE_ATTEMPTS)
                .map(stored -> {
                    LOG.debugf(
                            "Device authorization %s started for client %s",
                            SecureHash.fingerprint(stored.deviceCode()),
                            client.clientId());
                    return new DeviceAuthorizationResponse(
                            stored.deviceCode(),
                            stored.userCode(),
                            config.verificationUri(),
                            config.verificationUri() + "?user_code=" + stored.userCode(),
                            client.deviceCodeLifetime(),
                            stored.interval());
                });
    }

    @Override
    public Uni<Optional<DeviceAuthorization>> findByUserCode(String userCode) {
        return store.findByUserCode(normalize(userCode))
                .map(found -> found.filter(a -> !a.isExpired(clock.instant())));
    }

    @Override
    public Uni<Optional<DeviceAuthorizationStatus>> approve(String userCode, String subjectId, String sessionId) {
        final var session = sessionId != null ? sessionId : RandomValues.base64Url(16);
        return decide(userCode, a -> a.authorize(subjectId, session, clock.instant()));
    }

    @Override
    public Uni<Optional<DeviceAuthorizationStatus>> deny(String userCode) {
        return decide(userCode, DeviceAuthorization::deny);
    }

    private Uni<Optional<DeviceAuthorizationStatus>> decide(
            String userCode, UnaryOperator<DeviceAuthorization> change) {
        return findByUserCode(userCode).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Optional.<DeviceAuthorizationStatus>empty());
            }
            final var current = found.get();
            if (current.status() != DeviceAuthorizationStatus.PENDING) {
                return Uni.createFrom().item(Optional.of(current.status()));
            }
            final var updated = change.apply(current);
            return store.compareAndSet(current, updated).flatMap(applied -> {
                if (!applied) {
                    // A poll updated lastPolledAt; read again.
                    return decide(userCode, change);
                }
                LOG.infof(
                        "Device authorization %s %s",
                        SecureHash.fingerprint(current.deviceCode()),
                        updated.status().name().toLowerCase(Locale.ROOT));
                return Uni.createFrom().item(Optional.of(updated.status()));
            });
        });
    }

    private static String normalize(String userCode) {
        if (userCode == null) {
            return "";
        }
        final var compact = userCode.toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        return compact.length() == 8 ? compact.substring(0, 4) + "-" + compact.substring(4) : compact;
    }
}
