package quokka.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.model.device.DeviceAuthorization;
import quokka.core.port.out.DeviceCodeStore;

/**
 * In-memory device authorization store, indexed by device code with a
 * secondary user code index.
 */
@ApplicationScoped
public class InMemoryDeviceCodeStore implements DeviceCodeStore {

    private static final Logger LOG = Logger.getLogger(InMemoryDeviceCodeStore.class);
    private static final Duration RETENTION_AFTER_EXPIRY = Duration.ofMinutes(5);

    private final ConcurrentMap<String, DeviceAuthorization> byDeviceCode = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> userCodeIndex = new ConcurrentHashMap<>();
    private final Clock clock;

    @Inject
    public InMemoryDeviceCodeStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Void> store(DeviceAuthorization authorization) {
        return Uni.createFrom().item(() -> {
            if (userCodeIndex.putIfAbsent(authorization.userCode(), authorization.deviceCode()) != null) {
                throw new IllegalStateException("User code collision");
            }
            byDeviceCode.put(authorization.deviceCode(), authorization);
            return null;
        });
    }

    @Override
    public Uni<Optional<DeviceAuthorization>> findByDeviceCode(String deviceCode) {
        return Uni.createFrom().item(() -> Optional.ofNullable(byDeviceCode.get(deviceCode)));
    }

    @Override
    public Uni<Optional<DeviceAuthorization>> findByUserCode(String userCode) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(userCodeIndex.get(userCode)).map(byDeviceCode::get));
    }

    @Override
    public Uni<Boolean> compareAndSet(DeviceAuthorization expected, DeviceAuthorization updated) {
        return Uni.createFrom().item(() -> byDeviceCode.replace(expected.deviceCode(), expected, updated));
    }

    @Override
    public Uni<Boolean> remove(String deviceCode) {
        return Uni.createFrom().item(() -> {
            final var removed = byDeviceCode.remove(deviceCode);
            if (removed == null) {
                return false;
            }
            userCodeIndex.remove(removed.userCode(), deviceCode);
            return true;
        });
    }

    @Scheduled(every = "60s", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void purgeExpired() {
        final var cutoff = clock.instant().minus(RETENTION_AFTER_EXPIRY);
        final var before = byDeviceCode.size();
        byDeviceCode.values().removeIf(authorization -> {
            if (authorization.expiresAt().isBefore(cutoff)) {
                userCodeIndex.remove(authorization.userCode(), authorization.deviceCode());
                return true;
            }
            return false;
        });
        final var removed = before - byDeviceCode.size();
        if (removed > 0) {
            LOG.debugf("Purged %d expired device authorizations", removed);
        }
    }
}
