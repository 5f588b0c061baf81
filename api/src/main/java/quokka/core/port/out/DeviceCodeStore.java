package quokka.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.device.DeviceAuthorization;

/**
 * Storage for device authorizations, indexed by device code and user code.
 */
public interface DeviceCodeStore {

    Uni<Void> store(DeviceAuthorization authorization);

    Uni<Optional<DeviceAuthorization>> findByDeviceCode(String deviceCode);

    Uni<Optional<DeviceAuthorization>> findByUserCode(String userCode);

    /**
     * Replace {@code expected} with {@code updated} if the stored record still
     * equals {@code expected}.
     *
     * @return true if the record was replaced
     */
    Uni<Boolean> compareAndSet(DeviceAuthorization expected, DeviceAuthorization updated);

    /**
     * Remove an authorization.
     *
     * @return true if this call removed it
     */
    Uni<Boolean> remove(String deviceCode);
}
