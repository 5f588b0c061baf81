package quokka.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.ciba.CibaRequest;

/**
 * Storage for backchannel authentication requests.
 *
 * <p>Status changes go through {@link #compareAndSet}, a single conditional
 * update. The approver is the sole writer of terminal status, and a poller
 * never observes a partially written record.
 */
public interface CibaRequestStore {

    Uni<Void> store(CibaRequest request);

    Uni<Optional<CibaRequest>> find(String authReqId);

    /**
     * Replace {@code expected} with {@code updated} if the stored record still
     * equals {@code expected}.
     *
     * @return true if the record was replaced
     */
    Uni<Boolean> compareAndSet(CibaRequest expected, CibaRequest updated);
}
