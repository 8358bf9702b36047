package inspector.coordinator.repository;

import inspector.coordinator.model.CartStatus;

import java.util.Optional;

/**
 * Persistence for the single cart status row.
 */
public interface CartStatusRepository {

    /** Overwrite the stored snapshot */
    void save(CartStatus status);

    /** The stored snapshot, empty if telemetry never arrived */
    Optional<CartStatus> load();
}
