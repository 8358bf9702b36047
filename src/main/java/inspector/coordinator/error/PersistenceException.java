package inspector.coordinator.error;

/**
 * Thrown when a store operation fails at the JDBC level.
 */
public class PersistenceException extends CoordinatorException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PERSISTENCE;
    }
}
