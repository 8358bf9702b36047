package inspector.coordinator.error;

public class ConflictException extends CoordinatorException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }
}
