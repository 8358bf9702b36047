package inspector.coordinator.error;

public class ValidationException extends CoordinatorException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
