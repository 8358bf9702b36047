package inspector.coordinator.error;

public class NotFoundException extends CoordinatorException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
