package inspector.coordinator.error;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of a public coordinator operation: either a value or a typed failure.
 *
 * @param <T> value type on success
 */
public final class OperationResult<T> {

    private final T value;
    private final ErrorKind error;
    private final String message;

    private OperationResult(T value, ErrorKind error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String message) {
        return new OperationResult<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    /**
     * Run an operation, turning any {@link CoordinatorException} into a failure result.
     */
    public static <T> OperationResult<T> of(Supplier<T> operation) {
        try {
            return success(operation.get());
        } catch (CoordinatorException e) {
            return failure(e.kind(), e.getMessage());
        }
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("no value, operation failed with " + error + ": " + message);
        }
        return value;
    }

    public Optional<ErrorKind> error() {
        return Optional.ofNullable(error);
    }

    public String message() {
        return message;
    }

    /** True if this is a failure of the given kind */
    public boolean failedWith(ErrorKind kind) {
        return error == kind;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "OperationResult{success, value=" + value + "}"
                : "OperationResult{failure=" + error + ", message='" + message + "'}";
    }
}
