package inspector.coordinator.model;

import inspector.coordinator.error.ValidationException;

/**
 * The five inspection categories. A station is bound to exactly one of them.
 */
public enum TaskType {
    GAUGE_READING(1, "gauge reading"),
    TEMPERATURE(2, "temperature check"),
    SMOKE_A(3, "smoke check A"),
    SMOKE_B(4, "smoke check B"),
    OBJECT_DESCRIPTION(5, "object description");

    private final int code;
    private final String label;

    TaskType(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static TaskType fromCode(int code) {
        for (TaskType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new ValidationException("task_type must be between 1 and 5, got " + code);
    }

    public static TaskType fromCode(Integer code) {
        if (code == null) {
            throw new ValidationException("task_type is required");
        }
        return fromCode(code.intValue());
    }
}
