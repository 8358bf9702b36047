package inspector.coordinator.model;

import inspector.coordinator.error.ValidationException;

import java.util.Locale;

/**
 * Cart operating mode as reported by telemetry.
 */
public enum CartMode {
    IDLE,
    SINGLE,
    LOOP,
    TRAVELING,
    WORKING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CartMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("mode is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown cart mode: " + value);
        }
    }
}
