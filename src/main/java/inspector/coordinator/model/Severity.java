package inspector.coordinator.model;

import java.util.Locale;

/**
 * Three-level classification of a completed result.
 */
public enum Severity {
    NORMAL,
    WARNING,
    DANGER;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse used for values reported by the vision service.
     *
     * @return the severity, or null if the value is absent or not one of the three levels
     */
    public static Severity parseOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "normal" -> NORMAL;
            case "warning" -> WARNING;
            case "danger" -> DANGER;
            default -> null;
        };
    }
}
