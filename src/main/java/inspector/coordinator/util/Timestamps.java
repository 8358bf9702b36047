package inspector.coordinator.util;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Instants at the precision the store keeps, so a stamped value reads back unchanged.
 */
public final class Timestamps {

    public static final ChronoUnit PRECISION = ChronoUnit.MICROS;

    private Timestamps() {
    }

    public static Instant now() {
        return Instant.now().truncatedTo(PRECISION);
    }

    public static Instant storable(Instant instant) {
        return instant == null ? null : instant.truncatedTo(PRECISION);
    }
}
