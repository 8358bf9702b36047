package inspector.coordinator.api;

import inspector.coordinator.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class QueryParamsTest {

    @Test
    void readsTypedValues() {
        QueryParams params = QueryParams.of(
                "/api/v1/history?task_type=2&station_id=%203%20&from=2024-05-01T08:00:00Z&offset=");

        assertEquals(2, params.integer("task_type"));
        assertEquals(3, params.integer("station_id"));
        assertEquals(Instant.parse("2024-05-01T08:00:00Z"), params.instant("from"));
        assertNull(params.integer("offset"), "blank counts as absent");
        assertEquals(100, params.integer("limit", 100));
        assertNull(params.string("missing"));
    }

    @Test
    void malformedValuesAreValidationErrors() {
        QueryParams params = QueryParams.of("/x?limit=ten&from=yesterday&id=9x");

        assertThrows(ValidationException.class, () -> params.integer("limit"));
        assertThrows(ValidationException.class, () -> params.instant("from"));
        assertThrows(ValidationException.class, () -> params.longValue("id"));
    }
}
