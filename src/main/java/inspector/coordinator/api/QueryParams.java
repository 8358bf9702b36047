package inspector.coordinator.api;

import inspector.coordinator.error.ValidationException;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Typed access to a request's query string. Malformed values raise {@link ValidationException}.
 */
public final class QueryParams {

    private final Map<String, List<String>> params;

    private QueryParams(Map<String, List<String>> params) {
        this.params = params;
    }

    public static QueryParams of(String uri) {
        return new QueryParams(new QueryStringDecoder(uri).parameters());
    }

    public String string(String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    public Integer integer(String name) {
        String value = string(name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer, got '" + value + "'");
        }
    }

    public int integer(String name, int defaultValue) {
        Integer value = integer(name);
        return value != null ? value : defaultValue;
    }

    public Long longValue(String name) {
        String value = string(name);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer, got '" + value + "'");
        }
    }

    /** ISO-8601 instant, e.g. {@code 2024-05-01T08:00:00Z} */
    public Instant instant(String name) {
        String value = string(name);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(name + " must be an ISO-8601 instant, got '" + value + "'");
        }
    }
}
