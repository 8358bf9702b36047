package inspector.coordinator.model.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import inspector.coordinator.error.ValidationException;
import inspector.coordinator.model.TaskType;
import inspector.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Set;

/**
 * Converts the vision service's untagged result objects into typed payloads.
 * The variant is selected by task type, except that any object carrying a non-null
 * {@code error} field is a {@link ProcessingFailure}.
 *
 * <p>Binding is lenient: a known field whose value cannot be coerced to its declared type is
 * dropped (read back as null, or false for {@code has_smoke}) instead of rejecting the result.
 */
public final class ResultPayloads {

    private static final Logger log = LoggerFactory.getLogger(ResultPayloads.class);

    private static final Set<String> NUMBER_FIELDS = Set.of(
            "value", "min_range", "max_range", "confidence",
            "max_temperature", "avg_temperature", "ambient_temperature");
    private static final Set<String> TEXT_FIELDS = Set.of(
            "unit", "status", "density", "description", "error_code");

    private ResultPayloads() {
    }

    public static ResultPayload fromWire(TaskType taskType, JsonNode result) {
        if (result == null || result.isNull()) {
            throw new ValidationException("result is required");
        }
        if (!result.isObject()) {
            throw new ValidationException("result must be a JSON object");
        }

        ObjectNode tagged = ((ObjectNode) result).deepCopy();
        tagged.remove("kind");
        coerce(taskType, tagged);
        tagged.put("kind", kindFor(taskType, result));

        try {
            return Json.mapper().treeToValue(tagged, ResultPayload.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("malformed result for " + taskType.label() + ": " + e.getOriginalMessage());
        }
    }

    /** Serialize a payload with its discriminator, for storage */
    public static String toJson(ResultPayload payload) throws JsonProcessingException {
        return Json.mapper().writerFor(ResultPayload.class).writeValueAsString(payload);
    }

    /** Read a stored payload */
    public static ResultPayload fromJson(String json) throws JsonProcessingException {
        return Json.mapper().readValue(json, ResultPayload.class);
    }

    private static void coerce(TaskType taskType, ObjectNode node) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            JsonNode value = node.get(name);
            if (value.isNull()) {
                continue;
            }
            if (NUMBER_FIELDS.contains(name)) {
                Double number = toDouble(value);
                if (number == null) {
                    drop(taskType, name, value, names);
                } else {
                    node.put(name, number);
                }
            } else if (TEXT_FIELDS.contains(name)) {
                if (value.isContainerNode()) {
                    drop(taskType, name, value, names);
                } else {
                    node.put(name, value.asText());
                }
            } else if ("error".equals(name)) {
                node.put(name, value.isContainerNode() ? value.toString() : value.asText());
            } else if ("has_smoke".equals(name)) {
                Boolean flag = toBoolean(value);
                if (flag == null) {
                    drop(taskType, name, value, names);
                } else {
                    node.put(name, flag);
                }
            } else if ("items".equals(name)) {
                if (!value.isArray()) {
                    drop(taskType, name, value, names);
                } else {
                    ArrayNode scalars = node.arrayNode();
                    value.forEach(item -> {
                        if (item.isValueNode() && !item.isNull()) {
                            scalars.add(item.asText());
                        }
                    });
                    node.set(name, scalars);
                }
            }
        }
    }

    private static void drop(TaskType taskType, String name, JsonNode value, Iterator<String> names) {
        log.warn("Ignoring {}={} in {} result", name, value, taskType.label());
        names.remove();
    }

    private static Double toDouble(JsonNode value) {
        double number;
        if (value.isNumber()) {
            number = value.doubleValue();
        } else if (value.isTextual()) {
            try {
                number = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(number) ? number : null;
    }

    private static Boolean toBoolean(JsonNode value) {
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    private static String kindFor(TaskType taskType, JsonNode result) {
        JsonNode error = result.get("error");
        if (error != null && !error.isNull()) {
            return "failure";
        }
        return switch (taskType) {
            case GAUGE_READING -> "gauge_reading";
            case TEMPERATURE -> "temperature";
            case SMOKE_A, SMOKE_B -> "smoke";
            case OBJECT_DESCRIPTION -> "object_description";
        };
    }
}
