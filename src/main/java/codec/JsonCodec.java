package codec;

import org.json.simple.JSONValue;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON serialization of headers and claim sets, backed by json-simple.
 * Decoded objects are {@code JSONObject} (a {@code HashMap}); integral numbers
 * come back as {@code Long} and the rest as {@code Double}.
 */
public final class JsonCodec {

    private JsonCodec() {}

    /**
     * Serializes a JSON object.
     *
     * @param object String-keyed map whose values are JSON representable.
     * @return the JSON text, or empty if some value cannot be written as JSON.
     */
    public static Optional<String> encode(Map<String, ?> object) {
        if (!isJsonValue(object)) {
            return Optional.empty();
        }
        return Optional.of(JSONValue.toJSONString(object));
    }

    /**
     * Parses JSON text that must hold an object at the top level.
     *
     * @return the parsed object, or empty on malformed JSON or a non-object document.
     */
    @SuppressWarnings("unchecked")
    public static Optional<Map<String, Object>> decodeObject(String json) {
        try {
            // JSONParser keeps lexer state, so one per call
            Object parsed = new JSONParser().parse(json);
            if (parsed instanceof Map) {
                return Optional.of((Map<String, Object>) parsed);
            }
            return Optional.empty();
        } catch (ParseException | RuntimeException e) {
            return Optional.empty();
        }
    }

    /**
     * json-simple writes unknown types with {@code toString()}, which yields broken
     * JSON, so values are checked before serialization.
     */
    static boolean isJsonValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isNaN(d) && !Double.isInfinite(d);
        }
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String) || !isJsonValue(entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                if (!isJsonValue(element)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
