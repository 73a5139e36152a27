package fmap.domain.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Lenient field access on Gson trees. Telemetry sends numbers as strings at times, and fields come and go
 * between firmware versions, so every reader returns empty instead of failing.
 * @since 15/10/2026
 */
final class JsonFields {
    private JsonFields() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    static Optional<String> string(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return Optional.empty();
        }
        return Optional.of(element.getAsString());
    }

    static OptionalInt integer(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return OptionalInt.empty();
        }
        return parseInt(element.getAsJsonPrimitive());
    }

    static OptionalDouble decimal(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(element.getAsString().trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    static OptionalInt parseInt(JsonPrimitive primitive) {
        try {
            if (primitive.isNumber()) {
                // Exact conversion: values outside the int range must not wrap around
                return OptionalInt.of(primitive.getAsBigDecimal().intValueExact());
            }
            return OptionalInt.of(Integer.parseInt(primitive.getAsString().trim()));
        } catch (NumberFormatException | ArithmeticException e) {
            return OptionalInt.empty();
        }
    }

    static JsonArray array(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        return element != null && element.isJsonArray() ? element.getAsJsonArray() : new JsonArray();
    }

    static Optional<JsonObject> object(JsonElement element) {
        return element != null && element.isJsonObject() ? Optional.of(element.getAsJsonObject()) : Optional.empty();
    }
}
