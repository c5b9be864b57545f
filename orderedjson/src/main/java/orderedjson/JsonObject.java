package orderedjson;

import java.util.Map;

/**
 * Unordered JSON object, as produced by the typed pass of {@link OrderedJson.Decoder}.
 *
 * <p> Member order is not part of this value. Decoding replaces every {@code JsonObject} with an
 * {@link OrderedMap}; use this type only where order genuinely does not matter.
 *
 * @since 0.1.0
 */
public record JsonObject(Map<String, JsonValue> value) implements JsonValue {

    public JsonObject {
        value = Map.copyOf(value);
    }

    @Override
    public String stringify() {
        return OrderedJson.stringify(this);
    }
}
