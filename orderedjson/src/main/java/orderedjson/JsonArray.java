package orderedjson;

import java.util.List;

/**
 * JSON array. Elements are kept in document order; the list is immutable.
 *
 * @since 0.1.0
 */
public record JsonArray(List<JsonValue> value) implements JsonValue {

    public JsonArray {
        value = List.copyOf(value);
    }

    @Override
    public String stringify() {
        return OrderedJson.stringify(this);
    }
}
