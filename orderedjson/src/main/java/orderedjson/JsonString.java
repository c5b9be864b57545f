package orderedjson;

import java.util.Objects;

/**
 * JSON string, held unescaped.
 *
 * @since 0.1.0
 */
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String stringify() {
        return OrderedJson.stringify(this);
    }
}
