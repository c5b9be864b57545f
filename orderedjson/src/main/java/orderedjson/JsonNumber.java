package orderedjson;

import java.util.Objects;

public record JsonNumber(Number value) implements JsonValue {

    public JsonNumber {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String stringify() {
        return OrderedJson.stringify(this);
    }
}
