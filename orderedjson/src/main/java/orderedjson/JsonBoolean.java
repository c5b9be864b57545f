package orderedjson;

/**
 * JSON {@code true} or {@code false}.
 *
 * @since 0.1.0
 */
public record JsonBoolean(boolean value) implements JsonValue {
    @Override
    public String stringify() {
        return value ? "true" : "false";
    }
}
