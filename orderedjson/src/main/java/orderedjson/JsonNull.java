package orderedjson;

/**
 * JSON {@code null}.
 *
 * @since 0.1.0
 */
public record JsonNull() implements JsonValue {
    @Override
    public String stringify() {
        return "null";
    }
}
