package orderedjson;

import java.util.Objects;

/**
 * A read-only key and value of an {@link OrderedMap}, produced for sorting and iteration. Not stored.
 *
 * @since 0.1.0
 */
public record Pair(String key, JsonValue value) {

    public Pair {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
