package orderedjson;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A JSON object that remembers the order of its members.
 *
 * <p> Keys are kept in insertion order, or in document order for a decoded map, until explicitly
 * reordered with {@link #sortKeys(Comparator)} or {@link #sort(Comparator)}. Overwriting a key keeps its
 * position; deleting a key keeps the relative order of the others.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * OrderedMap map = OrderedJson.decode("{\"b\":2,\"a\":1}");
 * map.set("b", 3);
 * map.set("c", List.of(1, 2));
 * OrderedJson.encode(map);
 * // -> {"b":3,"a":1,"c":[1,2]}
 * }</pre>
 *
 * <p> Nested objects are {@code OrderedMap}s owned by their parent. Instances are not thread-safe;
 * callers sharing one across threads must synchronize externally.
 *
 * @since 0.1.0
 */
public final class OrderedMap implements JsonValue, Iterable<Pair> {

    private final List<String> keys;
    private final Map<String, JsonValue> values;
    private Config config;

    /**
     * Create an empty map with {@link Config#DEFAULT} settings.
     */
    public OrderedMap() {
        this(Config.DEFAULT);
    }

    OrderedMap(Config config) {
        this.config = Objects.requireNonNull(config, "config");
        this.keys = new ArrayList<>();
        this.values = new HashMap<>();
    }

    // ============================================================
    // Configuration
    // ============================================================

    /**
     * Per-map settings, handed down to every nested map created on this map's behalf.
     *
     * @param escapeHtml         escape {@code <}, {@code >} and {@code &} when encoding
     * @param allowDuplicateKeys tolerate repeated keys when decoding (last value wins, first position kept)
     *                           instead of failing with {@link JsonException.DuplicateKeyException}
     */
    public record Config(boolean escapeHtml, boolean allowDuplicateKeys) {

        public static final Config DEFAULT = new Config(true, false);

        /**
         * The single factory for maps: decoding and value conversion create every map, root or nested, here.
         */
        public OrderedMap newMap() {
            return new OrderedMap(this);
        }

        public Config withEscapeHtml(boolean escapeHtml) {
            return new Config(escapeHtml, allowDuplicateKeys);
        }

        public Config withAllowDuplicateKeys(boolean allowDuplicateKeys) {
            return new Config(escapeHtml, allowDuplicateKeys);
        }
    }

    public Config config() {
        return config;
    }

    /**
     * Only affects this map and maps created for it from now on; existing children keep their settings.
     */
    public void setEscapeHtml(boolean escapeHtml) {
        this.config = config.withEscapeHtml(escapeHtml);
    }

    public void setAllowDuplicateKeys(boolean allowDuplicateKeys) {
        this.config = config.withAllowDuplicateKeys(allowDuplicateKeys);
    }

    // ============================================================
    // Mutation
    // ============================================================

    /**
     * @param key member name
     * @return the value, or {@code null} if absent; a JSON null is a {@link JsonNull}
     */
    public @Nullable JsonValue get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * Set a member. A new key goes to the end, an existing key keeps its position.
     *
     * <p> Plain Java values are converted with {@link JsonValue#from(Object, Config)} using this map's settings.
     *
     * @param key   member name, not {@code null}
     * @param value any value, {@code null} meaning JSON null
     * @throws IllegalArgumentException             if {@code value} is this map or holds it at any depth
     * @throws JsonException.DepthExceededException if {@code value} nests too deep or reaches itself
     */
    public void set(String key, @Nullable Object value) {
        Objects.requireNonNull(key, "key");
        var jsonValue = JsonValue.from(value, config);
        if (reaches(jsonValue, this)) throw new IllegalArgumentException("An OrderedMap cannot contain itself");
        put(key, jsonValue);
    }

    /**
     * Store an already converted value that is known not to hold this map.
     */
    void put(String key, JsonValue value) {
        if (values.put(key, value) == null) keys.add(key);
    }

    /**
     * Identity search for {@code target} anywhere inside {@code value}. Iterative so that deep trees built
     * by hand cannot overflow the stack.
     */
    private static boolean reaches(JsonValue value, OrderedMap target) {
        Deque<JsonValue> pending = new ArrayDeque<>();
        Set<JsonValue> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        pending.push(value);
        while (!pending.isEmpty()) {
            var v = pending.pop();
            if (v == target) return true;
            if (!seen.add(v)) continue;
            if (v instanceof OrderedMap m) m.values.values().forEach(pending::push);
            else if (v instanceof JsonArray a) a.value().forEach(pending::push);
            else if (v instanceof JsonObject o) o.value().values().forEach(pending::push);
        }
        return false;
    }

    /**
     * Remove a member, keeping the order of the others.
     *
     * @return {@code true} if the key was present
     */
    public boolean delete(String key) {
        if (!values.containsKey(key)) return false;
        keys.remove(key);
        values.remove(key);
        return true;
    }

    /**
     * @return read-only live view of the keys in order
     */
    public List<String> keys() {
        return Collections.unmodifiableList(keys);
    }

    /**
     * @return read-only live view of the key to value mapping; its iteration order is unspecified
     */
    public Map<String, JsonValue> values() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * Replace the contents of this map with a decoded document, using this map's settings.
     * On failure the map is left untouched.
     *
     * @param json JSON text holding an object
     */
    public void readJson(String json) {
        var decoded = OrderedJson.Decoder.of(config).decode(json);
        keys.clear();
        values.clear();
        keys.addAll(decoded.keys);
        values.putAll(decoded.values);
    }

    // ============================================================
    // Sorting
    // ============================================================

    /**
     * Reorder keys by comparing key names only.
     */
    public void sortKeys(Comparator<? super String> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        keys.sort(comparator);
    }

    /**
     * Reorder keys by comparing key and value pairs. The sort is stable: pairs that compare equal keep
     * their current relative order. Values are not touched.
     */
    public void sort(Comparator<? super Pair> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        var pairs = new ArrayList<Pair>(keys.size());
        for (var key : keys) {
            pairs.add(new Pair(key, values.get(key)));
        }
        pairs.sort(comparator);
        for (int i = 0; i < pairs.size(); i++) {
            keys.set(i, pairs.get(i).key());
        }
    }

    // ============================================================
    // Iteration
    // ============================================================

    @Override
    public Iterator<Pair> iterator() {
        return pairs();
    }

    public PairIterator pairs() {
        return new PairIterator(this);
    }

    public ValueIterator valueIterator() {
        return new ValueIterator(this);
    }

    /**
     * Forward-only iterator over the pairs, backed by the live map. Modifying the map while iterating
     * is not supported.
     */
    public static final class PairIterator implements Iterator<Pair> {
        private final OrderedMap map;
        private final int length;
        private int index;

        PairIterator(OrderedMap map) {
            this.map = map;
            this.length = map.keys.size();
        }

        public int index() {
            return index;
        }

        public int length() {
            return length;
        }

        @Override
        public boolean hasNext() {
            return index < length;
        }

        @Override
        public Pair next() {
            if (!hasNext()) throw new NoSuchElementException();
            var key = map.keys.get(index++);
            return new Pair(key, map.values.get(key));
        }
    }

    /**
     * Forward-only iterator over the values in key order, backed by the live map.
     */
    public static final class ValueIterator implements Iterator<JsonValue> {
        private final OrderedMap map;
        private final int length;
        private int index;

        ValueIterator(OrderedMap map) {
            this.map = map;
            this.length = map.keys.size();
        }

        public int index() {
            return index;
        }

        public int length() {
            return length;
        }

        @Override
        public boolean hasNext() {
            return index < length;
        }

        @Override
        public JsonValue next() {
            if (!hasNext()) throw new NoSuchElementException();
            return map.values.get(map.keys.get(index++));
        }
    }

    // ============================================================
    // Object
    // ============================================================

    @Override
    public String stringify() {
        return OrderedJson.encode(this);
    }

    /**
     * Equal when both maps hold equal values under the same keys in the same order. Settings are ignored.
     */
    @Override
    public boolean equals(Object o) {
        return o instanceof OrderedMap m && keys.equals(m.keys) && values.equals(m.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, values);
    }

    @Override
    public String toString() {
        return stringify();
    }
}
