package orderedjson;

import java.beans.Introspector;
import java.lang.reflect.Array;
import java.net.URI;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.SneakyThrows;
import org.jspecify.annotations.Nullable;

/**
 * A dynamically typed JSON value.
 *
 * <p> Objects come in two flavours: {@link OrderedMap}, which remembers member order and is what
 * decoding produces, and {@link JsonObject}, the unordered mapping of the typed pass.
 *
 * @since 0.1.0
 */
public sealed interface JsonValue
        permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString, OrderedMap {

    /**
     * @return compact JSON text of this value
     */
    String stringify();

    /**
     * Convert a plain Java value using {@link OrderedMap.Config#DEFAULT} for any map it creates.
     *
     * @see #from(Object, OrderedMap.Config)
     */
    static JsonValue from(@Nullable Object o) {
        return from(o, OrderedMap.Config.DEFAULT);
    }

    /**
     * Convert a plain Java value to a {@link JsonValue}.
     *
     * <p> {@link Map}s, records and beans become {@link OrderedMap}s created through {@code config}, so they
     * inherit the settings of the map they are stored in. Map order follows the map's iteration order, record
     * order follows component order, bean properties come in {@link Introspector} order.
     *
     * @param o      any value, may be {@code null}
     * @param config settings for the maps created along the way
     * @return the converted value, never {@code null}
     * @throws JsonException.DepthExceededException if containers nest deeper than
     *                                              {@link OrderedJson#DEFAULT_MAX_DEPTH}, which includes a
     *                                              container that reaches itself
     */
    static JsonValue from(@Nullable Object o, OrderedMap.Config config) {
        Objects.requireNonNull(config, "config");
        return from(o, config, 1);
    }

    @SneakyThrows
    private static JsonValue from(@Nullable Object o, OrderedMap.Config config, int depth) {
        // json null
        if (o == null) return new JsonNull();
        if (o instanceof JsonValue jsonValue) return jsonValue;
        if (o instanceof Optional<?> optional) return from(optional.orElse(null), config, depth);
        // json number
        if (o instanceof Number number) return new JsonNumber(number);
        // json string
        if (o instanceof CharSequence || o instanceof Character) return new JsonString(o.toString());
        if (o instanceof Enum<?> e) return new JsonString(e.name());
        if (o instanceof Date date) return new JsonString(date.toInstant().toString());
        if (o instanceof TemporalAccessor || o instanceof UUID || o instanceof URI) return new JsonString(o.toString());
        // json boolean
        if (o instanceof Boolean bool) return new JsonBoolean(bool);

        OrderedJson.checkDepth(depth, OrderedJson.DEFAULT_MAX_DEPTH);
        // json array
        if (o.getClass().isArray()) {
            int length = Array.getLength(o);
            var values = new ArrayList<JsonValue>(length);
            for (int i = 0; i < length; i++) {
                values.add(from(Array.get(o, i), config, depth + 1));
            }
            return new JsonArray(values);
        }
        if (o instanceof Iterable<?> iterable) {
            var values = new ArrayList<JsonValue>();
            for (var e : iterable) {
                values.add(from(e, config, depth + 1));
            }
            return new JsonArray(values);
        }
        // json object
        var object = config.newMap();
        if (o instanceof Map<?, ?> map) {
            for (var en : map.entrySet()) {
                object.put(String.valueOf(en.getKey()), from(en.getValue(), config, depth + 1));
            }
        } else if (o instanceof Record) {
            for (var c : o.getClass().getRecordComponents()) {
                object.put(c.getName(), from(c.getAccessor().invoke(o), config, depth + 1));
            }
        } else {
            var beanInfo = Introspector.getBeanInfo(o.getClass());
            for (var property : beanInfo.getPropertyDescriptors()) {
                if (Objects.equals(property.getName(), "class")) continue;
                var readMethod = property.getReadMethod();
                if (readMethod == null) continue;
                object.put(property.getName(), from(readMethod.invoke(o), config, depth + 1));
            }
        }
        return object;
    }
}
