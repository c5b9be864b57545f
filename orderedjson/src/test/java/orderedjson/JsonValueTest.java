package orderedjson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.math.BigInteger;
import java.net.URI;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;
import lombok.Data;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonValueTest {

    record RecordUser(String name, Integer age, List<String> tags) {}

    @Data
    static class ClassUser {
        private final String name;
        private final Integer age;
    }

    @Nested
    class FromJavaObject {

        @Test
        void scalars() {
            // @spotless:off
            var table = new Object[][] {
                    {null, "null"},
                    {"hello", "\"hello\""},
                    {'A', "\"A\""},
                    {true, "true"},
                    {42, "42"},
                    {42L, "42"},
                    {3.14, "3.14"},
                    {BigInteger.TEN, "10"},
                    {Optional.empty(), "null"},
                    {Optional.of("str"), "\"str\""},
                    {DayOfWeek.MONDAY, "\"MONDAY\""},
                    {LocalDate.parse("2024-01-01"), "\"2024-01-01\""},
                    {Instant.parse("2024-03-15T10:15:30Z"), "\"2024-03-15T10:15:30Z\""},
                    {Date.from(Instant.parse("2024-03-15T10:15:30Z")), "\"2024-03-15T10:15:30Z\""},
                    {UUID.fromString("550e8400-e29b-41d4-a716-446655440000"), "\"550e8400-e29b-41d4-a716-446655440000\""},
                    {URI.create("https://example.com"), "\"https://example.com\""},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                assertThat(JsonValue.from(row[0]).stringify())
                        .as("Case %d: input=%s", i, row[0])
                        .isEqualTo(row[1]);
            }));
        }

        @Test
        void containers() {
            var map = new LinkedHashMap<Object, Object>();
            map.put("z", List.of(1, 2));
            map.put(1, new int[] {3, 4});
            map.put("a", Set.of());

            // @spotless:off
            var table = new Object[][] {
                    {List.of(1, "1", false), "[1,\"1\",false]"},
                    {new String[] {"a", null}, "[\"a\",null]"},
                    {map, "{\"z\":[1,2],\"1\":[3,4],\"a\":[]}"},
                    {new RecordUser("Freeman", 25, List.of("x")), "{\"name\":\"Freeman\",\"age\":25,\"tags\":[\"x\"]}"},
                    {new ClassUser("Freeman", 25), "{\"age\":25,\"name\":\"Freeman\"}"},
                    {new Object(), "{}"},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                assertThat(JsonValue.from(row[0]).stringify())
                        .as("Case %d: input=%s", i, row[0])
                        .isEqualTo(row[1]);
            }));
        }

        @Test
        void mapsBecomeOrderedMaps() {
            var value = JsonValue.from(new RecordUser("Freeman", null, List.of()));

            assertThat(value).isInstanceOf(OrderedMap.class);
            var map = (OrderedMap) value;
            assertThat(map.keys()).containsExactly("name", "age", "tags");
            assertThat(map.get("age")).isEqualTo(new JsonNull());
        }

        @Test
        void jsonValuePassesThrough() {
            var value = new JsonString("same");

            assertThat(JsonValue.from(value)).isSameAs(value);
        }

        @Test
        void createdMapsUseGivenConfig() {
            var config = new OrderedMap.Config(false, true);

            var value = (OrderedMap) JsonValue.from(Map.of("k", Map.of()), config);

            assertThat(value.config()).isEqualTo(config);
            assertThat(((OrderedMap) value.get("k")).config()).isEqualTo(config);
        }

        @Test
        void selfContainingList_throws() {
            List<Object> list = new ArrayList<>();
            list.add(list);

            assertThatThrownBy(() -> JsonValue.from(list)).isInstanceOf(JsonException.DepthExceededException.class);
            assertThatThrownBy(() -> new OrderedMap().set("x", list))
                    .isInstanceOf(JsonException.DepthExceededException.class);
        }

        @Test
        void selfContainingMap_throws() {
            Map<String, Object> map = new HashMap<>();
            map.put("self", map);

            assertThatThrownBy(() -> JsonValue.from(map)).isInstanceOf(JsonException.DepthExceededException.class);
        }

        @Test
        void nestingLimit() {
            Object fits = 1;
            for (int i = 0; i < OrderedJson.DEFAULT_MAX_DEPTH; i++) fits = List.of(fits);
            Object tooDeep = List.of(fits);
            Object farTooDeep = 1;
            for (int i = 0; i < 200_000; i++) farTooDeep = List.of(farTooDeep);
            var deepest = farTooDeep;

            assertThat(JsonValue.from(fits)).isInstanceOf(JsonArray.class);
            assertThatThrownBy(() -> JsonValue.from(tooDeep))
                    .isInstanceOfSatisfying(
                            JsonException.DepthExceededException.class,
                            e -> assertThat(e.getMaxDepth()).isEqualTo(OrderedJson.DEFAULT_MAX_DEPTH));
            assertThatThrownBy(() -> new OrderedMap().set("x", deepest))
                    .isInstanceOf(JsonException.DepthExceededException.class);
        }
    }
}
