package orderedjson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

/**
 * Cross-checks decode/encode against Jackson's tree model.
 */
class JacksonTest {

    private static final JsonMapper jsonMapper = JsonMapper.builder().build();

    // @spotless:off
    private static final String[] documents = {
            "{}",
            "{\"b\":2,\"a\":1,\"c\":3}",
            "{\"name\":\"test\",\"percent\":6,\"breakdown\":[{\"name\":\"a\",\"percent\":0.9},{\"percent\":2.7,\"name\":\"e\"}]}",
            "{\"z\":{\"y\":{\"x\":[{\"w\":null,\"v\":true}]}},\"a\":[[],[{}],\"{not:an object}\"]}",
            "{\"html\":\"<script>&amp;</script>\",\"unicode\":\"\\u00e9\\ud83d\\ude00\",\"esc\":\"\\\"\\\\\\/\\b\\f\\n\\r\\t\"}",
            "{\"n\":-0.5,\"e\":1.5e-7,\"big\":123456789012345678901234567890,\"neg\":-42}",
    };
    // @spotless:on

    @Test
    void roundTripIsSemanticallyEqual() {
        assertAll(IntStream.range(0, documents.length).mapToObj(i -> () -> {
            var json = documents[i];
            var encoded = OrderedJson.encode(OrderedJson.decode(json));
            assertThat(jsonMapper.readTree(encoded))
                    .as("Case %d: json=%s", i, json)
                    .isEqualTo(jsonMapper.readTree(json));
        }));
    }

    @Test
    void memberOrderMatchesJackson() {
        assertAll(IntStream.range(0, documents.length).mapToObj(i -> () -> {
            var json = documents[i];
            var encoded = OrderedJson.encode(OrderedJson.decode(json));
            assertThat(fieldOrder(jsonMapper.readTree(encoded)))
                    .as("Case %d: json=%s", i, json)
                    .isEqualTo(fieldOrder(jsonMapper.readTree(json)));
        }));
    }

    @Test
    void jacksonReadsIndentedOutput() {
        var o = OrderedJson.decode(documents[3]);

        var indented = jsonMapper.readTree(OrderedJson.encodeIndent(o, "    "));

        assertThat(indented).isEqualTo(jsonMapper.readTree(documents[3]));
    }

    /**
     * Every object's member names, depth first, in iteration order.
     */
    private static List<String> fieldOrder(JsonNode node) {
        var names = new ArrayList<String>();
        collect(node, names);
        return names;
    }

    private static void collect(JsonNode node, List<String> names) {
        if (node.isObject()) {
            for (Map.Entry<String, JsonNode> e : node.properties()) {
                names.add(e.getKey());
                collect(e.getValue(), names);
            }
        } else if (node.isArray()) {
            for (JsonNode element : node) collect(element, names);
        }
    }
}
