package orderedjson;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * Order-preserving JSON decoder and encoder.
 *
 * <p> Decoding runs in two passes over the same text: a typed pass that parses every value into the
 * dynamic {@link JsonValue} model without caring about member order, then an order pass that walks
 * the token stream again, records keys in document order and re-wraps every nested object as an
 * {@link OrderedMap}. With the default strict policy a duplicate-key scan runs first.
 */
@Slf4j
public final class OrderedJson {

    /**
     * Default nesting limit for decoding and encoding.
     */
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final Encoder defaultEncoder = Encoder.builder().build();
    private static final Decoder defaultDecoder = Decoder.builder().build();

    private OrderedJson() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Decode a JSON object, keeping member order at every level.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * OrderedMap map = OrderedJson.decode("{\"b\":2,\"a\":{\"z\":1,\"y\":2}}");
     * map.keys();
     * // -> [b, a]
     * }</pre>
     *
     * @param json JSON text holding an object, not {@code null}
     * @return a fresh map
     * @throws JsonException.ParseException        if the text is not valid JSON
     * @throws JsonException.TypeMismatchException if the top-level value is not an object
     * @throws JsonException.DuplicateKeyException if any object repeats a key
     */
    public static OrderedMap decode(String json) {
        return defaultDecoder.decode(json);
    }

    /**
     * Decode UTF-8 encoded JSON.
     *
     * @see #decode(String)
     */
    public static OrderedMap decode(byte[] json) {
        return defaultDecoder.decode(json);
    }

    /**
     * Encode a map in compact form, members in stored order.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * OrderedMap map = new OrderedMap();
     * map.set("z", 1);
     * map.set("a", "<b>");
     * OrderedJson.encode(map);
     * // -> {"z":1,"a":"<b>"}
     * }</pre>
     *
     * @param map map to encode, not {@code null}
     * @return non-null JSON text
     */
    public static String encode(OrderedMap map) {
        return defaultEncoder.encode(map);
    }

    /**
     * Encode a map with one member per line, each level indented by {@code indent}.
     */
    public static String encodeIndent(OrderedMap map, String indent) {
        Objects.requireNonNull(indent, "indent");
        return defaultEncoder.toBuilder().indent(indent).build().encode(map);
    }

    /**
     * Write any value in compact form.
     */
    public static String stringify(JsonValue value) {
        return defaultEncoder.write(value);
    }

    /**
     * Parse any JSON value into the dynamic model without order tracking; objects come back as
     * {@link JsonObject}. Duplicate keys resolve to the last value.
     */
    public static JsonValue parseValue(String json) {
        Objects.requireNonNull(json, "json");
        var lexer = new Lexer(json);
        var value = new Parser(DEFAULT_MAX_DEPTH).parseValue(lexer, 1);
        Parser.expectEnd(lexer);
        return value;
    }

    /**
     * Scan a document for objects that repeat a key, without building any value.
     *
     * @throws JsonException.DuplicateKeyException naming the first repeated key and where it is
     */
    public static void checkDuplicates(String json) {
        Objects.requireNonNull(json, "json");
        new DuplicateKeyChecker(DEFAULT_MAX_DEPTH).check(new Lexer(json));
    }

    // ============================================================
    // Lexer
    // ============================================================

    enum Token {
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        COLON,
        COMMA,
        STRING,
        NUMBER,
        TRUE,
        FALSE,
        NULL,
        EOF
    }

    /**
     * Token stream over JSON text. {@link #current()} is the token under the cursor; {@link #advance()}
     * moves to the next one. No tree is built.
     */
    static final class Lexer {
        private static final String HEX_DIGITS = "0123456789abcdef";

        private final String s;
        private int i = 0, line = 1, col = 1;
        private int tokenLine = 1, tokenCol = 1;
        private Token current;
        private String stringValue, numberLexeme;

        Lexer(String s) {
            this.s = Objects.requireNonNull(s);
            advance();
        }

        Token current() {
            return current;
        }

        String string() {
            return stringValue;
        }

        String number() {
            return numberLexeme;
        }

        /**
         * @return line where the current token starts
         */
        int line() {
            return tokenLine;
        }

        /**
         * @return column where the current token starts
         */
        int col() {
            return tokenCol;
        }

        void advance() {
            skipWs();
            tokenLine = line;
            tokenCol = col;
            if (eof()) {
                current = Token.EOF;
                return;
            }
            char c = peek();
            switch (c) {
                case '{' -> {
                    consume();
                    current = Token.LBRACE;
                }
                case '}' -> {
                    consume();
                    current = Token.RBRACE;
                }
                case '[' -> {
                    consume();
                    current = Token.LBRACKET;
                }
                case ']' -> {
                    consume();
                    current = Token.RBRACKET;
                }
                case ':' -> {
                    consume();
                    current = Token.COLON;
                }
                case ',' -> {
                    consume();
                    current = Token.COMMA;
                }
                case '"' -> {
                    stringValue = readString();
                    current = Token.STRING;
                }
                case 't' -> {
                    readKeyword("true");
                    current = Token.TRUE;
                }
                case 'f' -> {
                    readKeyword("false");
                    current = Token.FALSE;
                }
                case 'n' -> {
                    readKeyword("null");
                    current = Token.NULL;
                }
                default -> {
                    if (c == '-' || isDigit(c)) {
                        numberLexeme = readNumber();
                        current = Token.NUMBER;
                    } else throw error("Unexpected character '" + c + "'");
                }
            }
        }

        private void skipWs() {
            for (; !eof(); consume()) {
                char c = peek();
                if (c == '\n') {
                    // consume() moves col past the newline, reset it afterwards
                    line++;
                    col = 0;
                } else if (c != ' ' && c != '\t' && c != '\r') {
                    return;
                }
            }
        }

        private String readString() {
            consume();
            var sb = new StringBuilder();
            while (!eof()) {
                char c = consume();
                if (c == '"') return sb.toString();
                if (c < 0x20) throw error("Control character U+%04X must be escaped".formatted((int) c));
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (eof()) throw error("Input ends inside an escape sequence");
                char e = consume();
                switch (e) {
                    case '"', '\\', '/' -> sb.append(e);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> readUnicodeEscape(sb);
                    default -> throw error("Unknown escape sequence \\" + e);
                }
            }
            throw error("String is not closed before end of input");
        }

        /**
         * Appends the code unit of a unicode escape whose four hex digits come next. A high surrogate must be
         * directly followed by an escaped low surrogate.
         */
        private void readUnicodeEscape(StringBuilder sb) {
            char unit = readHex4();
            if (Character.isLowSurrogate(unit)) {
                throw error("Low surrogate \\u%04x has no high surrogate".formatted((int) unit));
            }
            sb.append(unit);
            if (!Character.isHighSurrogate(unit)) return;
            if (!s.startsWith("\\u", i)) {
                throw error("High surrogate \\u%04x is not followed by \\u".formatted((int) unit));
            }
            consume();
            consume();
            char low = readHex4();
            if (!Character.isLowSurrogate(low)) throw error("\\u%04x is not a low surrogate".formatted((int) low));
            sb.append(low);
        }

        private char readHex4() {
            if (i + 4 > s.length()) throw error("Input ends inside a \\u escape");
            int unit = 0;
            for (int k = 0; k < 4; k++) {
                char c = consume();
                int digit = c <= 'f' ? HEX_DIGITS.indexOf(Character.toLowerCase(c)) : -1;
                if (digit < 0) throw error("'" + c + "' is not a hex digit");
                unit = unit * 16 + digit;
            }
            return (char) unit;
        }

        private void readKeyword(String keyword) {
            if (!s.startsWith(keyword, i)) throw error("Expected literal " + keyword);
            for (int k = 0; k < keyword.length(); k++) consume();
        }

        /**
         * Consumes {@code -? int frac? exp?} and returns its text; conversion happens in the parser.
         */
        private String readNumber() {
            int start = i;
            if (peek() == '-') consume();
            if (eof() || !isDigit(peek())) throw error("Number needs a digit after '-'");
            if (consume() != '0') skipDigits();
            if (!eof() && peek() == '.') {
                consume();
                if (eof() || !isDigit(peek())) throw error("Number needs a digit after '.'");
                skipDigits();
            }
            if (!eof() && (peek() == 'e' || peek() == 'E')) {
                consume();
                if (!eof() && (peek() == '+' || peek() == '-')) consume();
                if (eof() || !isDigit(peek())) throw error("Number needs a digit in the exponent");
                skipDigits();
            }
            return s.substring(start, i);
        }

        private void skipDigits() {
            while (!eof() && isDigit(peek())) consume();
        }

        private boolean eof() {
            return i >= s.length();
        }

        private char peek() {
            return s.charAt(i);
        }

        private char consume() {
            col++;
            return s.charAt(i++);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        /**
         * Lexical errors report the position reached in the text, not the token start.
         */
        private JsonException.ParseException error(String msg) {
            return new JsonException.ParseException(msg, line, col);
        }
    }

    // ============================================================
    // Parser (typed pass)
    // ============================================================

    /**
     * Builds dynamic values from the token stream. Objects become unordered {@link JsonObject}s and a
     * repeated key keeps its last value.
     */
    static final class Parser {

        private final int maxDepth;

        Parser(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        JsonValue parseValue(Lexer lexer, int depth) {
            return switch (lexer.current()) {
                case LBRACE -> parseObject(lexer, depth);
                case LBRACKET -> parseArray(lexer, depth);
                case STRING -> {
                    String s = lexer.string();
                    lexer.advance();
                    yield new JsonString(s);
                }
                case NUMBER -> {
                    String n = lexer.number();
                    lexer.advance();
                    yield new JsonNumber(parseNumber(n));
                }
                case TRUE -> {
                    lexer.advance();
                    yield new JsonBoolean(true);
                }
                case FALSE -> {
                    lexer.advance();
                    yield new JsonBoolean(false);
                }
                case NULL -> {
                    lexer.advance();
                    yield new JsonNull();
                }
                case RBRACE, RBRACKET, COMMA, COLON -> throw error(lexer, "Unexpected token: " + lexer.current());
                case EOF -> throw error(lexer, "Unexpected end of input while expecting a value");
            };
        }

        private JsonObject parseObject(Lexer lexer, int depth) {
            checkDepth(depth, maxDepth);
            expect(lexer, Token.LBRACE);
            Map<String, JsonValue> m = new HashMap<>();
            if (accept(lexer, Token.RBRACE)) return new JsonObject(m);
            while (true) {
                if (lexer.current() != Token.STRING) throw error(lexer, "Expected string key in object");
                String key = lexer.string();
                lexer.advance();
                expect(lexer, Token.COLON);
                m.put(key, parseValue(lexer, depth + 1));
                if (accept(lexer, Token.COMMA)) continue;
                if (accept(lexer, Token.RBRACE)) break;
                throw error(lexer, "Expected ',' or '}' in object");
            }
            return new JsonObject(m);
        }

        private JsonArray parseArray(Lexer lexer, int depth) {
            checkDepth(depth, maxDepth);
            expect(lexer, Token.LBRACKET);
            List<JsonValue> list = new ArrayList<>();
            if (accept(lexer, Token.RBRACKET)) return new JsonArray(list);
            while (true) {
                list.add(parseValue(lexer, depth + 1));
                if (accept(lexer, Token.COMMA)) continue;
                if (accept(lexer, Token.RBRACKET)) break;
                throw error(lexer, "Expected ',' or ']' in array");
            }
            return new JsonArray(list);
        }

        static void expect(Lexer lexer, Token t) {
            if (lexer.current() != t) throw error(lexer, "Expected " + t + " but found " + lexer.current());
            lexer.advance();
        }

        static boolean accept(Lexer lexer, Token t) {
            if (lexer.current() == t) {
                lexer.advance();
                return true;
            }
            return false;
        }

        static void expectEnd(Lexer lexer) {
            if (lexer.current() != Token.EOF) throw error(lexer, "Trailing characters after top-level value");
        }

        static JsonException.ParseException error(Lexer lexer, String msg) {
            return new JsonException.ParseException(
                    msg + " (token: " + lexer.current() + ")", lexer.line(), lexer.col());
        }

        static Number parseNumber(String s) {
            BigDecimal b = new BigDecimal(s), n = b.stripTrailingZeros();
            // BigDecimal has no negative zero
            if (b.signum() == 0 && s.charAt(0) == '-') return -0.0;
            if (n.scale() <= 0) {
                try {
                    long l = n.longValueExact();
                    if ((int) l == l) return (int) l; // Do NOT use Ternary Operator here!
                    return l;
                } catch (ArithmeticException e) {
                    return n.toBigIntegerExact();
                }
            } else {
                double d = b.doubleValue();
                return Double.isFinite(d) && b.compareTo(BigDecimal.valueOf(d)) == 0 ? d : b;
            }
        }
    }

    // ============================================================
    // Duplicate key check
    // ============================================================

    /**
     * Walks the whole token stream, remembering the keys of each object, and fails on the first repeat.
     * Arrays are walked element by element. Nothing is built.
     */
    static final class DuplicateKeyChecker {

        private final int maxDepth;

        DuplicateKeyChecker(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        void check(Lexer lexer) {
            checkValue(lexer, null, 1);
            Parser.expectEnd(lexer);
        }

        private void checkValue(Lexer lexer, @Nullable Step at, int depth) {
            switch (lexer.current()) {
                case LBRACE -> checkObject(lexer, at, depth);
                case LBRACKET -> checkArray(lexer, at, depth);
                case STRING, NUMBER, TRUE, FALSE, NULL -> lexer.advance();
                case EOF -> throw Parser.error(lexer, "Unexpected end of input while expecting a value");
                default -> throw Parser.error(lexer, "Unexpected token: " + lexer.current());
            }
        }

        private void checkObject(Lexer lexer, @Nullable Step at, int depth) {
            checkDepth(depth, maxDepth);
            Parser.expect(lexer, Token.LBRACE);
            if (Parser.accept(lexer, Token.RBRACE)) return;
            Set<String> seen = new HashSet<>();
            while (true) {
                if (lexer.current() != Token.STRING) throw Parser.error(lexer, "Expected string key in object");
                String key = lexer.string();
                if (!seen.add(key)) throw new JsonException.DuplicateKeyException(key, Step.render(at));
                lexer.advance();
                Parser.expect(lexer, Token.COLON);
                checkValue(lexer, new Step(at, key, -1), depth + 1);
                if (Parser.accept(lexer, Token.COMMA)) continue;
                if (Parser.accept(lexer, Token.RBRACE)) return;
                throw Parser.error(lexer, "Expected ',' or '}' in object");
            }
        }

        private void checkArray(Lexer lexer, @Nullable Step at, int depth) {
            checkDepth(depth, maxDepth);
            Parser.expect(lexer, Token.LBRACKET);
            if (Parser.accept(lexer, Token.RBRACKET)) return;
            for (int index = 0; ; index++) {
                checkValue(lexer, new Step(at, null, index), depth + 1);
                if (Parser.accept(lexer, Token.COMMA)) continue;
                if (Parser.accept(lexer, Token.RBRACKET)) return;
                throw Parser.error(lexer, "Expected ',' or ']' in array");
            }
        }

        /**
         * One member or element step below the root. Only turned into text when a duplicate is reported.
         */
        private record Step(@Nullable Step parent, @Nullable String key, int index) {

            /**
             * {@code $} for the root, {@code .name} for identifier-like keys, {@code ["a.b"]} for any other
             * key and {@code [0]} for array elements.
             */
            static String render(@Nullable Step step) {
                var steps = new ArrayList<Step>();
                for (var s = step; s != null; s = s.parent) steps.add(s);
                var out = new StringBuilder("$");
                for (int i = steps.size() - 1; i >= 0; i--) {
                    var s = steps.get(i);
                    if (s.key == null) out.append('[').append(s.index).append(']');
                    else if (isPlain(s.key)) out.append('.').append(s.key);
                    else {
                        out.append('[');
                        Encoder.writeString(out, s.key, false);
                        out.append(']');
                    }
                }
                return out.toString();
            }

            private static boolean isPlain(String key) {
                if (key.isEmpty() || Character.isDigit(key.charAt(0))) return false;
                for (int i = 0; i < key.length(); i++) {
                    char c = key.charAt(i);
                    if (!Character.isLetterOrDigit(c) && c != '_') return false;
                }
                return true;
            }
        }
    }

    // ============================================================
    // Decoder (order pass)
    // ============================================================

    /**
     * Decodes JSON objects into {@link OrderedMap}s. Immutable and safe to share.
     *
     * <p> With {@code allowDuplicateKeys} a repeated key keeps the position of its first occurrence and
     * the value of its last.
     */
    @Builder(toBuilder = true)
    public static final class Decoder {

        @Builder.Default
        private final boolean escapeHtml = true;

        @Builder.Default
        private final boolean allowDuplicateKeys = false;

        @Builder.Default
        private final int maxDepth = DEFAULT_MAX_DEPTH;

        /**
         * A decoder whose maps carry the given settings.
         */
        public static Decoder of(OrderedMap.Config config) {
            return builder()
                    .escapeHtml(config.escapeHtml())
                    .allowDuplicateKeys(config.allowDuplicateKeys())
                    .build();
        }

        public OrderedMap.Config config() {
            return new OrderedMap.Config(escapeHtml, allowDuplicateKeys);
        }

        public OrderedMap decode(byte[] json) {
            Objects.requireNonNull(json, "json");
            return decode(new String(json, StandardCharsets.UTF_8));
        }

        public OrderedMap decode(String json) {
            Objects.requireNonNull(json, "json");
            if (!allowDuplicateKeys) new DuplicateKeyChecker(maxDepth).check(new Lexer(json));

            var typedLexer = new Lexer(json);
            var typed = new Parser(maxDepth).parseValue(typedLexer, 1);
            Parser.expectEnd(typedLexer);
            if (!(typed instanceof JsonObject root)) {
                throw new JsonException.TypeMismatchException("object", kindOf(typed));
            }

            var result = config().newMap();
            readObject(new Lexer(json), root, result, 1);
            return result;
        }

        /**
         * Walk the members of one object in document order. {@code typed} is the typed-pass value of the
         * same object; keys it does not hold belong to a superseded duplicate and are skipped.
         */
        private void readObject(Lexer lexer, JsonObject typed, OrderedMap target, int depth) {
            checkDepth(depth, maxDepth);
            Parser.expect(lexer, Token.LBRACE);
            if (Parser.accept(lexer, Token.RBRACE)) return;
            while (true) {
                String key = lexer.string();
                lexer.advance();
                Parser.expect(lexer, Token.COLON);
                var value = readValue(lexer, typed.value().get(key), target.config(), depth);
                if (value != null) {
                    if (target.containsKey(key)) log.debug("Duplicate key \"{}\" tolerated, last value wins", key);
                    target.put(key, value);
                }
                if (Parser.accept(lexer, Token.COMMA)) continue;
                Parser.expect(lexer, Token.RBRACE);
                return;
            }
        }

        private JsonArray readArray(Lexer lexer, JsonArray typed, OrderedMap.Config config, int depth) {
            checkDepth(depth, maxDepth);
            Parser.expect(lexer, Token.LBRACKET);
            var elements = new ArrayList<>(typed.value());
            if (Parser.accept(lexer, Token.RBRACKET)) return new JsonArray(elements);
            for (int index = 0; ; index++) {
                var element = readValue(lexer, index < elements.size() ? elements.get(index) : null, config, depth);
                if (element != null) elements.set(index, element);
                if (Parser.accept(lexer, Token.COMMA)) continue;
                Parser.expect(lexer, Token.RBRACKET);
                return new JsonArray(elements);
            }
        }

        /**
         * Read the value under the cursor, re-wrapping objects with order. Where the tokens do not match the
         * typed value the tokens are skipped and the typed value is returned as is.
         */
        private @Nullable JsonValue readValue(
                Lexer lexer, @Nullable JsonValue typed, OrderedMap.Config config, int depth) {
            switch (lexer.current()) {
                case LBRACE -> {
                    if (typed instanceof JsonObject object) {
                        var child = config.newMap();
                        readObject(lexer, object, child, depth + 1);
                        return child;
                    }
                    skipValue(lexer);
                    return typed;
                }
                case LBRACKET -> {
                    if (typed instanceof JsonArray array) return readArray(lexer, array, config, depth + 1);
                    skipValue(lexer);
                    return typed;
                }
                default -> {
                    lexer.advance();
                    return typed;
                }
            }
        }

        private static void skipValue(Lexer lexer) {
            int nesting = 0;
            do {
                switch (lexer.current()) {
                    case LBRACE, LBRACKET -> nesting++;
                    case RBRACE, RBRACKET -> nesting--;
                    case EOF -> throw Parser.error(lexer, "Unexpected end of input while skipping a value");
                    default -> {}
                }
                lexer.advance();
            } while (nesting > 0);
        }
    }

    // ============================================================
    // Encoder
    // ============================================================

    /**
     * Encodes {@link OrderedMap}s and other values. Immutable and safe to share.
     *
     * <p> HTML escaping is taken from each map's own {@link OrderedMap.Config}; values that are not maps use the
     * setting of the map that holds them.
     */
    @Builder(toBuilder = true)
    public static final class Encoder {

        /**
         * Indentation per level; empty for compact output.
         */
        @Builder.Default
        private final String indent = "";

        @Builder.Default
        private final int maxDepth = DEFAULT_MAX_DEPTH;

        public String encode(OrderedMap map) {
            Objects.requireNonNull(map, "map");
            var sb = new StringBuilder();
            writeOrderedMap(sb, map, 1);
            return sb.toString();
        }

        public byte[] encodeToBytes(OrderedMap map) {
            return encode(map).getBytes(StandardCharsets.UTF_8);
        }

        public String write(JsonValue value) {
            Objects.requireNonNull(value, "value");
            var sb = new StringBuilder();
            writeValue(sb, value, true, 1);
            return sb.toString();
        }

        void writeValue(StringBuilder out, JsonValue v, boolean escapeHtml, int depth) {
            if (v instanceof JsonNull) {
                out.append("null");
                return;
            }
            if (v instanceof JsonBoolean b) {
                out.append(b.value() ? "true" : "false");
                return;
            }
            if (v instanceof JsonNumber n) {
                writeNumber(out, n.value());
                return;
            }
            if (v instanceof JsonString s) {
                writeString(out, s.value(), escapeHtml);
                return;
            }
            if (v instanceof OrderedMap m) {
                writeOrderedMap(out, m, depth);
                return;
            }
            if (v instanceof JsonArray a) {
                checkDepth(depth, maxDepth);
                List<JsonValue> vs = a.value();
                if (vs.isEmpty()) {
                    out.append("[]");
                    return;
                }
                out.append('[');
                for (int i = 0; i < vs.size(); i++) {
                    if (i > 0) out.append(',');
                    newline(out, depth);
                    writeValue(out, vs.get(i), escapeHtml, depth + 1);
                }
                newline(out, depth - 1);
                out.append(']');
                return;
            }
            if (v instanceof JsonObject o) {
                checkDepth(depth, maxDepth);
                if (o.value().isEmpty()) {
                    out.append("{}");
                    return;
                }
                out.append('{');
                boolean first = true;
                for (var en : o.value().entrySet()) {
                    if (!first) out.append(',');
                    first = false;
                    newline(out, depth);
                    writeMember(out, en.getKey(), en.getValue(), escapeHtml, depth);
                }
                newline(out, depth - 1);
                out.append('}');
                return;
            }
            throw new JsonException.WriteException("Unknown JsonValue type: " + v.getClass());
        }

        private void writeOrderedMap(StringBuilder out, OrderedMap map, int depth) {
            checkDepth(depth, maxDepth);
            if (map.isEmpty()) {
                out.append("{}");
                return;
            }
            boolean escapeHtml = map.config().escapeHtml();
            out.append('{');
            List<String> keys = map.keys();
            for (int i = 0; i < keys.size(); i++) {
                if (i > 0) out.append(',');
                newline(out, depth);
                String key = keys.get(i);
                writeMember(out, key, map.get(key), escapeHtml, depth);
            }
            newline(out, depth - 1);
            out.append('}');
        }

        private void writeMember(StringBuilder out, String key, JsonValue value, boolean escapeHtml, int depth) {
            writeString(out, key, escapeHtml);
            out.append(indent.isEmpty() ? ":" : ": ");
            writeValue(out, value, escapeHtml, depth + 1);
        }

        private void newline(StringBuilder out, int level) {
            if (indent.isEmpty()) return;
            out.append('\n');
            for (int i = 0; i < level; i++) out.append(indent);
        }

        static void writeString(StringBuilder out, String s, boolean escapeHtml) {
            out.append('"');
            escapeTo(out, s, escapeHtml);
            out.append('"');
        }

        static void writeNumber(StringBuilder out, Number n) {
            if (n instanceof BigDecimal || n instanceof BigInteger) {
                out.append(n);
                return;
            }
            // Avoid NaN/Infinity (not valid in JSON)
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d))
                throw new JsonException.WriteException("Cannot serialize NaN or Infinity as JSON number: " + n);
            if (d == 0 && Math.copySign(1.0, d) < 0) out.append("-0");
            else out.append(n);
        }

        static void escapeTo(StringBuilder out, String s, boolean escapeHtml) {
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                switch (c) {
                    case '"' -> out.append("\\\"");
                    case '\\' -> out.append("\\\\");
                    case '\b' -> out.append("\\b");
                    case '\f' -> out.append("\\f");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    case '<', '>', '&' -> {
                        if (escapeHtml) unicodeEscape(out, c);
                        else out.append(c);
                    }
                    default -> {
                        if (c < 0x20) unicodeEscape(out, c);
                        else out.append(c);
                    }
                }
            }
        }

        private static void unicodeEscape(StringBuilder out, char c) {
            out.append("\\u");
            String hex = Integer.toHexString(c);
            for (int k = hex.length(); k < 4; k++) out.append('0');
            out.append(hex);
        }
    }

    // ============================================================
    // Utils
    // ============================================================

    static void checkDepth(int depth, int maxDepth) {
        if (depth > maxDepth) throw new JsonException.DepthExceededException(maxDepth);
    }

    static String kindOf(JsonValue v) {
        if (v instanceof JsonNull) return "null";
        if (v instanceof JsonBoolean) return "boolean";
        if (v instanceof JsonNumber) return "number";
        if (v instanceof JsonString) return "string";
        if (v instanceof JsonArray) return "array";
        return "object";
    }
}
