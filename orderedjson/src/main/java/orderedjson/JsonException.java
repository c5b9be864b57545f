package orderedjson;

/**
 * Exception thrown when JSON decoding or encoding fails.
 * This is the base exception for all orderedjson errors; every failure is terminal for the
 * operation that raised it and no partial result is returned.
 *
 * @since 0.1.0
 */
public class JsonException extends RuntimeException {

    /**
     * Constructs a new JsonException with the specified detail message.
     *
     * @param message the detail message
     */
    public JsonException(String message) {
        super(message);
    }

    /**
     * Exception thrown when JSON parsing fails due to malformed JSON syntax.
     */
    public static class ParseException extends JsonException {
        private final int line;
        private final int column;

        public ParseException(String message, int line, int column) {
            super(String.format("%s at line %d, column %d", message, line, column));
            this.line = line;
            this.column = column;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * Exception thrown when a well-formed document has the wrong shape, e.g. the top-level value is not an object.
     */
    public static class TypeMismatchException extends JsonException {
        private final String expected;
        private final String actual;

        public TypeMismatchException(String expected, String actual) {
            super(String.format("Expected JSON %s at top level, but got %s", expected, actual));
            this.expected = expected;
            this.actual = actual;
        }

        public String getExpected() {
            return expected;
        }

        public String getActual() {
            return actual;
        }
    }

    /**
     * Exception thrown when an object repeats a key and the duplicate key policy is strict.
     */
    public static class DuplicateKeyException extends JsonException {
        private final String key;
        private final String path;

        public DuplicateKeyException(String key, String path) {
            super(String.format("Duplicate key \"%s\" in object at %s", key, path));
            this.key = key;
            this.path = path;
        }

        public String getKey() {
            return key;
        }

        /**
         * @return location of the object holding the duplicate, {@code $} being the root
         */
        public String getPath() {
            return path;
        }
    }

    /**
     * Exception thrown when nesting goes deeper than the configured maximum.
     */
    public static class DepthExceededException extends JsonException {
        private final int maxDepth;

        public DepthExceededException(int maxDepth) {
            super(String.format("Nesting depth exceeds the maximum of %d", maxDepth));
            this.maxDepth = maxDepth;
        }

        public int getMaxDepth() {
            return maxDepth;
        }
    }

    /**
     * Exception thrown during JSON encoding when a value cannot be represented.
     */
    public static class WriteException extends JsonException {
        public WriteException(String message) {
            super(message);
        }
    }
}
