package io.flowcraft.core.state;

import java.io.Serial;

/// Thrown when a value does not conform to its declared type.
public class StateValidationException extends RuntimeException {
    @Serial private static final long serialVersionUID = 3140287733019553214L;

    private final String path;
    private final String expected;
    private final String actual;

    public StateValidationException(String path, String expected, String actual) {
        super("Value at '" + path + "' expected " + expected + " but was " + actual);
        this.path = path;
        this.expected = expected;
        this.actual = actual;
    }

    static StateValidationException mismatch(String path, String expected, Object value) {
        return new StateValidationException(path, expected, describeValue(value));
    }

    /// Describes a runtime value for error messages, e.g. `String("abc")`.
    public static String describeValue(Object value) {
        if (value == null) {
            return "null";
        }
        String text = String.valueOf(value);
        if (text.length() > 40) {
            text = text.substring(0, 40) + "...";
        }
        return value.getClass().getSimpleName() + "(" + text + ")";
    }

    public String getPath() {
        return path;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
