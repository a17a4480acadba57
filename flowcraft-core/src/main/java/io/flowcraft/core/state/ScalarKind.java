package io.flowcraft.core.state;

/// Scalar value kinds accepted by state fields and node outputs.
///
/// Values are held in their canonical Java form: `String`, `Long`, `Double`
/// and `Boolean`. Integral numbers are widened where a float is declared.
public enum ScalarKind {
    STRING("str"),
    INTEGER("int"),
    FLOAT("float"),
    BOOLEAN("bool");

    private final String keyword;

    ScalarKind(String keyword) {
        this.keyword = keyword;
    }

    /// Returns the keyword used for this kind in type expressions.
    public String keyword() {
        return keyword;
    }

    /// Looks up a kind by its type-expression keyword.
    ///
    /// @param keyword the keyword, e.g. `str`, may be null
    /// @return matching kind, or null when the keyword names no scalar
    public static ScalarKind fromKeyword(String keyword) {
        for (ScalarKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        return null;
    }

    /// Returns whether the given raw value is an instance of this kind.
    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> isIntegral(value);
            case FLOAT -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
        };
    }

    /// Converts an accepted value to its canonical form.
    ///
    /// @param value a value for which {@link #accepts(Object)} returned true
    /// @return canonical `String`, `Long`, `Double` or `Boolean`
    public Object canonical(Object value) {
        return switch (this) {
            case STRING, BOOLEAN -> value;
            case INTEGER -> ((Number) value).longValue();
            case FLOAT -> ((Number) value).doubleValue();
        };
    }

    static boolean isIntegral(Object value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || value instanceof java.math.BigInteger;
    }
}
