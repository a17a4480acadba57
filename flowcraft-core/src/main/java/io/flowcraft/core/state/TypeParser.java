package io.flowcraft.core.state;

/// Parses type expressions into {@link TypeDescriptor}s.
///
/// ### Grammar
/// ```
/// type   := scalar | list | dict | "object"
/// scalar := "str" | "int" | "float" | "bool"
/// list   := "list" [ "[" type "]" ]
/// dict   := "dict" [ "[" "str" "," type "]" ]
/// ```
/// Whitespace between tokens is ignored. `object` takes its fields from the
/// nested schema passed alongside the expression; an expression may reference
/// `object` at most as the innermost element type, e.g. `list[object]`.
///
/// @implNote Stateless and thread-safe.
public final class TypeParser {

    private final String expression;
    private final StateSchema nested;
    private int pos;

    private TypeParser(String expression, StateSchema nested) {
        this.expression = expression;
        this.nested = nested;
    }

    /// Parses a type expression without a nested object schema.
    ///
    /// @param expression the type expression, not null
    /// @return parsed descriptor, never null
    /// @throws TypeParseException if the expression is malformed or uses `object`
    public static TypeDescriptor parse(String expression) {
        return parse(expression, null);
    }

    /// Parses a type expression whose `object` references resolve to `nested`.
    ///
    /// @param expression the type expression, not null
    /// @param nested schema for `object` types, may be null when none is used
    /// @return parsed descriptor, never null
    /// @throws TypeParseException if the expression is malformed, or uses
    ///     `object` without a nested schema
    public static TypeDescriptor parse(String expression, StateSchema nested) {
        if (expression == null || expression.isBlank()) {
            throw new TypeParseException(String.valueOf(expression), "type must not be empty");
        }
        TypeParser parser = new TypeParser(expression, nested);
        TypeDescriptor type = parser.parseType();
        parser.skipWhitespace();
        if (parser.pos != expression.length()) {
            throw parser.error("unexpected '" + expression.substring(parser.pos) + "'");
        }
        return type;
    }

    private TypeDescriptor parseType() {
        String word = readWord();
        ScalarKind scalar = ScalarKind.fromKeyword(word);
        if (scalar != null) {
            return new TypeDescriptor.Scalar(scalar);
        }
        switch (word) {
            case "list" -> {
                if (!consume('[')) {
                    return new TypeDescriptor.ListOf(new TypeDescriptor.AnyValue());
                }
                TypeDescriptor element = parseType();
                expect(']');
                return new TypeDescriptor.ListOf(element);
            }
            case "dict" -> {
                if (!consume('[')) {
                    return new TypeDescriptor.MapOf(new TypeDescriptor.AnyValue());
                }
                String key = readWord();
                if (!"str".equals(key)) {
                    throw error("dict keys must be str, got '" + key + "'");
                }
                expect(',');
                TypeDescriptor value = parseType();
                expect(']');
                return new TypeDescriptor.MapOf(value);
            }
            case "object" -> {
                if (nested == null) {
                    throw error("object type requires a nested schema");
                }
                return new TypeDescriptor.ObjectOf(nested);
            }
            default -> throw error("unknown type '" + word + "'");
        }
    }

    private String readWord() {
        skipWhitespace();
        int start = pos;
        while (pos < expression.length() && Character.isLetter(expression.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw error("expected a type name at position " + pos);
        }
        return expression.substring(start, pos);
    }

    private boolean consume(char c) {
        skipWhitespace();
        if (pos < expression.length() && expression.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char c) {
        if (!consume(c)) {
            throw error("expected '" + c + "' at position " + pos);
        }
    }

    private void skipWhitespace() {
        while (pos < expression.length() && Character.isWhitespace(expression.charAt(pos))) {
            pos++;
        }
    }

    private TypeParseException error(String message) {
        return new TypeParseException(expression, message);
    }
}
