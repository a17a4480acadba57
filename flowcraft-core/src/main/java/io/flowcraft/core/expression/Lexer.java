package io.flowcraft.core.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Splits predicate source into {@link Token}s.
///
/// Accepts both word and symbol forms of the boolean operators
/// (`and`/`&&`, `or`/`||`, `not`/`!`) and single- or double-quoted strings
/// with backslash escapes.
final class Lexer {

    private static final Map<String, Token.Type> KEYWORDS =
            Map.ofEntries(
                    Map.entry("and", Token.Type.AND),
                    Map.entry("or", Token.Type.OR),
                    Map.entry("not", Token.Type.NOT),
                    Map.entry("true", Token.Type.TRUE),
                    Map.entry("True", Token.Type.TRUE),
                    Map.entry("false", Token.Type.FALSE),
                    Map.entry("False", Token.Type.FALSE),
                    Map.entry("null", Token.Type.NULL),
                    Map.entry("None", Token.Type.NULL));

    private final String source;
    private int pos;

    Lexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);

        if (Character.isDigit(c)) {
            return number(start);
        }
        if (Character.isLetter(c) || c == '_') {
            return word(start);
        }
        if (c == '"' || c == '\'') {
            return string(start, c);
        }

        pos++;
        return switch (c) {
            case '(' -> new Token(Token.Type.LPAREN, "(", start);
            case ')' -> new Token(Token.Type.RPAREN, ")", start);
            case '+' -> new Token(Token.Type.PLUS, "+", start);
            case '-' -> new Token(Token.Type.MINUS, "-", start);
            case '*' -> new Token(Token.Type.STAR, "*", start);
            case '/' -> new Token(Token.Type.SLASH, "/", start);
            case '%' -> new Token(Token.Type.PERCENT, "%", start);
            case '=' -> expectNext('=', Token.Type.EQ, "==", start);
            case '!' -> match('=')
                    ? new Token(Token.Type.NE, "!=", start)
                    : new Token(Token.Type.NOT, "!", start);
            case '<' -> match('=')
                    ? new Token(Token.Type.LE, "<=", start)
                    : new Token(Token.Type.LT, "<", start);
            case '>' -> match('=')
                    ? new Token(Token.Type.GE, ">=", start)
                    : new Token(Token.Type.GT, ">", start);
            case '&' -> expectNext('&', Token.Type.AND, "&&", start);
            case '|' -> expectNext('|', Token.Type.OR, "||", start);
            default -> throw error("Unexpected character '" + c + "' at position " + start);
        };
    }

    private Token number(int start) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < source.length()
                && source.charAt(pos) == '.'
                && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos), start);
    }

    private Token word(int start) {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                pos++;
            } else if (c == '.'
                    && pos + 1 < source.length()
                    && (Character.isLetter(source.charAt(pos + 1)) || source.charAt(pos + 1) == '_')) {
                pos++;
            } else {
                break;
            }
        }
        String text = source.substring(start, pos);
        Token.Type keyword = KEYWORDS.get(text);
        return new Token(keyword != null ? keyword : Token.Type.IDENTIFIER, text, start);
    }

    private Token string(int start, char quote) {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            if (c == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                sb.append(
                        switch (escaped) {
                            case 'n' -> '\n';
                            case 't' -> '\t';
                            default -> escaped;
                        });
            } else {
                sb.append(c);
            }
        }
        throw error("Unterminated string starting at position " + start);
    }

    private boolean match(char expected) {
        if (pos < source.length() && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private Token expectNext(char expected, Token.Type type, String text, int start) {
        if (!match(expected)) {
            throw error("Expected '" + text + "' at position " + start);
        }
        return new Token(type, text, start);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private ExpressionException error(String message) {
        return new ExpressionException(source, message);
    }
}
