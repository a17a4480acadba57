package io.flowcraft.core.expression;

import java.util.List;

/// Recursive-descent parser for the predicate language.
///
/// ### Grammar
/// ```
/// or         := and ( ("or" | "||") and )*
/// and        := not ( ("and" | "&&") not )*
/// not        := ("not" | "!") not | comparison
/// comparison := additive ( ("==" | "!=" | "<" | "<=" | ">" | ">=") additive )?
/// additive   := term ( ("+" | "-") term )*
/// term       := unary ( ("*" | "/" | "%") unary )*
/// unary      := "-" unary | primary
/// primary    := NUMBER | STRING | "true" | "false" | "null" | PATH | "(" or ")"
/// ```
/// Nothing outside this grammar is accepted: there are no function calls,
/// attribute access beyond dot-paths, or assignments.
public final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).tokenize();
    }

    /// Parses predicate source into an AST.
    ///
    /// @param source predicate text, not null
    /// @return the parsed expression, never null
    /// @throws ExpressionException on any lexical or syntax error
    public static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionException(String.valueOf(source), "Empty expression");
        }
        ExpressionParser parser = new ExpressionParser(source);
        Expression expression = parser.or();
        if (parser.peek().type() != Token.Type.EOF) {
            throw parser.error("Unexpected '" + parser.peek().text() + "'");
        }
        return expression;
    }

    private Expression or() {
        Expression left = and();
        while (accept(Token.Type.OR)) {
            left = new Expression.Binary(Expression.Operator.OR, left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = not();
        while (accept(Token.Type.AND)) {
            left = new Expression.Binary(Expression.Operator.AND, left, not());
        }
        return left;
    }

    private Expression not() {
        if (accept(Token.Type.NOT)) {
            return new Expression.Unary(Expression.Operator.NOT, not());
        }
        return comparison();
    }

    private Expression comparison() {
        Expression left = additive();
        Expression.Operator operator =
                switch (peek().type()) {
                    case EQ -> Expression.Operator.EQ;
                    case NE -> Expression.Operator.NE;
                    case LT -> Expression.Operator.LT;
                    case LE -> Expression.Operator.LE;
                    case GT -> Expression.Operator.GT;
                    case GE -> Expression.Operator.GE;
                    default -> null;
                };
        if (operator == null) {
            return left;
        }
        index++;
        return new Expression.Binary(operator, left, additive());
    }

    private Expression additive() {
        Expression left = term();
        while (true) {
            if (accept(Token.Type.PLUS)) {
                left = new Expression.Binary(Expression.Operator.ADD, left, term());
            } else if (accept(Token.Type.MINUS)) {
                left = new Expression.Binary(Expression.Operator.SUBTRACT, left, term());
            } else {
                return left;
            }
        }
    }

    private Expression term() {
        Expression left = unary();
        while (true) {
            if (accept(Token.Type.STAR)) {
                left = new Expression.Binary(Expression.Operator.MULTIPLY, left, unary());
            } else if (accept(Token.Type.SLASH)) {
                left = new Expression.Binary(Expression.Operator.DIVIDE, left, unary());
            } else if (accept(Token.Type.PERCENT)) {
                left = new Expression.Binary(Expression.Operator.MODULO, left, unary());
            } else {
                return left;
            }
        }
    }

    private Expression unary() {
        if (accept(Token.Type.MINUS)) {
            return new Expression.Unary(Expression.Operator.NEGATE, unary());
        }
        return primary();
    }

    private Expression primary() {
        Token token = peek();
        if (token.type() == Token.Type.EOF) {
            throw error("Unexpected end of expression");
        }
        index++;
        return switch (token.type()) {
            case NUMBER -> new Expression.Literal(parseNumber(token));
            case STRING -> new Expression.Literal(token.text());
            case TRUE -> new Expression.Literal(Boolean.TRUE);
            case FALSE -> new Expression.Literal(Boolean.FALSE);
            case NULL -> new Expression.Literal(null);
            case IDENTIFIER -> new Expression.PathRef(token.text());
            case LPAREN -> {
                Expression inner = or();
                if (!accept(Token.Type.RPAREN)) {
                    throw error("Expected ')'");
                }
                yield inner;
            }
            default -> throw new ExpressionException(
                    source, "Unexpected '" + token.text() + "' at position " + token.position());
        };
    }

    private Object parseNumber(Token token) {
        String text = token.text();
        try {
            return text.contains(".")
                    ? (Object) Double.parseDouble(text)
                    : (Object) Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ExpressionException(
                    source, "Invalid number '" + text + "' at position " + token.position());
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private boolean accept(Token.Type type) {
        if (peek().type() == type) {
            index++;
            return true;
        }
        return false;
    }

    private ExpressionException error(String message) {
        return new ExpressionException(source, message + " at position " + peek().position());
    }
}
