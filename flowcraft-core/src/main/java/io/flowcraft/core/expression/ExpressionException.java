package io.flowcraft.core.expression;

import java.io.Serial;

/// Thrown when a predicate cannot be parsed or evaluated.
public class ExpressionException extends RuntimeException {
    @Serial private static final long serialVersionUID = -1142976270315544409L;

    private final String expression;

    public ExpressionException(String expression, String message) {
        super(message + " in expression: " + expression);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
