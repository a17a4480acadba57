package io.flowcraft.core.state;

import java.io.Serial;

public class TypeParseException extends RuntimeException {
    @Serial private static final long serialVersionUID = 6623101853390441877L;

    private final String expression;

    public TypeParseException(String expression, String message) {
        super("Invalid type '" + expression + "': " + message);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
