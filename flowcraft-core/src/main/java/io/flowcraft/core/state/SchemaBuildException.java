package io.flowcraft.core.state;

import java.io.Serial;

/// Thrown when state field declarations cannot be turned into a schema, or when
/// a container cannot be constructed because a required field is missing.
///
/// Raised before any node runs; never retried.
public class SchemaBuildException extends RuntimeException {
    @Serial private static final long serialVersionUID = -2287361109845236716L;

    private final String field;

    public SchemaBuildException(String field, String message) {
        super("Field '" + field + "': " + message);
        this.field = field;
    }

    public SchemaBuildException(String field, String message, Throwable cause) {
        super("Field '" + field + "': " + message, cause);
        this.field = field;
    }

    /// Returns the dot-path of the offending field.
    public String getField() {
        return field;
    }
}
