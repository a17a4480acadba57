package io.flowcraft.core.workflow;

import java.util.List;
import java.util.Objects;

/// Declared result shape of a node.
///
/// Either a single scalar (`type` is a scalar or collection type and `fields`
/// is empty) or an object (`type` is `object` and `fields` lists the named
/// result fields).
///
/// @param type type expression of the whole result, not null
/// @param fields named fields for object results, not null (empty for scalars)
public record OutputDeclaration(String type, List<Field> fields) {

    public static final String OBJECT = "object";

    public OutputDeclaration {
        Objects.requireNonNull(type, "type must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    /// A named result field.
    public record Field(String name, String type, String description) {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    public static OutputDeclaration scalar(String type) {
        return new OutputDeclaration(type, List.of());
    }

    public static OutputDeclaration object(List<Field> fields) {
        return new OutputDeclaration(OBJECT, fields);
    }

    public boolean isObject() {
        return OBJECT.equals(type.trim());
    }
}
