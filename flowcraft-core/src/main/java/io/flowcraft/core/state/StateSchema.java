package io.flowcraft.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Validated, immutable description of a typed state container.
///
/// Built once per workflow by {@link StateSchemaBuilder}; produces
/// {@link StateContainer} instances via {@link #create(Map)}. Object-typed
/// fields hold their own nested schema, so validation recurses to any depth.
///
/// ### Contracts
/// - **Invariant**: field order follows declaration order
/// - **Invariant**: a required field never carries a default
/// - **Invariant**: every declared default conforms to its field type
///
/// @implNote Thread-safe. Instances are immutable and shared by every run of
/// the compiled workflow.
public final class StateSchema {

    private final Map<String, Field> fields;

    StateSchema(List<Field> fields) {
        Map<String, Field> byName = new LinkedHashMap<>();
        for (Field field : fields) {
            byName.put(field.name(), field);
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    /// Compiled field.
    ///
    /// @param name field name, not null
    /// @param type parsed type, not null
    /// @param required whether construction fails when the field is absent
    /// @param hasDefault whether a default value was declared
    /// @param defaultValue canonical default, may be null
    /// @param description free-form description, may be null
    public record Field(
            String name,
            TypeDescriptor type,
            boolean required,
            boolean hasDefault,
            Object defaultValue,
            String description) {

        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /// Constructs a validated container from caller inputs plus declared defaults.
    ///
    /// @param inputs caller-supplied values keyed by field name, not null
    /// @return new container with every declared field present, never null
    /// @throws SchemaBuildException if a required field is missing
    /// @throws StateValidationException if a value has the wrong type or the
    ///     input names an undeclared field
    public StateContainer create(Map<String, ?> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        return new StateContainer(this, conformFields(inputs, ""));
    }

    /// Validates a nested map against this schema, applying defaults.
    Map<String, Object> conformFields(Map<?, ?> raw, String prefix) {
        for (Object key : raw.keySet()) {
            if (!(key instanceof String name) || !fields.containsKey(name)) {
                throw new StateValidationException(
                        prefix + key, "a declared field", "undeclared field");
            }
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : fields.values()) {
            String path = prefix + field.name();
            if (raw.containsKey(field.name())) {
                values.put(field.name(), conformValue(field, raw.get(field.name()), path));
            } else if (field.hasDefault()) {
                values.put(field.name(), conformValue(field, field.defaultValue(), path));
            } else if (field.required()) {
                throw new SchemaBuildException(path, "required field is missing");
            } else {
                values.put(field.name(), null);
            }
        }
        return Collections.unmodifiableMap(values);
    }

    /// Validates one top-level field value.
    ///
    /// @param name declared field name, not null
    /// @param value raw value, may be null for optional fields
    /// @return canonical immutable value
    /// @throws StateValidationException if the field is undeclared or the value mismatches
    public Object conformField(String name, Object value) {
        Field field = fields.get(name);
        if (field == null) {
            throw new StateValidationException(name, "a declared field", "undeclared field");
        }
        return conformValue(field, value, name);
    }

    private static Object conformValue(Field field, Object value, String path) {
        if (value == null) {
            if (field.required()) {
                throw new StateValidationException(path, field.type().describe(), "null");
            }
            return null;
        }
        return field.type().conform(value, path);
    }

    /// Returns the declared fields in declaration order.
    public Map<String, Field> fields() {
        return fields;
    }

    /// Returns whether a top-level field is declared.
    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /// Returns a top-level field, or null when undeclared.
    public Field field(String name) {
        return fields.get(name);
    }

    /// Returns every addressable dot-path, nested object fields included.
    ///
    /// For a `metadata` object with a `flags.level` chain this yields
    /// `metadata`, `metadata.flags` and `metadata.flags.level`.
    ///
    /// @return paths in declaration order, never null
    public List<String> paths() {
        List<String> paths = new ArrayList<>();
        collectPaths("", paths);
        return paths;
    }

    private void collectPaths(String prefix, List<String> out) {
        for (Field field : fields.values()) {
            String path = prefix + field.name();
            out.add(path);
            if (field.type() instanceof TypeDescriptor.ObjectOf object) {
                object.schema().collectPaths(path + ".", out);
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StateSchema{");
        fields.values()
                .forEach(f -> sb.append(f.name()).append(':').append(f.type().describe()).append(' '));
        return sb.toString().trim() + "}";
    }
}
