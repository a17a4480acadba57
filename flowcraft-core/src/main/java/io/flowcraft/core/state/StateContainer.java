package io.flowcraft.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable, schema-validated workflow state.
///
/// Every declared field is present at all times; optional fields without a
/// value hold null. Values are canonical and deeply immutable, so unchanged
/// fields are shared between successive containers rather than copied.
///
/// ### Contracts
/// - **Invariant**: keys equal the schema's top-level field names, in order
/// - **Invariant**: every non-null value conforms to its declared type
/// - **Postcondition**: {@link #with(Map)} never modifies the receiver
///
/// @implNote Thread-safe. A container handed to a parallel branch is an
/// independent snapshot; branch updates produce new containers.
///
/// @see StateSchema#create(Map)
public final class StateContainer {

    private final StateSchema schema;
    private final Map<String, Object> values;

    StateContainer(StateSchema schema, Map<String, Object> values) {
        this.schema = schema;
        this.values = values;
    }

    /// Returns a new container with the given top-level fields replaced.
    ///
    /// @param updates new values keyed by declared field name, not null
    /// @return new container, never null; the receiver is unchanged
    /// @throws StateValidationException if a key is undeclared or a value mismatches
    public StateContainer with(Map<String, ?> updates) {
        Objects.requireNonNull(updates, "updates must not be null");
        if (updates.isEmpty()) {
            return this;
        }
        Map<String, Object> next = new LinkedHashMap<>(values);
        updates.forEach((name, value) -> next.put(name, schema.conformField(name, value)));
        return new StateContainer(schema, Collections.unmodifiableMap(next));
    }

    /// Returns the value of a top-level field.
    ///
    /// @param name declared field name, not null
    /// @return the value, may be null for unset optional fields
    /// @throws IllegalArgumentException if the field is undeclared
    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Undeclared state field: " + name);
        }
        return values.get(name);
    }

    /// Returns whether a dot-path addresses an existing entry.
    ///
    /// Traverses nested objects and dicts. An entry holding null counts as present.
    public boolean contains(String path) {
        return lookup(path) != MISSING;
    }

    /// Returns the value at a dot-path such as `metadata.flags.level`.
    ///
    /// @param path dot-separated path, not null
    /// @return the value, may be null
    /// @throws IllegalArgumentException if the path does not resolve
    public Object valueAt(String path) {
        Object value = lookup(path);
        if (value == MISSING) {
            throw new IllegalArgumentException("No state value at path: " + path);
        }
        return value;
    }

    private static final Object MISSING = new Object();

    private Object lookup(String path) {
        Object current = values;
        for (String segment : path.split("\\.", -1)) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return MISSING;
            }
            current = map.get(segment);
        }
        return current;
    }

    /// Returns all field values as an unmodifiable map in declaration order.
    public Map<String, Object> asMap() {
        return values;
    }

    public StateSchema schema() {
        return schema;
    }

    /// Returns every valid dot-path for error reporting.
    public List<String> paths() {
        return schema.paths();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateContainer that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "StateContainer" + values;
    }
}
