package io.flowcraft.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Parsed form of a state or output type expression.
///
/// Every descriptor can {@link #conform(Object, String)} a raw value: it checks
/// the value against the declared type and returns a canonical, deeply
/// immutable copy. Containers built from conformed values therefore never
/// alias caller-owned collections.
///
/// ### Permitted Subtypes
/// - {@link Scalar} - `str`, `int`, `float`, `bool`
/// - {@link ListOf} - `list` or `list[T]`
/// - {@link MapOf} - `dict` or `dict[str, T]`
/// - {@link ObjectOf} - `object` with a nested field schema
/// - {@link AnyValue} - element type of untyped collections
///
/// @see TypeParser for the expression grammar
public sealed interface TypeDescriptor {

    /// Returns the type expression this descriptor was parsed from.
    String describe();

    /// Validates a value against this type and returns its canonical copy.
    ///
    /// @param value raw value, may be null
    /// @param path dot-path of the value, used in error messages, not null
    /// @return canonical immutable value
    /// @throws StateValidationException if the value does not match
    Object conform(Object value, String path);

    /// Scalar type.
    record Scalar(ScalarKind kind) implements TypeDescriptor {

        public Scalar {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public String describe() {
            return kind.keyword();
        }

        @Override
        public Object conform(Object value, String path) {
            if (!kind.accepts(value)) {
                throw StateValidationException.mismatch(path, describe(), value);
            }
            return kind.canonical(value);
        }
    }

    /// Homogeneous list.
    record ListOf(TypeDescriptor element) implements TypeDescriptor {

        public ListOf {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public String describe() {
            return element instanceof AnyValue ? "list" : "list[" + element.describe() + "]";
        }

        @Override
        public Object conform(Object value, String path) {
            if (!(value instanceof List<?> list)) {
                throw StateValidationException.mismatch(path, describe(), value);
            }
            List<Object> copy = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                copy.add(element.conform(list.get(i), path + "[" + i + "]"));
            }
            return Collections.unmodifiableList(copy);
        }
    }

    /// String-keyed map with homogeneous values.
    record MapOf(TypeDescriptor value) implements TypeDescriptor {

        public MapOf {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String describe() {
            return value instanceof AnyValue ? "dict" : "dict[str, " + value.describe() + "]";
        }

        @Override
        public Object conform(Object raw, String path) {
            if (!(raw instanceof Map<?, ?> map)) {
                throw StateValidationException.mismatch(path, describe(), raw);
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw StateValidationException.mismatch(
                            path + " key", "str", entry.getKey());
                }
                copy.put(key, value.conform(entry.getValue(), path + "." + key));
            }
            return Collections.unmodifiableMap(copy);
        }
    }

    /// Nested object typed by its own schema.
    record ObjectOf(StateSchema schema) implements TypeDescriptor {

        public ObjectOf {
            Objects.requireNonNull(schema, "schema must not be null");
        }

        @Override
        public String describe() {
            return "object";
        }

        @Override
        public Object conform(Object value, String path) {
            if (!(value instanceof Map<?, ?> map)) {
                throw StateValidationException.mismatch(path, describe(), value);
            }
            return schema.conformFields(map, path + ".");
        }
    }

    /// Untyped element of a bare `list` or `dict`. Accepts scalars, lists and maps.
    record AnyValue() implements TypeDescriptor {

        @Override
        public String describe() {
            return "any";
        }

        @Override
        public Object conform(Object value, String path) {
            if (value == null) {
                return null;
            }
            if (value instanceof List<?>) {
                return new ListOf(this).conform(value, path);
            }
            if (value instanceof Map<?, ?>) {
                return new MapOf(this).conform(value, path);
            }
            for (ScalarKind kind : ScalarKind.values()) {
                if (kind.accepts(value)) {
                    return kind.canonical(value);
                }
            }
            throw StateValidationException.mismatch(path, "any", value);
        }
    }
}
