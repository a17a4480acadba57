package io.flowcraft.core.output;

import io.flowcraft.core.state.ScalarKind;
import io.flowcraft.core.state.StateValidationException;
import io.flowcraft.core.state.TypeDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// Compiled result shape of a node, doubling as its payload validator.
///
/// A single-scalar result is modelled as a one-field record named
/// {@link #SCALAR_FIELD}, so object and scalar results validate the same way.
///
/// ### Contracts
/// - **Precondition**: payload is a map keyed by field name
/// - **Postcondition**: {@link #validate(Map)} returns every declared field,
///   canonicalized, and nothing else
///
/// ### Normalization
/// The only coercion applied is numeric or boolean to string, when the
/// declared type is `str`. Integral numbers are also accepted where `float`
/// is declared. Anything else that does not match is rejected.
///
/// @implNote Thread-safe. Instances are immutable.
/// @see OutputModelBuilder
public final class OutputModel {

    /// Field name used for single-scalar results.
    public static final String SCALAR_FIELD = "result";

    private final String nodeId;
    private final boolean scalar;
    private final List<OutputField> fields;

    OutputModel(String nodeId, boolean scalar, List<OutputField> fields) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId must not be null");
        this.scalar = scalar;
        this.fields = List.copyOf(fields);
    }

    /// Validates a capability payload against the declared fields.
    ///
    /// @param payload the raw payload, may be null
    /// @return canonical field values in declaration order, never null
    /// @throws OutputValidationException on the first missing, extra or mistyped field
    public Map<String, Object> validate(Map<String, ?> payload) {
        if (payload == null) {
            throw new OutputValidationException(nodeId, "*", describe(), "null");
        }
        for (String key : payload.keySet()) {
            if (fields.stream().noneMatch(f -> f.name().equals(key))) {
                throw new OutputValidationException(nodeId, key, "no such field", "present");
            }
        }

        Map<String, Object> validated = new LinkedHashMap<>();
        for (OutputField field : fields) {
            if (!payload.containsKey(field.name()) || payload.get(field.name()) == null) {
                throw new OutputValidationException(
                        nodeId, field.name(), field.type().describe(), "missing");
            }
            Object value = normalize(field.type(), payload.get(field.name()));
            try {
                validated.put(field.name(), field.type().conform(value, field.name()));
            } catch (StateValidationException e) {
                throw new OutputValidationException(
                        nodeId, e.getPath(), e.getExpected(), e.getActual());
            }
        }
        return Collections.unmodifiableMap(validated);
    }

    private static Object normalize(TypeDescriptor type, Object value) {
        if (type instanceof TypeDescriptor.Scalar s
                && s.kind() == ScalarKind.STRING
                && (value instanceof Number || value instanceof Boolean)) {
            return String.valueOf(value);
        }
        return value;
    }

    /// Maps validated fields onto the state fields named by a node's `outputs`.
    ///
    /// Object results copy each output name from the same-named result field;
    /// a scalar result is written to the first output name.
    ///
    /// @param validated result of {@link #validate(Map)}, not null
    /// @param outputs state field names the node writes, not null
    /// @return state updates, never null
    public Map<String, Object> toStateUpdates(Map<String, Object> validated, List<String> outputs) {
        Map<String, Object> updates = new LinkedHashMap<>();
        if (scalar) {
            if (!outputs.isEmpty()) {
                updates.put(outputs.get(0), validated.get(SCALAR_FIELD));
            }
            return updates;
        }
        for (String output : outputs) {
            if (validated.containsKey(output)) {
                updates.put(output, validated.get(output));
            }
        }
        return updates;
    }

    /// Renders the expected shape as a JSON-like schema for prompts.
    ///
    /// {@snippet :
    /// {"title": "str", "word_count": "int"}
    /// }
    public String describe() {
        return fields.stream()
                .map(f -> "\"" + f.name() + "\": \"" + f.type().describe() + "\"")
                .collect(Collectors.joining(", ", "{", "}"));
    }

    public String getNodeId() {
        return nodeId;
    }

    public boolean isScalar() {
        return scalar;
    }

    public List<OutputField> getFields() {
        return fields;
    }

    /// Returns the declared field names.
    public List<String> fieldNames() {
        return fields.stream().map(OutputField::name).toList();
    }
}
