package io.flowcraft.core.output;

import io.flowcraft.core.state.SchemaBuildException;
import io.flowcraft.core.state.TypeDescriptor;
import io.flowcraft.core.state.TypeParseException;
import io.flowcraft.core.state.TypeParser;
import io.flowcraft.core.workflow.OutputDeclaration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Compiles a node's {@link OutputDeclaration} into an {@link OutputModel}.
///
/// Result fields may use any scalar or collection type; `object` is only
/// valid for the result as a whole.
public final class OutputModelBuilder {

    private OutputModelBuilder() {}

    /// Builds the output model for a node.
    ///
    /// @param nodeId owning node id, used in error paths, not null
    /// @param declaration declared result shape, not null
    /// @return compiled model, never null
    /// @throws SchemaBuildException if a field type is invalid, a field name is
    ///     duplicated, or an object result declares no fields
    public static OutputModel build(String nodeId, OutputDeclaration declaration) {
        if (!declaration.isObject()) {
            if (!declaration.fields().isEmpty()) {
                throw new SchemaBuildException(
                        nodeId + ".output", "fields are only allowed on object results");
            }
            TypeDescriptor type = parse(nodeId + ".output", declaration.type());
            return new OutputModel(
                    nodeId,
                    true,
                    List.of(new OutputField(OutputModel.SCALAR_FIELD, type, null)));
        }

        if (declaration.fields().isEmpty()) {
            throw new SchemaBuildException(
                    nodeId + ".output", "object results require at least one field");
        }
        List<OutputField> fields = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (OutputDeclaration.Field field : declaration.fields()) {
            String path = nodeId + ".output." + field.name();
            if (!seen.add(field.name())) {
                throw new SchemaBuildException(path, "duplicate output field");
            }
            fields.add(new OutputField(field.name(), parse(path, field.type()), field.description()));
        }
        return new OutputModel(nodeId, false, fields);
    }

    private static TypeDescriptor parse(String path, String type) {
        try {
            return TypeParser.parse(type);
        } catch (TypeParseException e) {
            throw new SchemaBuildException(path, e.getMessage(), e);
        }
    }
}
