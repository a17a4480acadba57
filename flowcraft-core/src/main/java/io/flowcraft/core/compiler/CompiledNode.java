package io.flowcraft.core.compiler;

import io.flowcraft.core.output.OutputModel;
import io.flowcraft.core.workflow.NodeDeclaration;

/// Node declaration paired with its compiled output model.
///
/// @param declaration the declared node, not null
/// @param outputModel validator for the node's result, not null
public record CompiledNode(NodeDeclaration declaration, OutputModel outputModel) {

    public String id() {
        return declaration.getId();
    }
}
