package io.flowcraft.core.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Declared unit of work: an LLM call, a sandboxed code block, or both.
///
/// ### Execution Inputs
/// - `inputs` maps node-local names to templates resolved against state;
///   the prompt sees these names first
/// - `prompt` is a `{path}` template
/// - `output` declares the result shape; `outputs` names the state fields it writes
///
/// When a node declares `code`, the sandbox runs it and the prompt, if any,
/// is still sent to the LLM afterwards with the code results visible as inputs.
///
/// @implNote Immutable and thread-safe after construction.
public final class NodeDeclaration {

    private final String id;
    private final String description;
    private final Map<String, String> inputs;
    private final String prompt;
    private final OutputDeclaration output;
    private final List<String> outputs;
    private final List<ToolRef> tools;
    private final LlmConfig llm;
    private final CodeBlock code;

    private NodeDeclaration(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node ID must not be blank");
        }
        if (builder.prompt == null && builder.code == null) {
            throw new IllegalArgumentException(
                    "Node '" + id + "' must declare a prompt or a code block");
        }
        this.description = builder.description;
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputs));
        this.prompt = builder.prompt;
        this.output = builder.output != null ? builder.output : OutputDeclaration.scalar("str");
        this.outputs = List.copyOf(builder.outputs);
        this.tools = List.copyOf(builder.tools);
        this.llm = builder.llm;
        this.code = builder.code;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, String> getInputs() {
        return inputs;
    }

    /// Returns the prompt template, or null for code-only nodes.
    public String getPrompt() {
        return prompt;
    }

    public OutputDeclaration getOutput() {
        return output;
    }

    public List<String> getOutputs() {
        return outputs;
    }

    public List<ToolRef> getTools() {
        return tools;
    }

    /// Returns the node-level LLM override, or null to use the workflow default.
    public LlmConfig getLlm() {
        return llm;
    }

    /// Returns the code block, or null when the node only calls the LLM.
    public CodeBlock getCode() {
        return code;
    }

    public boolean hasCode() {
        return code != null;
    }

    public boolean hasPrompt() {
        return prompt != null;
    }

    @Override
    public String toString() {
        return "NodeDeclaration{" + id + "}";
    }

    public static final class Builder {
        private final String id;
        private String description;
        private final Map<String, String> inputs = new LinkedHashMap<>();
        private String prompt;
        private OutputDeclaration output;
        private final List<String> outputs = new ArrayList<>();
        private final List<ToolRef> tools = new ArrayList<>();
        private LlmConfig llm;
        private CodeBlock code;

        private Builder(String id) {
            this.id = id;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder input(String name, String template) {
            this.inputs.put(name, template);
            return this;
        }

        public Builder inputs(Map<String, String> inputs) {
            this.inputs.putAll(inputs);
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder output(OutputDeclaration output) {
            this.output = output;
            return this;
        }

        public Builder outputs(String... outputs) {
            this.outputs.addAll(List.of(outputs));
            return this;
        }

        public Builder outputs(List<String> outputs) {
            this.outputs.addAll(outputs);
            return this;
        }

        public Builder tool(ToolRef tool) {
            this.tools.add(tool);
            return this;
        }

        public Builder tools(List<ToolRef> tools) {
            this.tools.addAll(tools);
            return this;
        }

        public Builder llm(LlmConfig llm) {
            this.llm = llm;
            return this;
        }

        public Builder code(CodeBlock code) {
            this.code = code;
            return this;
        }

        public NodeDeclaration build() {
            return new NodeDeclaration(this);
        }
    }
}
