package io.flowcraft.core.workflow;

import io.flowcraft.core.state.StateFieldDeclaration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Declarative workflow: typed state, nodes, edges and global defaults.
///
/// A spec is pure data and performs no structural validation of its own;
/// {@link io.flowcraft.core.compiler.GraphCompiler} checks it and produces
/// the executable graph.
///
/// {@snippet :
/// WorkflowSpec spec = WorkflowSpec.builder()
///         .metadata(WorkflowMetadata.named("article"))
///         .state(StateFieldDeclaration.builder("topic").type("str").required(true).build())
///         .state(StateFieldDeclaration.of("draft", "str"))
///         .node(NodeDeclaration.builder("write").prompt("Write about {topic}").outputs("draft").build())
///         .edge(new EdgeDeclaration.Linear(EdgeDeclaration.START, "write"))
///         .edge(new EdgeDeclaration.Linear("write", EdgeDeclaration.END))
///         .build();
/// }
///
/// @implNote Immutable and thread-safe after construction.
public final class WorkflowSpec {

    public static final String SCHEMA_VERSION = "1.0";

    private final String schemaVersion;
    private final WorkflowMetadata metadata;
    private final List<StateFieldDeclaration> state;
    private final List<NodeDeclaration> nodes;
    private final List<EdgeDeclaration> edges;
    private final LlmConfig llm;
    private final ExecutionDefaults execution;

    private WorkflowSpec(Builder builder) {
        this.schemaVersion = builder.schemaVersion;
        this.metadata = Objects.requireNonNull(builder.metadata, "Workflow metadata required");
        this.state = List.copyOf(builder.state);
        this.nodes = List.copyOf(builder.nodes);
        this.edges = List.copyOf(builder.edges);
        this.llm = builder.llm != null ? builder.llm : LlmConfig.EMPTY;
        this.execution = builder.execution != null ? builder.execution : ExecutionDefaults.DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public WorkflowMetadata getMetadata() {
        return metadata;
    }

    public String getName() {
        return metadata.name();
    }

    public List<StateFieldDeclaration> getState() {
        return state;
    }

    public List<NodeDeclaration> getNodes() {
        return nodes;
    }

    public Optional<NodeDeclaration> findNode(String id) {
        return nodes.stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    public List<EdgeDeclaration> getEdges() {
        return edges;
    }

    /// Returns the workflow-level LLM defaults, never null.
    public LlmConfig getLlm() {
        return llm;
    }

    public ExecutionDefaults getExecution() {
        return execution;
    }

    public static final class Builder {
        private String schemaVersion = SCHEMA_VERSION;
        private WorkflowMetadata metadata;
        private final List<StateFieldDeclaration> state = new ArrayList<>();
        private final List<NodeDeclaration> nodes = new ArrayList<>();
        private final List<EdgeDeclaration> edges = new ArrayList<>();
        private LlmConfig llm;
        private ExecutionDefaults execution;

        private Builder() {}

        public Builder schemaVersion(String schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        public Builder metadata(WorkflowMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder state(StateFieldDeclaration field) {
            this.state.add(field);
            return this;
        }

        public Builder state(List<StateFieldDeclaration> fields) {
            this.state.addAll(fields);
            return this;
        }

        public Builder node(NodeDeclaration node) {
            this.nodes.add(node);
            return this;
        }

        public Builder nodes(List<NodeDeclaration> nodes) {
            this.nodes.addAll(nodes);
            return this;
        }

        public Builder edge(EdgeDeclaration edge) {
            this.edges.add(edge);
            return this;
        }

        public Builder edges(List<EdgeDeclaration> edges) {
            this.edges.addAll(edges);
            return this;
        }

        public Builder llm(LlmConfig llm) {
            this.llm = llm;
            return this;
        }

        public Builder execution(ExecutionDefaults execution) {
            this.execution = execution;
            return this;
        }

        public WorkflowSpec build() {
            return new WorkflowSpec(this);
        }
    }
}
