package io.flowcraft.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowcraft.core.capability.SandboxLimits;
import io.flowcraft.core.state.StateFieldDeclaration;
import io.flowcraft.core.workflow.CodeBlock;
import io.flowcraft.core.workflow.EdgeDeclaration;
import io.flowcraft.core.workflow.ExecutionDefaults;
import io.flowcraft.core.workflow.LlmConfig;
import io.flowcraft.core.workflow.NodeDeclaration;
import io.flowcraft.core.workflow.OutputDeclaration;
import io.flowcraft.core.workflow.ToolRef;
import io.flowcraft.core.workflow.WorkflowMetadata;
import io.flowcraft.core.workflow.WorkflowSpec;
import java.io.IOException;
import java.io.Serial;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Reads a workflow document into a {@link WorkflowSpec}.
///
/// ### Document shape
/// {@snippet lang=yaml :
/// schema_version: "1.0"
/// flow: {name: article_writer}
/// state:
///   fields:
///     topic: {type: str, required: true}
///     article: {type: str}
/// nodes:
///   - id: write
///     prompt: "Write about {topic}"
///     outputs: [article]
/// edges:
///   - {from: START, to: write}
///   - {from: write, to: END}
/// }
///
/// Edges carry exactly one of `to`, `routes`, `loop` or `parallel`. A route
/// whose condition is `default` becomes the route set's default target.
///
/// The document is walked as a `JsonNode` tree; every value is read by hand
/// so that error messages can name the exact document path.
///
/// @implNote Package-private. Registered by {@link FlowcraftJacksonModule}.
class WorkflowSpecDeserializer extends StdDeserializer<WorkflowSpec> {

    @Serial private static final long serialVersionUID = 2284409725176034158L;

    private static final String DEFAULT_ROUTE = "default";
    private static final int DEFAULT_LOOP_ITERATIONS = 10;

    WorkflowSpecDeserializer() {
        super(WorkflowSpec.class);
    }

    @Override
    public WorkflowSpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || !root.isObject()) {
            throw new WorkflowParseException(null, "Workflow document must be a mapping");
        }

        String version = requiredText(root, "schema_version", "schema_version");
        if (!WorkflowSpec.SCHEMA_VERSION.equals(version)) {
            throw new WorkflowParseException(
                    "schema_version",
                    "Unsupported schema version '"
                            + version
                            + "'. Expected '"
                            + WorkflowSpec.SCHEMA_VERSION
                            + "'");
        }

        WorkflowSpec.Builder builder =
                WorkflowSpec.builder()
                        .schemaVersion(version)
                        .metadata(metadata(requiredObject(root, "flow", "flow")))
                        .state(stateFields(mapper, requiredObject(root, "state", "state")))
                        .nodes(nodes(requiredArray(root, "nodes", "nodes")))
                        .edges(edges(requiredArray(root, "edges", "edges")));

        JsonNode config = root.get("config");
        if (config != null && !config.isNull()) {
            if (config.has("llm")) {
                builder.llm(llmConfig(config.get("llm"), "config.llm"));
            }
            if (config.has("execution")) {
                builder.execution(execution(config.get("execution"), "config.execution"));
            }
        }
        return builder.build();
    }

    private static WorkflowMetadata metadata(JsonNode flow) {
        String name = requiredText(flow, "name", "flow.name").trim();
        if (name.isEmpty()) {
            throw new WorkflowParseException("flow.name", "Flow name cannot be empty");
        }
        return new WorkflowMetadata(
                name, textOrNull(flow, "description"), textOrNull(flow, "version"));
    }

    private static List<StateFieldDeclaration> stateFields(ObjectMapper mapper, JsonNode state) {
        JsonNode fields = requiredObject(state, "fields", "state.fields");
        if (fields.isEmpty()) {
            throw new WorkflowParseException("state.fields", "State must have at least one field");
        }
        return fieldMap(mapper, fields, "state.fields");
    }

    private static List<StateFieldDeclaration> fieldMap(
            ObjectMapper mapper, JsonNode fields, String path) {
        List<StateFieldDeclaration> declarations = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            declarations.add(
                    stateField(
                            mapper, entry.getKey(), entry.getValue(), path + "." + entry.getKey()));
        }
        return declarations;
    }

    private static StateFieldDeclaration stateField(
            ObjectMapper mapper, String name, JsonNode node, String path) {
        if (node.isTextual()) {
            return StateFieldDeclaration.of(name, node.asText());
        }
        if (!node.isObject()) {
            throw new WorkflowParseException(path, "expected a type name or a field mapping");
        }
        StateFieldDeclaration.Builder b =
                StateFieldDeclaration.builder(name)
                        .type(requiredText(node, "type", path + ".type"))
                        .required(node.path("required").asBoolean(false))
                        .description(textOrNull(node, "description"));
        JsonNode defaultValue = node.get("default");
        if (defaultValue != null && !defaultValue.isNull()) {
            b.defaultValue(mapper.convertValue(defaultValue, Object.class));
        }
        JsonNode schema = node.get("schema");
        if (schema != null && !schema.isNull()) {
            if (!schema.isObject()) {
                throw new WorkflowParseException(path + ".schema", "expected a field mapping");
            }
            b.fields(fieldMap(mapper, schema, path + ".schema"));
        }
        return b.build();
    }

    private static List<NodeDeclaration> nodes(JsonNode nodes) {
        if (nodes.isEmpty()) {
            throw new WorkflowParseException("nodes", "Workflow must have at least one node");
        }
        List<NodeDeclaration> declarations = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            String path = "nodes[" + i + "]";
            NodeDeclaration node = node(nodes.get(i), path);
            if (!ids.add(node.getId())) {
                throw new WorkflowParseException(
                        path + ".id", "Duplicate node id '" + node.getId() + "'");
            }
            declarations.add(node);
        }
        return declarations;
    }

    private static NodeDeclaration node(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new WorkflowParseException(path, "expected a node mapping");
        }
        NodeDeclaration.Builder b =
                NodeDeclaration.builder(requiredText(node, "id", path + ".id"))
                        .description(textOrNull(node, "description"))
                        .prompt(textOrNull(node, "prompt"));

        JsonNode inputs = node.get("inputs");
        if (inputs != null && !inputs.isNull()) {
            if (!inputs.isObject()) {
                throw new WorkflowParseException(path + ".inputs", "expected a mapping");
            }
            inputs.fields().forEachRemaining(e -> b.input(e.getKey(), e.getValue().asText()));
        }
        if (node.has("output_schema")) {
            b.output(outputSchema(node.get("output_schema"), path + ".output_schema"));
        }
        b.outputs(stringList(node.get("outputs"), path + ".outputs"));

        JsonNode tools = node.get("tools");
        if (tools != null && !tools.isNull()) {
            if (!tools.isArray()) {
                throw new WorkflowParseException(path + ".tools", "expected a list");
            }
            for (int i = 0; i < tools.size(); i++) {
                b.tool(tool(tools.get(i), path + ".tools[" + i + "]"));
            }
        }
        if (node.has("llm")) {
            b.llm(llmConfig(node.get("llm"), path + ".llm"));
        }
        String code = textOrNull(node, "code");
        if (code != null) {
            b.code(new CodeBlock(code, sandbox(node.get("sandbox"), path + ".sandbox")));
        }

        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private static OutputDeclaration outputSchema(JsonNode schema, String path) {
        String type = requiredText(schema, "type", path + ".type");
        if (!OutputDeclaration.OBJECT.equals(type)) {
            return OutputDeclaration.scalar(type);
        }
        JsonNode fields = schema.get("fields");
        if (fields == null || !fields.isArray() || fields.isEmpty()) {
            throw new WorkflowParseException(
                    path, "Output schema with type='object' must have fields");
        }
        List<OutputDeclaration.Field> declared = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            JsonNode field = fields.get(i);
            String fieldPath = path + ".fields[" + i + "]";
            declared.add(
                    new OutputDeclaration.Field(
                            requiredText(field, "name", fieldPath + ".name"),
                            requiredText(field, "type", fieldPath + ".type"),
                            textOrNull(field, "description")));
        }
        return OutputDeclaration.object(declared);
    }

    private static ToolRef tool(JsonNode tool, String path) {
        if (tool.isTextual()) {
            return ToolRef.of(tool.asText());
        }
        String name = requiredText(tool, "name", path + ".name");
        String onError = textOrNull(tool, "on_error");
        if (onError == null) {
            return ToolRef.of(name);
        }
        return switch (onError.toLowerCase(Locale.ROOT)) {
            case "fail" -> new ToolRef(name, ToolRef.OnError.FAIL);
            case "continue" -> new ToolRef(name, ToolRef.OnError.CONTINUE);
            default -> throw new WorkflowParseException(
                    path + ".on_error", "expected 'fail' or 'continue', got '" + onError + "'");
        };
    }

    private static SandboxLimits sandbox(JsonNode sandbox, String path) {
        if (sandbox == null || sandbox.isNull()) {
            return SandboxLimits.DEFAULT;
        }
        SandboxLimits defaults = SandboxLimits.DEFAULT;
        Duration timeout =
                sandbox.has("timeout")
                        ? Duration.ofSeconds(sandbox.get("timeout").asLong())
                        : defaults.timeout();
        boolean network = sandbox.path("network").asBoolean(defaults.network());
        SandboxLimits.Preset preset = defaults.preset();
        String presetName = textOrNull(sandbox, "preset");
        if (presetName != null) {
            try {
                preset = SandboxLimits.Preset.valueOf(presetName.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(
                        path + ".preset",
                        "expected low, medium, high or max, got '" + presetName + "'",
                        e);
            }
        }
        try {
            return new SandboxLimits(timeout, network, preset);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private static LlmConfig llmConfig(JsonNode llm, String path) {
        if (!llm.isObject()) {
            throw new WorkflowParseException(path, "expected a mapping");
        }
        try {
            return new LlmConfig(
                    textOrNull(llm, "provider"),
                    textOrNull(llm, "model"),
                    llm.hasNonNull("temperature") ? llm.get("temperature").asDouble() : null,
                    llm.hasNonNull("max_tokens") ? llm.get("max_tokens").asInt() : null,
                    textOrNull(llm, "api_base"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private static ExecutionDefaults execution(JsonNode execution, String path) {
        ExecutionDefaults defaults = ExecutionDefaults.DEFAULT;
        try {
            return new ExecutionDefaults(
                    execution.path("max_retries").asInt(defaults.maxRetries()),
                    Duration.ofSeconds(
                            execution.path("timeout").asLong(defaults.timeout().toSeconds())),
                    Duration.ofMillis(
                            execution.path("backoff_ms").asLong(defaults.backoffBase().toMillis())),
                    Duration.ofMillis(
                            execution
                                    .path("backoff_max_ms")
                                    .asLong(defaults.backoffMax().toMillis())));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private static List<EdgeDeclaration> edges(JsonNode edges) {
        if (edges.isEmpty()) {
            throw new WorkflowParseException("edges", "Workflow must have at least one edge");
        }
        List<EdgeDeclaration> declarations = new ArrayList<>();
        for (int i = 0; i < edges.size(); i++) {
            declarations.add(edge(edges.get(i), "edges[" + i + "]"));
        }
        return declarations;
    }

    private static EdgeDeclaration edge(JsonNode edge, String path) {
        String from = requiredText(edge, "from", path + ".from");
        int kinds = 0;
        for (String kind : List.of("to", "routes", "loop", "parallel")) {
            if (edge.hasNonNull(kind)) {
                kinds++;
            }
        }
        if (kinds != 1) {
            throw new WorkflowParseException(
                    path,
                    "Edge must have exactly one of 'to' (linear), 'routes' (conditional),"
                            + " 'loop' (iteration) or 'parallel' (fan-out)");
        }

        if (edge.hasNonNull("to")) {
            return new EdgeDeclaration.Linear(from, edge.get("to").asText());
        }
        if (edge.hasNonNull("routes")) {
            return routes(from, edge, path);
        }
        if (edge.hasNonNull("loop")) {
            JsonNode loop = edge.get("loop");
            int max = loop.path("max_iterations").asInt(DEFAULT_LOOP_ITERATIONS);
            return new EdgeDeclaration.LoopBack(
                    from,
                    textOrNull(loop, "reenter"),
                    max,
                    textOrNull(loop, "until"),
                    textOrNull(loop, "exit_to"));
        }
        JsonNode parallel = edge.get("parallel");
        return new EdgeDeclaration.ParallelFanOut(
                from,
                stringList(parallel.get("targets"), path + ".parallel.targets"),
                requiredText(parallel, "join", path + ".parallel.join"));
    }

    private static EdgeDeclaration routes(String from, JsonNode edge, String path) {
        JsonNode routes = edge.get("routes");
        if (!routes.isArray()) {
            throw new WorkflowParseException(path + ".routes", "expected a list");
        }
        List<EdgeDeclaration.Route> guarded = new ArrayList<>();
        String defaultTarget = textOrNull(edge, "default");
        for (int i = 0; i < routes.size(); i++) {
            JsonNode route = routes.get(i);
            String routePath = path + ".routes[" + i + "]";
            String target = requiredText(route, "to", routePath + ".to");
            JsonNode condition = route.get("condition");
            String logic =
                    condition != null && condition.isObject()
                            ? requiredText(condition, "logic", routePath + ".condition.logic")
                            : requiredText(route, "condition", routePath + ".condition");
            if (DEFAULT_ROUTE.equals(logic.trim())) {
                if (defaultTarget != null) {
                    throw new WorkflowParseException(routePath, "more than one default route");
                }
                defaultTarget = target;
            } else {
                guarded.add(new EdgeDeclaration.Route(logic, target));
            }
        }
        return new EdgeDeclaration.ConditionalRoute(from, guarded, defaultTarget);
    }

    private static List<String> stringList(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw new WorkflowParseException(path, "expected a list of strings");
        }
        List<String> values = new ArrayList<>();
        node.forEach(v -> values.add(v.asText()));
        return values;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String requiredText(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new WorkflowParseException(path, "required value is missing");
        }
        return value.asText();
    }

    private static JsonNode requiredObject(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new WorkflowParseException(path, "required mapping is missing");
        }
        return value;
    }

    private static JsonNode requiredArray(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new WorkflowParseException(path, "required list is missing");
        }
        return value;
    }
}
