package io.flowcraft.cli.commands;

import io.flowcraft.cli.ui.AnsiStyles;
import io.flowcraft.core.compiler.CompiledGraph;
import io.flowcraft.core.compiler.GraphCompiler;
import io.flowcraft.core.compiler.GraphStructureException;
import io.flowcraft.core.state.SchemaBuildException;
import io.flowcraft.core.workflow.WorkflowSpec;
import io.flowcraft.serialization.WorkflowParseException;
import java.io.IOException;
import picocli.CommandLine.Command;

/// Parses and compiles a workflow document without running it.
///
/// Compilation performs every structural check: unknown targets, missing
/// defaults, unreachable nodes, cycles outside loops, overlapping branch
/// outputs and type mismatches between node results and state fields.
///
/// ### Usage
/// ```bash
/// flowcraft validate workflows/article.yaml
/// ```
@Command(name = "validate", description = "Validate a workflow document")
public class WorkflowValidateCommand extends WorkflowCommand {

    @Override
    protected int execute() {
        AnsiStyles styles = styles();
        try {
            WorkflowSpec workflow = loadWorkflow();
            CompiledGraph graph = new GraphCompiler().compile(workflow);

            out().printf(
                    "%s %s%n",
                    styles.checkmark(), styles.bold("Workflow is valid: " + workflow.getName()));
            out().printf(
                    "  %s%n",
                    styles.gray(
                            "State fields: "
                                    + graph.getStateSchema().fields().size()
                                    + " "
                                    + styles.bullet()
                                    + " Nodes: "
                                    + graph.getNodes().size()
                                    + " "
                                    + styles.bullet()
                                    + " Edges: "
                                    + workflow.getEdges().size()));
            return EXIT_OK;
        } catch (IOException e) {
            err().printf("%s Cannot read %s: %s%n", styles.crossmark(), workflowFile, e.getMessage());
            return EXIT_USAGE;
        } catch (WorkflowParseException | SchemaBuildException | GraphStructureException e) {
            err().printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Validation failed:"), e.getMessage());
            return EXIT_FAILED;
        }
    }
}
