package io.flowcraft.cli.commands;

import io.flowcraft.cli.ui.AnsiStyles;
import io.flowcraft.core.workflow.WorkflowSpec;
import io.flowcraft.serialization.WorkflowParser;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/// Base class for commands that operate on one workflow document.
///
/// ### Exit Codes
/// - `0` - success
/// - `1` - the workflow ran but did not complete, or failed validation
/// - `2` - the document or inputs could not be read
///
/// @implNote Subclasses must be annotated with `@Command` and write through
/// {@link #out()} and {@link #err()} so tests can capture output.
public abstract class WorkflowCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Spec protected CommandSpec spec;

    @Parameters(index = "0", description = "Workflow document (.yaml, .yml or .json)")
    protected Path workflowFile;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    protected boolean color = true;

    @Override
    public final Integer call() {
        return execute();
    }

    protected abstract int execute();

    /// Reads the workflow document named on the command line.
    ///
    /// @throws IOException if the file cannot be read
    /// @throws io.flowcraft.serialization.WorkflowParseException if the document is malformed
    protected WorkflowSpec loadWorkflow() throws IOException {
        return WorkflowParser.read(workflowFile);
    }

    protected AnsiStyles styles() {
        return AnsiStyles.of(color);
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
