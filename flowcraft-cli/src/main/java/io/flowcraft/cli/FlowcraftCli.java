package io.flowcraft.cli;

import io.flowcraft.cli.commands.WorkflowRunCommand;
import io.flowcraft.cli.commands.WorkflowValidateCommand;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Flowcraft CLI.
///
/// - `run` - execute a workflow document and print its outcome
/// - `validate` - parse and compile a workflow document without running it
///
/// @see WorkflowRunCommand
/// @see WorkflowValidateCommand
@Command(
        name = "flowcraft",
        description = "Declarative LLM workflow engine",
        mixinStandardHelpOptions = true,
        version = "flowcraft 0.1.0",
        subcommands = {WorkflowRunCommand.class, WorkflowValidateCommand.class})
public class FlowcraftCli {

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new CommandLine(new FlowcraftCli()).execute(args);
        System.exit(exitCode);
    }

    /// Loads `logging.properties` from the classpath into `java.util.logging`.
    static void configureLogging() {
        try (InputStream in = FlowcraftCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging configuration: " + e.getMessage());
        }
    }
}
