package io.flowcraft.cli.execution;

import io.flowcraft.cli.ui.AnsiStyles;
import io.flowcraft.core.execution.ExecutionListener;
import io.flowcraft.core.execution.ExecutionRecord;
import io.flowcraft.core.execution.RunStatus;
import java.io.PrintWriter;

/// Execution listener that prints node progress to the terminal.
///
/// ### Output Format
/// ```
/// ┌─────────────────────────────────────────────────────────────
///   * START [write]
///   ↻ RETRY [write] attempt 2: rate limited
///   * DONE  [write] 812 ms • 130 tokens • $0.0004 (OK)
/// └─────────────────────────────────────────────────────────────
/// ```
///
/// @implNote Thread-safe. Each event is printed under the listener's lock so
/// lines from parallel branches do not interleave.
public class VerboseExecutionListener implements ExecutionListener {

    private final PrintWriter out;
    private final AnsiStyles styles;

    /// @param out destination for progress lines, not null
    /// @param useColor whether to apply ANSI color codes
    public VerboseExecutionListener(PrintWriter out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public synchronized void onRunStart(String runId, String workflowName) {
        out.println(styles.frameTop());
        out.printf("  %s %s %s%n", styles.bold(workflowName), styles.bullet(), styles.gray(runId));
        out.flush();
    }

    @Override
    public synchronized void onNodeStart(String runId, String nodeId) {
        out.printf("  %s %s [%s]%n", styles.accent("*"), styles.bold("START"), nodeId);
        out.flush();
    }

    @Override
    public synchronized void onRetry(String runId, String nodeId, int attempt, Throwable cause) {
        out.printf(
                "  %s %s [%s] attempt %d: %s%n",
                styles.warn("↻"), styles.bold("RETRY"), nodeId, attempt, cause.getMessage());
        out.flush();
    }

    @Override
    public synchronized void onNodeComplete(String runId, ExecutionRecord record) {
        boolean ok = record.succeeded();
        String detail =
                record.duration().toMillis()
                        + " ms "
                        + styles.bullet()
                        + " "
                        + record.usage().totalTokens()
                        + " tokens "
                        + styles.bullet()
                        + " $"
                        + String.format("%.4f", record.cost());
        if (record.iteration() != null) {
            detail += " " + styles.bullet() + " pass " + (record.iteration() + 1);
        }
        out.printf(
                "  %s %s  [%s] %s (%s)%n",
                styles.outcomeMarker(ok),
                styles.bold("DONE"),
                record.nodeId(),
                styles.gray(detail),
                styles.outcome(ok));
        if (!ok) {
            String phase = record.failedPhase() != null ? record.failedPhase().label() + ": " : "";
            out.printf("      %s%n", styles.error(phase + record.error()));
        }
        out.flush();
    }

    @Override
    public synchronized void onRunComplete(String runId, RunStatus status) {
        out.printf("  %s%n", styles.status(status));
        out.println(styles.frameBottom());
        out.flush();
    }
}
