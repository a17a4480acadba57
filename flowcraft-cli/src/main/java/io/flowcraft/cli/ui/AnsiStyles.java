package io.flowcraft.cli.ui;

import io.flowcraft.core.execution.RunStatus;

/// Terminal styling for run reports and progress lines.
///
/// Plain text styles (`bold`, `gray`, `accent`, `warn`, `error`) wrap their
/// argument in a reset-terminated ANSI code. The remaining methods render run
/// vocabulary: node outcomes, run statuses, bottleneck tags and the frame
/// drawn around a verbose run.
///
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// out.println(styles.outcomeMarker(ok) + " " + styles.outcome(ok));
/// out.println(styles.status(RunStatus.CANCELLED));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String FRAME = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private static final int FRAME_WIDTH = 60;

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// @param useColor true to apply ANSI codes, false for plain text
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String paint(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return paint(text, BOLD);
    }

    /// Secondary detail such as run ids and timings.
    public String gray(String text) {
        return paint(text, GRAY);
    }

    public String accent(String text) {
        return paint(text, BLUE);
    }

    public String warn(String text) {
        return paint(text, YELLOW);
    }

    public String error(String text) {
        return paint(text, RED);
    }

    public String checkmark() {
        return paint("✓", GREEN);
    }

    public String crossmark() {
        return paint("✗", RED);
    }

    public String bullet() {
        return paint("•", GRAY);
    }

    /// Leading marker of a finished node line.
    public String outcomeMarker(boolean succeeded) {
        return paint("*", succeeded ? GREEN : RED);
    }

    /// `OK` or `FAILED` for a finished node.
    public String outcome(boolean succeeded) {
        return succeeded ? paint("OK", GREEN) : paint("FAILED", RED);
    }

    /// Arrow and status name, colored by how the run ended.
    public String status(RunStatus status) {
        String color =
                switch (status) {
                    case COMPLETED -> GREEN;
                    case FAILED -> RED;
                    case CANCELLED -> YELLOW;
                    case READY, RUNNING -> BLUE;
                };
        return paint("→", BLUE) + " " + paint(status.name(), BOLD + color);
    }

    /// Tag appended to profile rows above the bottleneck threshold.
    public String bottleneckTag() {
        return warn("bottleneck");
    }

    public String frameTop() {
        return frame('┌');
    }

    public String frameBottom() {
        return frame('└');
    }

    private String frame(char corner) {
        return paint(corner + "─".repeat(FRAME_WIDTH), FRAME);
    }
}
