package io.flowcraft.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import io.flowcraft.core.execution.RunStatus;
import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    @Test
    void shouldLeaveTextPlainWithoutColor() {
        var styles = AnsiStyles.of(false);

        assertThat(styles.isColorEnabled()).isFalse();
        assertThat(styles.bold("x")).isEqualTo("x");
        assertThat(styles.outcome(true)).isEqualTo("OK");
        assertThat(styles.outcome(false)).isEqualTo("FAILED");
        assertThat(styles.status(RunStatus.CANCELLED)).isEqualTo("→ CANCELLED");
        assertThat(styles.bottleneckTag()).isEqualTo("bottleneck");
        assertThat(styles.checkmark()).isEqualTo("✓");
        assertThat(styles.frameTop()).startsWith("┌─").hasSize(61);
        assertThat(styles.frameBottom()).startsWith("└─");
    }

    @Test
    void shouldWrapTextInResetTerminatedCodes() {
        var styles = AnsiStyles.of(true);

        assertThat(styles.error("boom")).startsWith("\033[").contains("boom").endsWith("\033[0m");
        assertThat(styles.outcomeMarker(true)).isNotEqualTo(styles.outcomeMarker(false));
    }

    @Test
    void shouldColorStatusByOutcome() {
        var styles = AnsiStyles.of(true);

        assertThat(styles.status(RunStatus.COMPLETED))
                .contains("COMPLETED")
                .isNotEqualTo(styles.status(RunStatus.FAILED).replace("FAILED", "COMPLETED"));
        assertThat(styles.status(RunStatus.CANCELLED)).contains("\033[38;5;214m");
    }
}
