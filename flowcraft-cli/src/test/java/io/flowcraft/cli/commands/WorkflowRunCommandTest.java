package io.flowcraft.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("flowcraft run")
class WorkflowRunCommandTest extends CommandTestSupport {

    @Nested
    @DisplayName("with the stub LLM")
    class Stubbed {

        @Test
        void shouldPrintFinalState() throws Exception {
            var file = write("demo.yaml", DEMO_WORKFLOW);

            int exitCode = run("run", "--stub", "--no-color", file.toString(), "-i", "topic=tides");

            assertThat(exitCode).isZero();
            assertThat(out.toString())
                    .contains("Workflow loaded: demo")
                    .contains("LLM: stub")
                    .contains("Workflow completed successfully!")
                    .contains("topic: tides")
                    .contains("draft: stub result");
        }

        @Test
        void shouldReadInputValuesAsJsonWhenTheyParse() throws Exception {
            var file = write("demo.yaml", DEMO_WORKFLOW);

            int exitCode =
                    run(
                            "run", "--stub", "--no-color", file.toString(),
                            "-i", "topic=tides", "-i", "count=3");

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("count: 3");
        }

        @Test
        void shouldMergeContextFileWithInputOverrides() throws Exception {
            var file = write("demo.yaml", DEMO_WORKFLOW);
            var context = write("inputs.json", "{\"topic\": \"reefs\", \"count\": 2}");

            int exitCode =
                    run(
                            "run", "--stub", "--no-color", file.toString(),
                            "-c", context.toString(), "-i", "count=5");

            assertThat(exitCode).isZero();
            assertThat(out.toString()).contains("topic: reefs").contains("count: 5");
        }

        @Test
        void shouldRejectMissingRequiredInputs() throws Exception {
            var file = write("demo.yaml", DEMO_WORKFLOW);

            int exitCode = run("run", "--stub", "--no-color", file.toString());

            assertThat(exitCode).isEqualTo(2);
            assertThat(err.toString())
                    .contains("Invalid inputs")
                    .contains("required field is missing");
        }

        @Test
        void shouldPrintProgressWhenVerbose() throws Exception {
            var file = write("demo.yaml", DEMO_WORKFLOW);

            run("run", "--stub", "--no-color", "-v", file.toString(), "-i", "topic=tides");

            assertThat(out.toString())
                    .contains("START [write]")
                    .contains("DONE  [write]")
                    .contains("COMPLETED");
        }

        @Test
        void shouldPrintProfile() throws Exception {
            var file = write("demo.yaml", DEMO_WORKFLOW);

            run("run", "--stub", "--no-color", "--profile", file.toString(), "-i", "topic=x");

            assertThat(out.toString()).contains("Profile (total").contains("write").contains("Cost:");
        }

        @Test
        void shouldPrintJsonReports() throws Exception {
            var file = write("demo.yaml", DEMO_WORKFLOW);

            int exitCode =
                    run("run", "--stub", "--json", file.toString(), "-i", "topic=tides");

            assertThat(exitCode).isZero();
            var json = new ObjectMapper().readTree(out.toString());
            assertThat(json.get("status").asText()).isEqualTo("COMPLETED");
            assertThat(json.get("state").get("draft").asText()).isEqualTo("stub result");
            assertThat(json.get("records")).hasSize(1);
        }

        @Test
        void shouldExitWithFailureWhenANodeFails() throws Exception {
            var file =
                    write(
                            "code.yaml",
                            DEMO_WORKFLOW.replace(
                                    "prompt: \"Write {count} lines about {topic}\"",
                                    "code: \"result = 'x'\""));

            int exitCode = run("run", "--stub", "--no-color", file.toString(), "-i", "topic=t");

            assertThat(exitCode).isEqualTo(1);
            assertThat(out.toString())
                    .contains("Workflow failed:")
                    .contains("no sandbox capability is configured");
        }
    }

    @Test
    void shouldRejectMalformedContext() throws Exception {
        var file = write("demo.yaml", DEMO_WORKFLOW);

        int exitCode = run("run", "--stub", "--no-color", file.toString(), "-c", "{not json");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Cannot read input");
    }
}
