package io.flowcraft.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flowcraft.core.execution.ExecutionRecord;
import io.flowcraft.core.execution.ExecutionResult;
import io.flowcraft.core.profiling.BottleneckSummary;
import java.util.List;

/// Writes run outcomes, traces and profiling summaries as JSON.
///
/// A run result is written as one object:
/// {@snippet lang=json :
/// {
///   "runId": "3f0c...",
///   "status": "COMPLETED",
///   "state": {"topic": "tides", "draft": "..."},
///   "records": [ ... ]
/// }
/// }
/// `FAILED` results carry `error` and `state` (the last committed state);
/// `CANCELLED` results carry only records; `PENDING` results carry only the run id.
public final class ExecutionReportWriter {

    private ExecutionReportWriter() {}

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ExecutionResult result) {
        ObjectMapper mapper = WorkflowParser.createMapper();
        return write(mapper, resultTree(mapper, result));
    }

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(List<ExecutionRecord> records) {
        return write(WorkflowParser.createMapper(), records);
    }

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(BottleneckSummary summary) {
        return write(WorkflowParser.createMapper(), summary);
    }

    static ObjectNode resultTree(ObjectMapper mapper, ExecutionResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("runId", result.runId());
        if (result instanceof ExecutionResult.Completed completed) {
            root.put("status", "COMPLETED");
            root.set("state", mapper.valueToTree(completed.finalState()));
            root.set("records", mapper.valueToTree(completed.records()));
        } else if (result instanceof ExecutionResult.Failure failure) {
            root.put("status", "FAILED");
            root.put("error", failure.error().getMessage());
            root.set("state", mapper.valueToTree(failure.lastState()));
            root.set("records", mapper.valueToTree(failure.records()));
        } else if (result instanceof ExecutionResult.Cancelled cancelled) {
            root.put("status", "CANCELLED");
            root.set("records", mapper.valueToTree(cancelled.records()));
        } else {
            root.put("status", "PENDING");
        }
        return root;
    }

    private static String write(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to write report: " + e.getMessage(), e);
        }
    }
}
