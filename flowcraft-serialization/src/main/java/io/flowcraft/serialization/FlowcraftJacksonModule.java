package io.flowcraft.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.flowcraft.core.execution.ExecutionRecord;
import io.flowcraft.core.profiling.BottleneckSummary;
import io.flowcraft.core.state.StateContainer;
import io.flowcraft.core.workflow.WorkflowSpec;
import io.flowcraft.serialization.mixin.BottleneckSummaryMixin;
import io.flowcraft.serialization.mixin.ExecutionRecordMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Flowcraft serialization configuration.
///
/// - `WorkflowSpec` - read by `WorkflowSpecDeserializer` from JSON or YAML documents
/// - `StateContainer` - written by `StateContainerSerializer` as a plain value object
/// - `ExecutionRecord`, `BottleneckSummary` - records written through their
///   components, with mixins dropping null components
///
/// @see WorkflowParser for the document-reading API
/// @see ExecutionReportWriter for the report-writing API
public class FlowcraftJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4432187659021847730L;

    public FlowcraftJacksonModule() {
        super("FlowcraftJacksonModule");

        addDeserializer(WorkflowSpec.class, new WorkflowSpecDeserializer());
        addSerializer(StateContainer.class, new StateContainerSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(ExecutionRecord.class, ExecutionRecordMixin.class);
        context.setMixInAnnotations(BottleneckSummary.class, BottleneckSummaryMixin.class);
    }
}
