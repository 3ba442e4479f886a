package io.isoflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.isoflow.core.job.JobSnapshot;
import io.isoflow.core.model.Branch;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.StepTarget;
import io.isoflow.core.model.WorkflowStep;
import io.isoflow.serialization.mixin.BranchMixin;
import io.isoflow.serialization.mixin.WorkflowStepBuilderMixin;
import io.isoflow.serialization.mixin.WorkflowStepMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all isoflow serialization configuration in one place.
///
/// **Custom serializer/deserializer pairs**:
/// - `Flowchart` - `FlowchartSerializer` / `FlowchartDeserializer`; the node map and
///   connection list are written as arrays and rebuilt through the flowchart's own
///   insertion checks
/// - `StepTarget` - `StepTargetSerializer` / `StepTargetDeserializer`; `"next"`, `"end"`
///   or a step number
/// - `JobSnapshot` - `JobSnapshotSerializer`, write-only status payload
///
/// **Mixins**:
/// - `WorkflowStep` + `WorkflowStep.Builder`
/// - `Branch` (hides the derived `implicit` flag)
///
/// Records without a mixin (`Connection`, `ValidationResult`, `ValidationIssue`,
/// `RenderResult`, `AttemptFailure`) bind through their canonical constructors.
///
/// @see FlowchartJson for the convenience factory API
public class IsoflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5521874460931370572L;

    public IsoflowJacksonModule() {
        super("IsoflowJacksonModule");

        addSerializer(Flowchart.class, new FlowchartSerializer());
        addDeserializer(Flowchart.class, new FlowchartDeserializer());

        addSerializer(StepTarget.class, new StepTargetSerializer());
        addDeserializer(StepTarget.class, new StepTargetDeserializer());

        addSerializer(JobSnapshot.class, new JobSnapshotSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(WorkflowStep.class, WorkflowStepMixin.class);
        context.setMixInAnnotations(WorkflowStep.Builder.class, WorkflowStepBuilderMixin.class);

        context.setMixInAnnotations(Branch.class, BranchMixin.class);
    }
}
