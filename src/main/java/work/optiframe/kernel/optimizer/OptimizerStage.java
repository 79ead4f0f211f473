package work.optiframe.kernel.optimizer;

import java.util.Objects;
import work.optiframe.kernel.api.WorkflowTrace;
import work.optiframe.kernel.runtime.InitializedWorkflow;
import work.optiframe.kernel.runtime.Registry;

/**
 * Common state of the optimizer lifecycle stages. Each stage can only advance to the next phase.
 */
abstract class OptimizerStage {
    final InitializedWorkflow workflow;

    OptimizerStage(InitializedWorkflow workflow) {
        this.workflow = Objects.requireNonNull(workflow, "workflow");
    }

    public Registry registry() {
        return workflow.registry();
    }

    public WorkflowTrace trace() {
        return workflow.trace();
    }

    final Registry runPhase(Phase phase) throws Exception {
        return workflow.executeStep(phase.index());
    }
}
