package work.optiframe.kernel.optimizer;

import work.optiframe.kernel.runtime.InitializedWorkflow;

public final class PreProcessedOptimizer extends OptimizerStage {
    PreProcessedOptimizer(InitializedWorkflow workflow) {
        super(workflow);
    }

    public BuiltOptimizer build() throws Exception {
        runPhase(Phase.CONSTRUCTION);
        return new BuiltOptimizer(workflow);
    }
}
