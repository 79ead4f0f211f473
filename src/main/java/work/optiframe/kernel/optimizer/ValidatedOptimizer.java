package work.optiframe.kernel.optimizer;

import work.optiframe.kernel.runtime.InitializedWorkflow;

public final class ValidatedOptimizer extends OptimizerStage {
    ValidatedOptimizer(InitializedWorkflow workflow) {
        super(workflow);
    }

    /**
     * Runs the pre-processing tasks, which may shrink or reshape the data before the model is built.
     */
    public PreProcessedOptimizer preProcess() throws Exception {
        runPhase(Phase.PRE_PROCESSING);
        return new PreProcessedOptimizer(workflow);
    }
}
