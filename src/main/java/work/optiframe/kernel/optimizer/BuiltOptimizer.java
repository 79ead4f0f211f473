package work.optiframe.kernel.optimizer;

import work.optiframe.kernel.runtime.InitializedWorkflow;
import work.optiframe.kernel.runtime.Registry;

/**
 * An optimizer whose model has been constructed. The registry holds whatever the construction tasks produced
 * and can be inspected before solving.
 */
public final class BuiltOptimizer extends OptimizerStage {
    BuiltOptimizer(InitializedWorkflow workflow) {
        super(workflow);
    }

    /**
     * Adds {@code solveData} (solver selection, limits, ...) to the registry, then runs the solving and
     * extraction phases.
     *
     * @return the final registry
     */
    public Registry solve(Object... solveData) throws Exception {
        if (solveData != null) {
            for (Object data : solveData) {
                if (data != null) {
                    workflow.addData(data);
                }
            }
        }
        runPhase(Phase.SOLVING);
        return runPhase(Phase.EXTRACTION);
    }
}
