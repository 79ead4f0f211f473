package work.optiframe.kernel.optimizer;

import work.optiframe.kernel.runtime.InitializedWorkflow;
import work.optiframe.kernel.runtime.Registry;

/**
 * An optimizer seeded with a concrete problem instance.
 */
public final class InitializedOptimizer extends OptimizerStage {
    InitializedOptimizer(InitializedWorkflow workflow) {
        super(workflow);
    }

    /**
     * Runs the validation tasks against the seeded data.
     */
    public ValidatedOptimizer validate() throws Exception {
        runPhase(Phase.VALIDATION);
        return new ValidatedOptimizer(workflow);
    }

    /**
     * Shorthand for {@code validate().preProcess().build().solve(solveData)}.
     */
    public Registry solve(Object... solveData) throws Exception {
        return validate().preProcess().build().solve(solveData);
    }
}
