package work.optiframe.kernel.optimizer;

/**
 * The phases of an optimization run, declared in execution order. Each phase becomes one step.
 */
public enum Phase {
    VALIDATION("validation"),
    PRE_PROCESSING("pre_processing"),
    CONSTRUCTION("construction"),
    SOLVING("solving"),
    EXTRACTION("extraction");

    private final String stepName;

    Phase(String stepName) {
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }

    /**
     * Position of the phase's step within the workflow.
     */
    public int index() {
        return ordinal();
    }
}
