package work.optiframe.kernel.optimizer;

/**
 * Direction of the objective.
 */
public enum Sense {
    MINIMIZE,
    MAXIMIZE
}
