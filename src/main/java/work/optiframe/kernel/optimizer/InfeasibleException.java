package work.optiframe.kernel.optimizer;

/**
 * Thrown by solving tasks when the optimization problem has no solution.
 */
public class InfeasibleException extends Exception {
    public InfeasibleException() {
        this("The optimization problem does not have a solution");
    }

    public InfeasibleException(String message) {
        super(message);
    }
}
