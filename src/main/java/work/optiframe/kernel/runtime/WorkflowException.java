package work.optiframe.kernel.runtime;

/**
 * Base type for errors raised by the scheduler itself. Failures thrown by tasks are never wrapped in it.
 */
public class WorkflowException extends RuntimeException {
    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
