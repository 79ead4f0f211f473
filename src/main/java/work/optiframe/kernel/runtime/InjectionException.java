package work.optiframe.kernel.runtime;

/**
 * A task definition cannot be resolved against the registry: malformed dependencies, a missing factory,
 * or an output that does not match what the task declared.
 */
public final class InjectionException extends WorkflowException {
    public InjectionException(String message) {
        super(message);
    }
}
