package work.optiframe.kernel.runtime;

/**
 * Creates a fresh {@link Task} from the values bound to its declared dependencies.
 */
@FunctionalInterface
public interface TaskFactory<T> {
    Task<T> create(TaskInputs inputs) throws Exception;
}
