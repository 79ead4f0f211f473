package work.optiframe.kernel.runtime;

/**
 * A unit of work created by a {@link TaskFactory} once its dependencies are available. Executed exactly once;
 * the returned value (if the definition declares an output) is stored in the registry for later tasks.
 */
@FunctionalInterface
public interface Task<T> {
    T execute() throws Exception;
}
