package work.optiframe.kernel.runtime;

import java.util.Objects;

/**
 * A named, typed input of a task.
 */
public record TaskDependency<T>(String param, TypeKey<T> key) {
    public TaskDependency {
        Objects.requireNonNull(param, "param");
        Objects.requireNonNull(key, "key");
    }

    @Override
    public String toString() {
        return param + ": " + key.name();
    }
}
