package work.optiframe.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values bound to the declared dependencies of one task execution, addressed by parameter name.
 */
public final class TaskInputs {
    private final String task;
    private final Map<String, TaskDependency<?>> dependencies;
    private final Map<String, Object> values;

    TaskInputs(String task, List<TaskDependency<?>> dependencies, Registry source) {
        this.task = task;
        var declared = new LinkedHashMap<String, TaskDependency<?>>();
        var bound = new LinkedHashMap<String, Object>();
        for (var dependency : dependencies) {
            declared.put(dependency.param(), dependency);
            bound.put(dependency.param(), source.require(dependency.key()));
        }
        this.dependencies = Collections.unmodifiableMap(declared);
        this.values = Collections.unmodifiableMap(bound);
    }

    public <T> T get(String param, TypeKey<T> key) {
        var dependency = dependencies.get(param);
        if (dependency == null) {
            throw new InjectionException("Task " + task + " has no dependency named '" + param + "'");
        }
        if (!dependency.key().equals(key)) {
            throw new InjectionException("Task " + task + " declared '" + dependency
                + "' but requested it as " + key.name());
        }
        return key.cast(values.get(param));
    }

    public <T> T get(String param, Class<T> type) {
        return get(param, TypeKey.of(type));
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
