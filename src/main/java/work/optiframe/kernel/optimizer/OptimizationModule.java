package work.optiframe.kernel.optimizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import work.optiframe.kernel.runtime.TaskDefinition;

/**
 * Bundles the tasks one feature of a problem contributes to each phase. Modules are combined by an
 * {@link Optimizer}; the solving phase is reserved for tasks the optimizer itself injects.
 */
public final class OptimizationModule {
    private final String name;
    private final Map<Phase, List<TaskDefinition<?>>> tasks;

    private OptimizationModule(String name, Map<Phase, List<TaskDefinition<?>>> tasks) {
        this.name = name;
        var copy = new EnumMap<Phase, List<TaskDefinition<?>>>(Phase.class);
        tasks.forEach((phase, list) -> copy.put(phase, List.copyOf(list)));
        this.tasks = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<TaskDefinition<?>> tasks(Phase phase) {
        return tasks.getOrDefault(phase, List.of());
    }

    @Override
    public String toString() {
        return "OptimizationModule[" + name + "]";
    }

    public static final class Builder {
        private final String name;
        private final Map<Phase, List<TaskDefinition<?>>> tasks = new EnumMap<>(Phase.class);

        private Builder(String name) {
            this.name = name;
        }

        public Builder validation(TaskDefinition<?>... definitions) {
            return add(Phase.VALIDATION, definitions);
        }

        public Builder preProcessing(TaskDefinition<?>... definitions) {
            return add(Phase.PRE_PROCESSING, definitions);
        }

        public Builder construction(TaskDefinition<?>... definitions) {
            return add(Phase.CONSTRUCTION, definitions);
        }

        public Builder extraction(TaskDefinition<?>... definitions) {
            return add(Phase.EXTRACTION, definitions);
        }

        private Builder add(Phase phase, TaskDefinition<?>... definitions) {
            var list = tasks.computeIfAbsent(phase, ignored -> new ArrayList<>());
            for (var definition : definitions) {
                if (definition == null) {
                    throw new IllegalArgumentException("Module " + name + " has a null task in phase " + phase);
                }
                list.add(definition);
            }
            return this;
        }

        public OptimizationModule build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Optimization modules need a name");
            }
            return new OptimizationModule(name, tasks);
        }
    }
}
