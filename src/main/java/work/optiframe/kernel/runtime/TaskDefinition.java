package work.optiframe.kernel.runtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Describes a task to the scheduler: its ordered dependencies, the type it produces (if any) and how to
 * construct it. The scheduler infers execution order from these declarations alone.
 */
public final class TaskDefinition<T> {
    private final String name;
    private final List<TaskDependency<?>> dependencies;
    private final TypeKey<T> output;
    private final TaskFactory<T> factory;

    private TaskDefinition(String name, List<TaskDependency<?>> dependencies, TypeKey<T> output, TaskFactory<T> factory) {
        this.name = name;
        this.dependencies = List.copyOf(dependencies);
        this.output = output;
        this.factory = factory;
    }

    public static Builder<Void> builder(String name) {
        return new Builder<>(name, new ArrayList<>(), null);
    }

    public String name() {
        return name;
    }

    public List<TaskDependency<?>> dependencies() {
        return dependencies;
    }

    public Optional<TypeKey<T>> output() {
        return Optional.ofNullable(output);
    }

    /**
     * Dependencies whose key is absent from {@code registry}, in declaration order.
     */
    public List<TaskDependency<?>> missingDependencies(Registry registry) {
        var missing = new ArrayList<TaskDependency<?>>();
        for (var dependency : dependencies) {
            if (!registry.contains(dependency.key())) {
                missing.add(dependency);
            }
        }
        return missing;
    }

    /**
     * Binds the dependencies from {@code registry}, creates the task and runs it.
     *
     * @return the produced value, or empty for tasks without an output
     */
    Optional<T> run(Registry registry) throws Exception {
        Task<T> task = factory.create(new TaskInputs(name, dependencies, registry));
        if (task == null) {
            throw new InjectionException("Factory of task " + name + " returned no task");
        }
        T result = task.execute();
        if (output == null) {
            if (result != null) {
                throw new InjectionException("Task " + name + " returned data of type "
                    + result.getClass().getName() + ", but declares no output. "
                    + "This prevents the data from being accessible to other tasks.");
            }
            return Optional.empty();
        }
        if (result == null) {
            throw new InjectionException("Task " + name + " declares output " + output.name() + " but returned nothing");
        }
        if (!output.accepts(result)) {
            throw new InjectionException("Task " + name + " declares output " + output.name()
                + " but returned " + result.getClass().getName());
        }
        return Optional.of(result);
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder<T> {
        private final String name;
        private final List<TaskDependency<?>> dependencies;
        private final TypeKey<T> output;
        private TaskFactory<T> factory;

        private Builder(String name, List<TaskDependency<?>> dependencies, TypeKey<T> output) {
            this.name = name;
            this.dependencies = dependencies;
            this.output = output;
        }

        public Builder<T> requires(String param, Class<?> type) {
            if (type == null) {
                throw new InjectionException("Dependency '" + param + "' of task " + name + " has no type");
            }
            return requires(param, TypeKey.of(type));
        }

        public Builder<T> requires(String param, TypeKey<?> key) {
            if (param == null || param.isBlank()) {
                throw new InjectionException("Task " + name + " declares a dependency without a name");
            }
            if (key == null) {
                throw new InjectionException("Dependency '" + param + "' of task " + name + " has no type");
            }
            dependencies.add(new TaskDependency<>(param, key));
            return this;
        }

        /**
         * Declares the output type. Resets any factory set so far, since its type no longer matches.
         */
        public <R> Builder<R> produces(Class<R> type) {
            if (type == null) {
                throw new InjectionException("Output of task " + name + " has no type");
            }
            return produces(TypeKey.of(type));
        }

        public <R> Builder<R> produces(TypeKey<R> key) {
            if (key == null) {
                throw new InjectionException("Output of task " + name + " has no type");
            }
            return new Builder<>(name, new ArrayList<>(dependencies), key);
        }

        public Builder<T> factory(TaskFactory<T> factory) {
            this.factory = factory;
            return this;
        }

        public TaskDefinition<T> build() {
            if (name == null || name.isBlank()) {
                throw new InjectionException("Task definitions need a name");
            }
            if (factory == null) {
                throw new InjectionException("Task " + name + " has no factory");
            }
            var seen = new HashSet<String>();
            for (var dependency : dependencies) {
                if (!seen.add(dependency.param())) {
                    throw new InjectionException("Task " + name + " declares dependency '"
                        + dependency.param() + "' more than once");
                }
            }
            return new TaskDefinition<>(name, dependencies, output, factory);
        }
    }
}
