package work.optiframe.kernel.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.optiframe.kernel.api.DuplicateOutputPolicy;
import work.optiframe.kernel.api.SchedulerSettings;
import work.optiframe.kernel.api.StepTrace;

/**
 * A named set of tasks executed together. The order is not declared: each pass runs every pending task whose
 * dependencies are all present in the registry, until nothing is pending or a pass makes no progress.
 */
public final class Step {
    private static final Logger log = LoggerFactory.getLogger(Step.class);

    private final String name;
    private final List<TaskDefinition<?>> tasks = new ArrayList<>();

    public Step(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name must not be blank");
        }
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Registers tasks to run in this step. Registration order only breaks ties within a pass.
     *
     * @throws InjectionException if a task name is already taken in this step
     */
    public Step addTasks(TaskDefinition<?>... definitions) {
        return addTasks(List.of(definitions));
    }

    public Step addTasks(Collection<? extends TaskDefinition<?>> definitions) {
        for (var definition : definitions) {
            Objects.requireNonNull(definition, "task definition");
            for (var existing : tasks) {
                if (existing.name().equals(definition.name())) {
                    throw new InjectionException("Step " + name + " already has a task named " + definition.name());
                }
            }
            tasks.add(definition);
        }
        return this;
    }

    public List<TaskDefinition<?>> tasks() {
        return List.copyOf(tasks);
    }

    public Registry execute(Registry registry) throws Exception {
        return execute(registry, SchedulerSettings.DEFAULTS);
    }

    public Registry execute(Registry registry, SchedulerSettings settings) throws Exception {
        run(registry, settings);
        return registry;
    }

    /**
     * Executes every task exactly once against {@code registry}, storing their outputs in it.
     *
     * @return the passes that were run
     * @throws ScheduleException if a pass makes no progress while tasks are pending
     * @throws InjectionException if a task cannot be bound or its output does not match its declaration
     * @throws Exception whatever a task throws; remaining tasks are not run and the registry keeps the
     *     outputs stored so far
     */
    public StepTrace run(Registry registry, SchedulerSettings settings) throws Exception {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(settings, "settings");
        long started = System.nanoTime();
        log.info("Executing step {}...", name);

        if (settings.duplicateOutputs() == DuplicateOutputPolicy.REJECT) {
            rejectDuplicateOutputs();
        }

        var pending = new ArrayList<>(tasks);
        var passes = new ArrayList<List<String>>();
        while (!pending.isEmpty()) {
            var snapshot = registry.snapshot();
            var ready = new ArrayList<TaskDefinition<?>>();
            var stuck = new LinkedHashMap<String, List<TaskDependency<?>>>();
            for (var task : pending) {
                var missing = task.missingDependencies(snapshot);
                if (missing.isEmpty()) {
                    ready.add(task);
                } else {
                    stuck.put(task.name(), missing);
                }
            }
            if (ready.isEmpty()) {
                throw new ScheduleException(name, stuck);
            }

            var names = names(ready);
            log.debug("Step {} pass {} runs {}", name, passes.size() + 1, names);
            if (settings.isParallel() && ready.size() > 1) {
                runConcurrently(ready, snapshot, registry, settings.parallelism());
            } else {
                for (var task : ready) {
                    Outcome.of(task, snapshot).writeTo(registry);
                }
            }
            passes.add(names);
            pending.removeAll(ready);
        }

        var elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.info("Finished step {} in {}s.", name, String.format(Locale.ROOT, "%.2f", elapsed.toMillis() / 1000.0));
        return new StepTrace(name, passes);
    }

    private void runConcurrently(List<TaskDefinition<?>> ready, Registry snapshot, Registry registry, int parallelism)
        throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, ready.size()), workerThreads());
        try {
            var futures = new ArrayList<Future<Outcome<?>>>();
            for (var task : ready) {
                Callable<Outcome<?>> call = () -> Outcome.of(task, snapshot);
                futures.add(pool.submit(call));
            }
            var outcomes = new ArrayList<Outcome<?>>();
            for (var future : futures) {
                try {
                    outcomes.add(future.get());
                } catch (ExecutionException ex) {
                    futures.forEach(pending -> pending.cancel(true));
                    throw unwrap(ex);
                } catch (InterruptedException ex) {
                    futures.forEach(pending -> pending.cancel(true));
                    Thread.currentThread().interrupt();
                    throw new WorkflowException("Interrupted while executing step " + name, ex);
                }
            }
            for (var outcome : outcomes) {
                outcome.writeTo(registry);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void rejectDuplicateOutputs() {
        Map<TypeKey<?>, String> producers = new LinkedHashMap<>();
        for (var task : tasks) {
            var output = task.output();
            if (output.isEmpty()) {
                continue;
            }
            var previous = producers.putIfAbsent(output.get(), task.name());
            if (previous != null) {
                throw new InjectionException("Tasks " + previous + " and " + task.name() + " of step " + name
                    + " both produce " + output.get().name());
            }
        }
    }

    private ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "optiframe-" + name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static Exception unwrap(ExecutionException ex) {
        var cause = ex.getCause();
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof Exception exception) {
            return exception;
        }
        return ex;
    }

    private static List<String> names(List<TaskDefinition<?>> definitions) {
        var names = new ArrayList<String>(definitions.size());
        for (var definition : definitions) {
            names.add(definition.name());
        }
        return names;
    }

    @Override
    public String toString() {
        return "Step[" + name + ", tasks=" + names(tasks) + "]";
    }

    private record Outcome<T>(TaskDefinition<T> task, Optional<T> value) {
        static <T> Outcome<T> of(TaskDefinition<T> task, Registry snapshot) throws Exception {
            log.debug("Running task {}", task.name());
            return new Outcome<>(task, task.run(snapshot));
        }

        void writeTo(Registry registry) {
            if (value.isEmpty()) {
                return;
            }
            var key = task.output().orElseThrow();
            registry.set(key, value.get())
                .ifPresent(previous -> log.debug("Task {} replaced the existing {}", task.name(), key.name()));
        }
    }
}
