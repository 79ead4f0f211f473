package work.optiframe.kernel.optimizer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.optiframe.kernel.api.SchedulerSettings;
import work.optiframe.kernel.runtime.Step;
import work.optiframe.kernel.runtime.TaskDefinition;
import work.optiframe.kernel.runtime.Workflow;

/**
 * Assembles optimization modules into a workflow with one step per {@link Phase}, in phase order.
 *
 * <p>Phase tasks added directly on the optimizer (creating the problem object, calling a solver, reporting
 * infeasibility) are scheduled ahead of module tasks in the same phase, but are otherwise ordinary tasks.
 */
public final class Optimizer {
    private static final Logger log = LoggerFactory.getLogger(Optimizer.class);

    private final String name;
    private final Sense sense;
    private final List<OptimizationModule> modules = new ArrayList<>();
    private final Map<Phase, List<TaskDefinition<?>>> phaseTasks = new EnumMap<>(Phase.class);
    private SchedulerSettings settings = SchedulerSettings.DEFAULTS;

    public Optimizer(String name) {
        this(name, Sense.MINIMIZE);
    }

    public Optimizer(String name, Sense sense) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Optimizer name must not be blank");
        }
        this.name = name;
        this.sense = Objects.requireNonNull(sense, "sense");
    }

    public String name() {
        return name;
    }

    public Sense sense() {
        return sense;
    }

    public Optimizer addModules(OptimizationModule... newModules) {
        for (var module : newModules) {
            modules.add(Objects.requireNonNull(module, "module"));
        }
        return this;
    }

    public Optimizer addPhaseTasks(Phase phase, TaskDefinition<?>... definitions) {
        Objects.requireNonNull(phase, "phase");
        var list = phaseTasks.computeIfAbsent(phase, ignored -> new ArrayList<>());
        for (var definition : definitions) {
            list.add(Objects.requireNonNull(definition, "task definition"));
        }
        return this;
    }

    public Optimizer settings(SchedulerSettings newSettings) {
        this.settings = Objects.requireNonNull(newSettings, "settings");
        return this;
    }

    public List<OptimizationModule> modules() {
        return List.copyOf(modules);
    }

    /**
     * Builds the phase steps and seeds them with the data describing the problem instance. Which data is
     * needed depends on the modules that were added.
     */
    public InitializedOptimizer initialize(Object... data) {
        var workflow = new Workflow(settings);
        for (var phase : Phase.values()) {
            var step = new Step(phase.stepName());
            step.addTasks(phaseTasks.getOrDefault(phase, List.of()));
            for (var module : modules) {
                step.addTasks(module.tasks(phase));
            }
            workflow.addSteps(step);
        }
        log.debug("Initialized optimizer {} with modules {}", name, modules);
        var initialized = workflow.initialize(data).addData(new ProblemSettings(name, sense));
        return new InitializedOptimizer(initialized);
    }
}
