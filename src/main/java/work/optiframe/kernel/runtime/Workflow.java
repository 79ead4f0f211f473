package work.optiframe.kernel.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.optiframe.kernel.api.SchedulerSettings;

/**
 * An ordered sequence of steps. Later steps may depend on data seeded at initialization or produced by any
 * earlier step.
 */
public final class Workflow {
    private final List<Step> steps = new ArrayList<>();
    private final SchedulerSettings settings;

    public Workflow() {
        this(SchedulerSettings.DEFAULTS);
    }

    public Workflow(SchedulerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Appends steps; they run in the order they are added.
     */
    public Workflow addSteps(Step... newSteps) {
        for (var step : newSteps) {
            steps.add(Objects.requireNonNull(step, "step"));
        }
        return this;
    }

    public List<Step> steps() {
        return List.copyOf(steps);
    }

    public SchedulerSettings settings() {
        return settings;
    }

    /**
     * Seeds a registry with data that no task produces. Each value is keyed by its runtime class;
     * {@code null} values are ignored.
     */
    public InitializedWorkflow initialize(Object... seeds) {
        return new InitializedWorkflow(this, Registry.of(seeds));
    }
}
