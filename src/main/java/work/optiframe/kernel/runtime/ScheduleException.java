package work.optiframe.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A pass over the pending tasks of a step made no progress. Covers circular dependencies as well as data
 * that is neither seeded nor produced by any task.
 */
public final class ScheduleException extends WorkflowException {
    private final String step;
    private final Map<String, List<TaskDependency<?>>> stuckTasks;

    public ScheduleException(String step, Map<String, List<TaskDependency<?>>> stuckTasks) {
        super(describe(step, stuckTasks));
        this.step = step;
        this.stuckTasks = Collections.unmodifiableMap(new LinkedHashMap<>(stuckTasks));
    }

    public String step() {
        return step;
    }

    /**
     * Pending task names, in registration order, mapped to the dependencies they are still missing.
     */
    public Map<String, List<TaskDependency<?>>> stuckTasks() {
        return stuckTasks;
    }

    private static String describe(String step, Map<String, List<TaskDependency<?>>> stuckTasks) {
        var details = stuckTasks.entrySet().stream()
            .map(entry -> "- " + entry.getKey() + ": " + entry.getValue())
            .collect(Collectors.joining("\n"));
        return "The tasks of step '" + step + "' could not be scheduled, "
            + stuckTasks.keySet() + " have unfulfilled dependencies:\n" + details;
    }
}
