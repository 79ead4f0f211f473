package work.optiframe.kernel.runtime;

import java.util.Objects;
import work.optiframe.kernel.api.WorkflowTrace;

/**
 * A workflow bound to its registry. Steps can be driven one at a time so callers can act between phases.
 */
public final class InitializedWorkflow {
    private final Workflow workflow;
    private final WorkflowTrace trace = new WorkflowTrace();
    private final Registry registry;

    InitializedWorkflow(Workflow workflow, Registry registry) {
        this.workflow = Objects.requireNonNull(workflow, "workflow");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Workflow workflow() {
        return workflow;
    }

    public Registry registry() {
        return registry;
    }

    public WorkflowTrace trace() {
        return trace;
    }

    /**
     * Adds data that is neither produced by a task nor known at initialization, replacing any value of the
     * same type.
     */
    public InitializedWorkflow addData(Object data) {
        registry.put(Objects.requireNonNull(data, "data"));
        return this;
    }

    /**
     * Executes the step at {@code index} (zero based) against the current registry.
     */
    public Registry executeStep(int index) throws Exception {
        var steps = workflow.steps();
        if (index < 0 || index >= steps.size()) {
            throw new IndexOutOfBoundsException("Workflow has " + steps.size() + " steps, no step at index " + index);
        }
        var step = steps.get(index);
        try {
            trace.record(step.run(registry, workflow.settings()));
        } catch (Exception ex) {
            trace.fail(step.name(), ex);
            throw ex;
        }
        return registry;
    }

    /**
     * Executes all steps in order.
     */
    public Registry executeAll() throws Exception {
        int count = workflow.steps().size();
        for (int index = 0; index < count; index++) {
            executeStep(index);
        }
        return registry;
    }
}
