package work.optiframe.kernel.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The schedule a step actually ran: one entry per pass, each listing task names in execution order.
 */
public record StepTrace(String step, List<List<String>> passes) {
    public StepTrace {
        Objects.requireNonNull(step, "step");
        var copy = new ArrayList<List<String>>();
        if (passes != null) {
            for (var pass : passes) {
                copy.add(List.copyOf(pass));
            }
        }
        passes = List.copyOf(copy);
    }

    /**
     * All executed tasks, flattened in schedule order.
     */
    public List<String> executionOrder() {
        var order = new ArrayList<String>();
        passes.forEach(order::addAll);
        return order;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("step", step);
        serializable.put("passes", passes);
        return serializable;
    }
}
