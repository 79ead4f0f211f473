package work.optiframe.kernel.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Steps executed so far by a workflow, in order, plus the failure that stopped it if any.
 */
public final class WorkflowTrace {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private final List<StepTrace> steps = new ArrayList<>();
    private Failure failure;

    /**
     * Records a completed step. A failure recorded earlier is cleared, since the run has moved past it.
     */
    public void record(StepTrace trace) {
        steps.add(trace);
        failure = null;
    }

    public void fail(String step, Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        this.failure = new Failure(step, error.getClass().getName(), message);
    }

    public List<StepTrace> steps() {
        return List.copyOf(steps);
    }

    public Optional<Failure> failure() {
        return Optional.ofNullable(failure);
    }

    public Status status() {
        return failure == null ? Status.SUCCESS : Status.FAILURE;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status().name().toLowerCase());
        List<Map<String, Object>> stepMaps = new ArrayList<>();
        for (var step : steps) {
            stepMaps.add(step.toSerializableMap());
        }
        serializable.put("steps", stepMaps);
        if (failure != null) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("step", failure.step());
            error.put("type", failure.type());
            error.put("message", failure.message());
            serializable.put("error", error);
        }
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize workflow trace", ex);
        }
    }

    public record Failure(String step, String type, String message) {}

    public enum Status {
        SUCCESS,
        FAILURE
    }
}
