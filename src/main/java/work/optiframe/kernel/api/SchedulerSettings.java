package work.optiframe.kernel.api;

import java.util.Objects;

/**
 * Immutable scheduler options shared by every step of a workflow.
 *
 * @param duplicateOutputs how two producers of the same type within one step are treated
 * @param parallelism maximum number of tasks of one pass running at the same time; {@code 1} runs sequentially
 */
public record SchedulerSettings(DuplicateOutputPolicy duplicateOutputs, int parallelism) {
    public static final SchedulerSettings DEFAULTS = builder().build();

    public SchedulerSettings {
        Objects.requireNonNull(duplicateOutputs, "duplicateOutputs");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
    }

    public boolean isParallel() {
        return parallelism > 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().duplicateOutputs(duplicateOutputs).parallelism(parallelism);
    }

    public static final class Builder {
        private DuplicateOutputPolicy duplicateOutputs = DuplicateOutputPolicy.LAST_WRITE_WINS;
        private int parallelism = 1;

        public Builder duplicateOutputs(DuplicateOutputPolicy duplicateOutputs) {
            this.duplicateOutputs = duplicateOutputs;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public SchedulerSettings build() {
            return new SchedulerSettings(duplicateOutputs, parallelism);
        }
    }
}
