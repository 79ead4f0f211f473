package work.optiframe.kernel.optimizer;

import java.util.Objects;

/**
 * Seeded into every optimizer run so construction tasks can name the problem they build and know which way
 * to optimize.
 */
public record ProblemSettings(String name, Sense sense) {
    public ProblemSettings {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sense, "sense");
    }
}
