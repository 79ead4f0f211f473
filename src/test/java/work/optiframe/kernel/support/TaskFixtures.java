package work.optiframe.kernel.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import work.optiframe.kernel.runtime.TaskDefinition;

/**
 * Small data types and task definitions shared by the scheduler tests.
 */
public final class TaskFixtures {
    private TaskFixtures() {}

    public record A(int value) {}

    public record B(int value) {}

    public record C(int value) {}

    public record X(String value) {}

    /**
     * Records the names of tasks in the order they were created.
     */
    public static final class Journal {
        private final List<String> entries = new CopyOnWriteArrayList<>();

        public void record(String name) {
            entries.add(name);
        }

        public List<String> entries() {
            return List.copyOf(entries);
        }
    }

    /** No dependencies, produces {@code A(1)}. */
    public static TaskDefinition<A> produceA(Journal journal) {
        return TaskDefinition.builder("P")
            .produces(A.class)
            .factory(inputs -> {
                journal.record("P");
                return () -> new A(1);
            })
            .build();
    }

    /** Requires {@code A}, produces {@code B(a + 1)}. */
    public static TaskDefinition<B> produceB(Journal journal) {
        return TaskDefinition.builder("Q")
            .requires("a", A.class)
            .produces(B.class)
            .factory(inputs -> {
                journal.record("Q");
                var a = inputs.get("a", A.class);
                return () -> new B(a.value() + 1);
            })
            .build();
    }

    /** Requires {@code B}, produces {@code C(b + 1)}. */
    public static TaskDefinition<C> produceC(Journal journal) {
        return TaskDefinition.builder("R")
            .requires("b", B.class)
            .produces(C.class)
            .factory(inputs -> {
                journal.record("R");
                var b = inputs.get("b", B.class);
                return () -> new C(b.value() + 1);
            })
            .build();
    }
}
