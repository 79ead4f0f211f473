package work.optiframe.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.optiframe.kernel.support.TaskFixtures.produceA;
import static work.optiframe.kernel.support.TaskFixtures.produceB;
import static work.optiframe.kernel.support.TaskFixtures.produceC;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.optiframe.kernel.api.WorkflowTrace;
import work.optiframe.kernel.support.TaskFixtures.A;
import work.optiframe.kernel.support.TaskFixtures.B;
import work.optiframe.kernel.support.TaskFixtures.C;
import work.optiframe.kernel.support.TaskFixtures.Journal;
import work.optiframe.kernel.support.TaskFixtures.X;

class WorkflowTest {
    private static final TaskDefinition<X> PRODUCE_X = TaskDefinition.builder("produceX")
        .produces(X.class)
        .factory(inputs -> () -> new X("made"))
        .build();

    private static final TaskDefinition<A> CONSUME_X = TaskDefinition.builder("consumeX")
        .requires("x", X.class)
        .produces(A.class)
        .factory(inputs -> {
            var x = inputs.get("x", X.class);
            return () -> new A(x.value().length());
        })
        .build();

    @Test
    void laterStepConsumesEarlierOutput() throws Exception {
        var workflow = new Workflow().addSteps(new Step("first").addTasks(PRODUCE_X), new Step("second").addTasks(CONSUME_X));

        var registry = workflow.initialize().executeAll();

        assertEquals(new X("made"), registry.require(X.class));
        assertEquals(new A(4), registry.require(A.class));
    }

    @Test
    void stepAloneFailsWithoutItsInputs() {
        var workflow = new Workflow().addSteps(new Step("first").addTasks(PRODUCE_X), new Step("second").addTasks(CONSUME_X));
        var initialized = workflow.initialize();

        var error = assertThrows(ScheduleException.class, () -> initialized.executeStep(1));

        assertEquals(List.of("consumeX"), List.copyOf(error.stuckTasks().keySet()));
        assertEquals(TypeKey.of(X.class), error.stuckTasks().get("consumeX").get(0).key());
        assertEquals(WorkflowTrace.Status.FAILURE, initialized.trace().status());
        assertEquals("second", initialized.trace().failure().orElseThrow().step());
    }

    @Test
    void retryAfterLateDataClearsTheFailure() throws Exception {
        var initialized = new Workflow().addSteps(new Step("consume").addTasks(CONSUME_X)).initialize();

        assertThrows(ScheduleException.class, () -> initialized.executeStep(0));
        assertEquals(WorkflowTrace.Status.FAILURE, initialized.trace().status());

        initialized.addData(new X("late"));
        var registry = initialized.executeStep(0);

        assertEquals(new A(4), registry.require(A.class));
        assertEquals(WorkflowTrace.Status.SUCCESS, initialized.trace().status());
        assertTrue(initialized.trace().failure().isEmpty());
    }

    @Test
    void stepsRunOneAtATime() throws Exception {
        var journal = new Journal();
        var workflow = new Workflow().addSteps(
            new Step("a").addTasks(produceA(journal)),
            new Step("b").addTasks(produceB(journal)),
            new Step("c").addTasks(produceC(journal)));
        var initialized = workflow.initialize();

        initialized.executeStep(0);
        assertEquals(List.of("P"), journal.entries());
        initialized.executeStep(1);
        var registry = initialized.executeStep(2);

        assertEquals(new C(3), registry.require(C.class));
        assertEquals(List.of("a", "b", "c"),
            initialized.trace().steps().stream().map(step -> step.step()).toList());
        assertEquals(WorkflowTrace.Status.SUCCESS, initialized.trace().status());
    }

    @Test
    void seedsAreKeyedByTypeAndNullsIgnored() throws Exception {
        var journal = new Journal();
        var workflow = new Workflow().addSteps(new Step("b").addTasks(produceB(journal)));

        var registry = workflow.initialize(new A(1), null, new A(9)).executeAll();

        assertEquals(new B(10), registry.require(B.class));
    }

    @Test
    void addDataMakesLateInputsAvailable() throws Exception {
        var initialized = new Workflow().addSteps(new Step("consume").addTasks(CONSUME_X)).initialize();
        initialized.addData(new X("late!"));

        assertEquals(new A(5), initialized.executeAll().require(A.class));
    }

    @Test
    void rejectsUnknownStepIndex() {
        var initialized = new Workflow().addSteps(new Step("only")).initialize();
        assertThrows(IndexOutOfBoundsException.class, () -> initialized.executeStep(1));
        assertThrows(IndexOutOfBoundsException.class, () -> initialized.executeStep(-1));
    }

    @Test
    void failureStopsRemainingSteps() {
        var journal = new Journal();
        var failing = TaskDefinition.builder("explode")
            .factory(inputs -> () -> {
                throw new IllegalStateException("boom");
            })
            .build();
        var workflow = new Workflow().addSteps(new Step("bad").addTasks(failing), new Step("never").addTasks(produceA(journal)));
        var initialized = workflow.initialize();

        var error = assertThrows(IllegalStateException.class, initialized::executeAll);

        assertEquals("boom", error.getMessage());
        assertTrue(journal.entries().isEmpty());
        assertTrue(initialized.trace().toPrettyJson().contains("\"status\" : \"failure\""));
    }
}
