package taskengine.dispatch;

import org.junit.jupiter.api.Test;
import taskengine.Affinity;
import taskengine.RecordingMetricsExporter;
import taskengine.Task;
import taskengine.TaskState;
import taskengine.registry.DefaultTaskTypeRegistry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskRunnerTest {

    private final DefaultTaskTypeRegistry registry = new DefaultTaskTypeRegistry();
    private final RecordingMetricsExporter metrics = new RecordingMetricsExporter();
    private final TaskRunner runner = new TaskRunner(registry, metrics);

    private static Task task(String type, Map<String, ?> payload) {
        return Task.builder(1, type)
                .created(Instant.EPOCH)
                .affinity(Affinity.SERIAL)
                .state(TaskState.PROCESSING)
                .payload(payload)
                .build();
    }

    @Test
    void handlerReturnValueBecomesResult() {
        registry.register("echo", t -> t.payload().get("msg"));

        TaskOutcome outcome = runner.run(task("echo", Map.of("msg", "hi")));

        assertTrue(outcome.isComplete());
        assertEquals("hi", outcome.result());
        assertNull(outcome.errors());
        assertEquals(Map.of("state", TaskState.COMPLETE, "result", "hi"), outcome.changes());
        assertEquals(1, metrics.handlerDurations.get());
    }

    @Test
    void nullResultIsStillComplete() {
        registry.register("noop", t -> null);

        TaskOutcome outcome = runner.run(task("noop", null));

        assertEquals(TaskState.COMPLETE, outcome.state());
        assertNull(outcome.result());
        assertTrue(outcome.changes().containsKey("result"));
    }

    @Test
    void handlerExceptionBecomesFailure() {
        registry.register("boom", t -> {
            throw new IllegalStateException("motor jammed");
        });

        TaskOutcome outcome = runner.run(task("boom", null));

        assertEquals(TaskState.FAILED, outcome.state());
        assertEquals(List.of("motor jammed"), outcome.errors());
        assertEquals(List.of("motor jammed"), outcome.changes().get("errors"));
    }

    @Test
    void exceptionWithoutMessageUsesClassName() {
        registry.register("npe", t -> {
            throw new NullPointerException();
        });

        TaskOutcome outcome = runner.run(task("npe", null));

        assertEquals(List.of(NullPointerException.class.getName()), outcome.errors());
    }

    @Test
    void missingHandlerFailsWithoutInvokingAnything() {
        TaskOutcome outcome = runner.run(task("unknown", null));

        assertEquals(TaskState.FAILED, outcome.state());
        assertEquals(List.of("No handler for task type unknown"), outcome.errors());
        assertEquals(0, metrics.handlerDurations.get());
    }

    @Test
    void interruptedHandlerFailsWithoutInterruptingCaller() {
        registry.register("sleepy", t -> {
            throw new InterruptedException("woken");
        });

        TaskOutcome outcome = runner.run(task("sleepy", null));

        assertEquals(List.of("woken"), outcome.errors());
        assertEquals(TaskState.FAILED, outcome.state());
        assertFalse(Thread.interrupted());
    }

    @Test
    void outcomeRejectsNonTerminalState() {
        assertThrows(IllegalArgumentException.class,
                () -> new TaskOutcome(TaskState.PROCESSING, null, null));
    }
}
