package taskengine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import taskengine.registry.TaskTypeRegistry;
import taskengine.registry.TaskType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskEngineTest {

  private TaskEngine engine;

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.resumeTaskExecution();
      engine.close();
    }
  }

  private void awaitState(long taskId, TaskState state) {
    Awaits.until(() -> engine.getTask(taskId).map(Task::state).orElse(null) == state,
        "task " + taskId + " to reach " + state);
  }

  @Test
  void echoTaskCompletesWithItsInput() {
    engine = TaskEngine.builder().build();
    engine.registerTaskType("echo", Task::payload);
    assertTrue(engine.start());

    Task task = engine.addTask("echo", Map.of("x", 1));
    awaitState(task.id(), TaskState.COMPLETE);

    Task done = engine.getTask(task.id()).orElseThrow();
    assertEquals(Map.of("x", 1), done.result());

    List<TaskEvent> events = engine.eventsForTask(task.id());
    assertEquals(3, events.size());
    assertEquals(TaskState.NEW, events.get(0).changed().get(Task.STATE));
    assertEquals(TaskState.PROCESSING, events.get(1).changed().get(Task.STATE));
    assertEquals(TaskState.COMPLETE, events.get(2).changed().get(Task.STATE));
    assertEquals(events.get(2).id(), done.update());
    assertEquals(done, TaskHistory.replay(events).orElseThrow());
  }

  @Test
  void unknownTypeIsRejected() {
    engine = TaskEngine.builder().build();
    engine.start();

    assertThrows(UnrecognizedTaskTypeException.class, () -> engine.addTask("ghost", null));
    assertTrue(engine.getTasks().isEmpty());
    assertTrue(engine.getEvents().isEmpty());
  }

  @Test
  void startIsIdempotent() {
    engine = TaskEngine.builder().build();
    assertTrue(engine.start());
    assertFalse(engine.start());
  }

  @Test
  void builderCannotBeReused() {
    TaskEngine.Builder builder = TaskEngine.builder();
    engine = builder.build();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void registrationRequiresDefaultRegistry() {
    TaskTypeRegistry fixed = new TaskTypeRegistry() {
      @Override
      public Optional<TaskType> lookup(String type) {
        return Optional.empty();
      }

      @Override
      public Map<String, TaskHandler> handlers() {
        return Map.of();
      }
    };
    engine = TaskEngine.builder().registry(fixed).build();

    assertThrows(IllegalStateException.class, () -> engine.registerTaskType("x", t -> null));
  }

  @Test
  void updateTaskAcceptsFieldValuePairs() {
    engine = TaskEngine.builder().build();
    engine.registerTaskType("plan", t -> null);

    Task task = engine.addTask("plan", Map.of("goal", "dock"));
    Task prior = engine.updateTask(task.id(), "goal", "charger", "eta", 30);

    assertEquals("dock", prior.payload().get("goal"));
    Task current = engine.getTask(task.id()).orElseThrow();
    assertEquals("charger", current.payload().get("goal"));
    assertEquals(30, current.payload().get("eta"));
    assertEquals(current.update(), engine.getEvent(current.update()).orElseThrow().id());
    assertEquals(Map.of("goal", "charger", "eta", 30), engine.getEvent(current.update()).orElseThrow().changed());
    assertThrows(IllegalArgumentException.class, () -> engine.updateTask(task.id(), "goal"));
  }

  @Test
  void pauseHoldsSerialWorkButNotHighPriority() {
    RecordingMetricsExporter metrics = new RecordingMetricsExporter();
    engine = TaskEngine.builder().metrics(metrics).build();
    engine.registerTaskType("move", t -> "moved");
    engine.registerTaskType("stop", t -> "stopped", Affinity.HIGH_PRIORITY);
    engine.start();

    engine.pauseTaskExecution();
    assertTrue(engine.isPaused());
    Task move = engine.addTask("move", null);
    Task stop = engine.addTask("stop", null);

    awaitState(stop.id(), TaskState.COMPLETE);
    assertNotEquals(TaskState.COMPLETE, engine.getTask(move.id()).orElseThrow().state());

    engine.resumeTaskExecution();
    awaitState(move.id(), TaskState.COMPLETE);
    assertEquals(2, metrics.created.get());
    Awaits.until(() -> metrics.completed.get() == 2, "completed counter");
  }

  @Test
  void cancelStopsQueuedTask() throws Exception {
    RecordingMetricsExporter metrics = new RecordingMetricsExporter();
    CountDownLatch release = new CountDownLatch(1);
    engine = TaskEngine.builder().metrics(metrics).build();
    engine.registerTaskType("move", t -> release.await(5, TimeUnit.SECONDS));
    engine.start();

    Task blocking = engine.addTask("move", null);
    Task queued = engine.addTask("move", null);
    awaitState(blocking.id(), TaskState.PROCESSING);

    assertTrue(engine.cancelTask(queued.id()));
    assertFalse(engine.cancelTask(queued.id()));
    release.countDown();

    awaitState(blocking.id(), TaskState.COMPLETE);
    assertFalse(engine.cancelTask(blocking.id()));
    assertEquals(TaskState.CANCELLED, engine.getTask(queued.id()).orElseThrow().state());
    assertEquals(1, metrics.cancelled.get());
  }

  @Test
  void closeDrainsPendingTasksAndIsIdempotent() {
    engine = TaskEngine.builder().parallelWorkers(2).build();
    engine.registerTaskType("status", t -> "ok", Affinity.PARALLEL);
    engine.start();
    Task a = engine.addTask("status", null);
    Task b = engine.addTask("status", null);

    engine.close();
    engine.close();

    assertEquals(TaskState.COMPLETE, engine.getTask(a.id()).orElseThrow().state());
    assertEquals(TaskState.COMPLETE, engine.getTask(b.id()).orElseThrow().state());
    Map<String, Integer> depths = engine.queueDepths();
    assertEquals(List.of("dispatch", "serial", "parallel", "high-priority"), List.copyOf(depths.keySet()));
  }

  @Test
  void addTaskAfterCloseThrowsAndStoresNothing() {
    RecordingMetricsExporter metrics = new RecordingMetricsExporter();
    engine = TaskEngine.builder().metrics(metrics).build();
    engine.registerTaskType("status", t -> "ok");
    engine.start();
    engine.close();

    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> engine.addTask("status", null));

    assertEquals("TaskEngine has been closed", e.getMessage());
    assertTrue(engine.getTasks().isEmpty());
    assertTrue(engine.getEvents().isEmpty());
    assertEquals(0, metrics.created.get());
  }
}
