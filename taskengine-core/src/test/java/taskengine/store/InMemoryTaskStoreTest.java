package taskengine.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import taskengine.Affinity;
import taskengine.Task;
import taskengine.TaskEvent;
import taskengine.TaskHistory;
import taskengine.TaskNotFoundException;
import taskengine.TaskState;
import taskengine.UnrecognizedTaskTypeException;
import taskengine.registry.DefaultTaskTypeRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private DefaultTaskTypeRegistry registry;
  private InMemoryTaskStore store;

  @BeforeEach
  void setUp() {
    registry = new DefaultTaskTypeRegistry()
        .register("move", task -> "moved")
        .register("status", task -> "ok", Affinity.PARALLEL)
        .register("stop", task -> "stopped", Affinity.HIGH_PRIORITY);
    store = new InMemoryTaskStore(registry, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  // ── addTask ─────────────────────────────────────────────────────

  @Test
  void addTaskStoresNewTaskWithInitiatingEvent() {
    Task task = store.addTask("move", Map.of("waypoints", List.of(1, 2, 3)));

    assertEquals(1, task.id());
    assertEquals("move", task.type());
    assertEquals(NOW, task.created());
    assertEquals(TaskState.NEW, task.state());
    assertEquals(Affinity.SERIAL, task.affinity());
    assertEquals(List.of(1, 2, 3), task.payload().get("waypoints"));
    assertEquals(1, task.update());

    TaskEvent event = store.getEvent(1).orElseThrow();
    assertEquals(1, event.taskId());
    assertEquals(NOW, event.created());
    assertEquals("move", event.changed().get(Task.TYPE));
    assertEquals(TaskState.NEW, event.changed().get(Task.STATE));
    assertEquals(Affinity.SERIAL, event.changed().get(Task.AFFINITY));
    assertNull(event.errors());
    assertEquals(task, store.getTask(1).orElseThrow());
  }

  @Test
  void addTaskResolvesAffinityFromRegistry() {
    assertEquals(Affinity.PARALLEL, store.addTask("status", null).affinity());
    assertEquals(Affinity.HIGH_PRIORITY, store.addTask("stop", null).affinity());
  }

  @Test
  void addTaskIgnoresCallerSuppliedCoreFields() {
    Task task = store.addTask("move", Map.of("id", 42, "state", "complete", "affinity", "parallel"));

    assertEquals(1, task.id());
    assertEquals(TaskState.NEW, task.state());
    assertEquals(Affinity.SERIAL, task.affinity());
    assertTrue(task.payload().isEmpty());
  }

  @Test
  void unrecognizedTypeLeavesNoGap() {
    store.addTask("move", null);
    UnrecognizedTaskTypeException e = assertThrows(UnrecognizedTaskTypeException.class,
        () -> store.addTask("ghost", null));
    assertEquals("ghost", e.taskType());
    assertEquals("Unrecognized task type ghost", e.getMessage());

    Task next = store.addTask("move", null);
    assertEquals(2, next.id());
    assertEquals(2, next.update());
    assertEquals(2, store.getTasks().size());
    assertEquals(2, store.getEvents().size());
  }

  @Test
  void affinityIsFixedAtCreation() {
    Task before = store.addTask("move", null);
    registry.register("move", task -> "moved", Affinity.PARALLEL);

    assertEquals(Affinity.SERIAL, store.getTask(before.id()).orElseThrow().affinity());
    assertEquals(Affinity.PARALLEL, store.addTask("move", null).affinity());
  }

  // ── updateTask ──────────────────────────────────────────────────

  @Test
  void updateReturnsPriorTaskAndAppendsOneEvent() {
    Task created = store.addTask("move", null);

    Task prior = store.updateTask(created.id(), "state", TaskState.PROCESSING);

    assertEquals(created, prior);
    Task current = store.getTask(created.id()).orElseThrow();
    assertEquals(TaskState.PROCESSING, current.state());
    assertEquals(2, current.update());
    TaskEvent event = store.getEvent(2).orElseThrow();
    assertEquals(Map.of("state", TaskState.PROCESSING), event.changed());
    assertEquals(List.of(event), store.eventsForTask(created.id()).subList(1, 2));
  }

  @Test
  void updateWithErrorsRecordsThemOnEvent() {
    Task task = store.addTask("move", null);
    store.updateTask(task.id(), "state", TaskState.FAILED, "errors", List.of("blocked"));

    assertEquals(List.of("blocked"), store.getTask(task.id()).orElseThrow().errors());
    assertEquals(List.of("blocked"), store.getEvent(2).orElseThrow().errors());
  }

  @Test
  void updateMissingTaskThrows() {
    TaskNotFoundException e = assertThrows(TaskNotFoundException.class,
        () -> store.updateTask(99, "state", TaskState.COMPLETE));
    assertEquals(99, e.taskId());
    assertTrue(store.getEvents().isEmpty());
  }

  @Test
  void oddArgumentCountIsRejected() {
    Task task = store.addTask("move", null);
    assertThrows(IllegalArgumentException.class, () -> store.updateTask(task.id(), "state"));
    assertEquals(1, store.getEvents().size());
  }

  @Test
  void reservedFieldUpdateIsRejectedWithoutEvent() {
    Task task = store.addTask("move", null);
    assertThrows(IllegalArgumentException.class, () -> store.updateTask(task.id(), "affinity", "parallel"));
    assertThrows(IllegalArgumentException.class, () -> store.updateTask(task.id(), "id", 5L));
    assertEquals(1, store.getEvents().size());
    assertEquals(task, store.getTask(task.id()).orElseThrow());
  }

  // ── transition / cancel ─────────────────────────────────────────

  @Test
  void transitionOnlyAppliesFromExpectedState() {
    Task task = store.addTask("move", null);

    assertTrue(store.transition(task.id(), Set.of(TaskState.NEW),
        Map.of(Task.STATE, TaskState.PROCESSING)).isPresent());
    assertTrue(store.transition(task.id(), Set.of(TaskState.NEW),
        Map.of(Task.STATE, TaskState.PROCESSING)).isEmpty());
    assertTrue(store.transition(404, Set.of(TaskState.NEW),
        Map.of(Task.STATE, TaskState.PROCESSING)).isEmpty());
    assertEquals(2, store.getEvents().size());
  }

  @Test
  void cancelIsGuardedByState() {
    Task task = store.addTask("move", null);
    assertTrue(store.cancelTask(task.id()));
    assertEquals(TaskState.CANCELLED, store.getTask(task.id()).orElseThrow().state());

    assertFalse(store.cancelTask(task.id()));
    assertFalse(store.cancelTask(404));

    Task done = store.addTask("move", null);
    store.updateTask(done.id(), "state", TaskState.COMPLETE, "result", "moved");
    assertFalse(store.cancelTask(done.id()));
    assertEquals(TaskState.COMPLETE, store.getTask(done.id()).orElseThrow().state());
  }

  // ── Reads ───────────────────────────────────────────────────────

  @Test
  void absentLookupsAreEmpty() {
    assertTrue(store.getTask(1).isEmpty());
    assertTrue(store.getEvent(1).isEmpty());
    assertTrue(store.eventsForTask(1).isEmpty());
    assertTrue(store.getTasks().isEmpty());
  }

  @Test
  void snapshotsAreImmutable() {
    store.addTask("move", null);
    Map<Long, Task> tasks = store.getTasks();
    store.addTask("move", null);

    assertEquals(1, tasks.size());
    assertThrows(UnsupportedOperationException.class, () -> tasks.remove(1L));
  }

  @Test
  void replayingEventsReproducesTask() {
    Task task = store.addTask("move", Map.of("waypoints", List.of("a", "b")));
    store.updateTask(task.id(), "state", TaskState.PROCESSING);
    store.updateTask(task.id(), "state", TaskState.COMPLETE, "result", Map.of("at", "b"));

    Task replayed = TaskHistory.replay(store.eventsForTask(task.id())).orElseThrow();

    assertEquals(store.getTask(task.id()).orElseThrow(), replayed);
  }

  // ── Concurrency ─────────────────────────────────────────────────

  @Test
  void concurrentWritersGetDistinctContiguousIds() throws Exception {
    int threads = 8;
    int perThread = 200;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<List<Long>>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        futures.add(pool.submit(() -> {
          go.await();
          List<Long> ids = new ArrayList<>();
          for (int i = 0; i < perThread; i++) {
            Task task = store.addTask("move", null);
            ids.add(task.id());
            store.updateTask(task.id(), "state", TaskState.PROCESSING);
          }
          return ids;
        }));
      }
      go.countDown();

      TreeSet<Long> all = new TreeSet<>();
      for (Future<List<Long>> f : futures) {
        List<Long> ids = f.get(30, TimeUnit.SECONDS);
        List<Long> sorted = new ArrayList<>(ids);
        Collections.sort(sorted);
        assertEquals(sorted, ids, "ids seen by one writer increase");
        all.addAll(ids);
      }
      int total = threads * perThread;
      assertEquals(total, all.size());
      assertEquals(Long.valueOf(1), all.first());
      assertEquals(Long.valueOf(total), all.last());
    } finally {
      pool.shutdownNow();
    }

    Map<Long, TaskEvent> events = store.getEvents();
    assertEquals(threads * perThread * 2, events.size());
    long expected = 1;
    for (long id : events.keySet()) {
      assertEquals(expected++, id);
    }
    for (Task task : store.getTasks().values()) {
      List<TaskEvent> own = store.eventsForTask(task.id());
      assertEquals(2, own.size());
      assertEquals(own.get(1).id(), task.update());
      assertTrue(own.get(0).id() < own.get(1).id());
    }
  }

  @Test
  void readersNeverSeeAnEventBeforeItsTask() throws Exception {
    int total = 5000;
    AtomicInteger orphans = new AtomicInteger();
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<?> reader = pool.submit(() -> {
        for (long eventId = 1; eventId <= total; eventId++) {
          TaskEvent event;
          while ((event = store.getEvent(eventId).orElse(null)) == null) {
            Thread.onSpinWait();
          }
          if (store.getTask(event.taskId()).isEmpty()) {
            orphans.incrementAndGet();
          }
        }
      });
      for (int i = 0; i < total; i++) {
        store.addTask("status", null);
      }
      reader.get(30, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    assertEquals(0, orphans.get());
  }
}
