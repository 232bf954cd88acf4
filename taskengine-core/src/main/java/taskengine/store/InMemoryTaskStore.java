package taskengine.store;

import taskengine.Task;
import taskengine.TaskEvent;
import taskengine.TaskNotFoundException;
import taskengine.TaskState;
import taskengine.UnrecognizedTaskTypeException;
import taskengine.registry.TaskType;
import taskengine.registry.TaskTypeRegistry;
import taskengine.spi.TaskStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory {@link TaskStore}. Nothing survives a restart.
 *
 * <p>Writers take a single {@link ReentrantLock}; the id counters are only read and
 * advanced while holding it. Readers go straight to concurrent maps of immutable
 * {@link Task} and {@link TaskEvent} snapshots, so a reader can observe one write half done:
 * <ul>
 *   <li>a new task is published before its initiating event, so every visible event refers
 *       to a visible task, but a brand-new task's {@code update} may briefly name an event
 *       not yet in {@link #getEvents()};</li>
 *   <li>on later writes the event is appended before the task is replaced, so a reader may
 *       briefly see an event whose task still shows the previous {@code update}.</li>
 * </ul>
 */
public final class InMemoryTaskStore implements TaskStore {
  private static final Logger logger = Logger.getLogger(InMemoryTaskStore.class.getName());

  private final TaskTypeRegistry registry;
  private final Clock clock;
  private final ReentrantLock writeLock = new ReentrantLock();

  private final ConcurrentSkipListMap<Long, Task> tasks = new ConcurrentSkipListMap<>();
  private final ConcurrentSkipListMap<Long, TaskEvent> events = new ConcurrentSkipListMap<>();
  private final Map<Long, List<TaskEvent>> eventsByTask = new ConcurrentHashMap<>();

  private long lastTaskId;
  private long lastEventId;

  public InMemoryTaskStore(TaskTypeRegistry registry) {
    this(registry, Clock.systemUTC());
  }

  public InMemoryTaskStore(TaskTypeRegistry registry, Clock clock) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Task addTask(String type, Map<String, ?> options) {
    TaskType taskType = registry.lookup(type)
        .orElseThrow(() -> new UnrecognizedTaskTypeException(type));

    writeLock.lock();
    try {
      long taskId = lastTaskId + 1;
      Instant now = clock.instant();
      Task draft = Task.builder(taskId, type)
          .created(now)
          .affinity(taskType.affinity())
          .payload(options)
          .build();

      Map<String, Object> initial = new LinkedHashMap<>();
      initial.put(Task.TYPE, type);
      initial.put(Task.CREATED, now);
      initial.put(Task.AFFINITY, taskType.affinity());
      initial.put(Task.STATE, TaskState.NEW);
      initial.putAll(draft.payload());

      // The task goes in first so that no event is ever visible without its task.
      Task stored = draft.withChanges(Map.of(Task.STATE, TaskState.NEW), lastEventId + 1);
      tasks.put(taskId, stored);
      lastTaskId = taskId;
      appendEvent(taskId, initial, null, now);
      logger.log(Level.FINE, "Added task {0} of type {1}", new Object[]{taskId, type});
      return stored;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public Task updateTask(long taskId, Map<String, ?> changes) {
    Objects.requireNonNull(changes, "changes");
    writeLock.lock();
    try {
      Task current = tasks.get(taskId);
      if (current == null) {
        throw new TaskNotFoundException(taskId);
      }
      apply(current, changes);
      return current;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public Optional<Task> transition(long taskId, Set<TaskState> expected, Map<String, ?> changes) {
    Objects.requireNonNull(expected, "expected");
    Objects.requireNonNull(changes, "changes");
    writeLock.lock();
    try {
      Task current = tasks.get(taskId);
      if (current == null || !expected.contains(current.state())) {
        return Optional.empty();
      }
      apply(current, changes);
      return Optional.of(current);
    } finally {
      writeLock.unlock();
    }
  }

  // Caller holds writeLock.
  private void apply(Task current, Map<String, ?> changes) {
    Instant now = clock.instant();
    // Validates the changes before anything is appended.
    Task updated = current.withChanges(changes, lastEventId + 1);
    List<String> errors = changes.containsKey(Task.ERRORS) ? updated.errors() : null;
    appendEvent(current.id(), changes, errors, now);
    tasks.put(current.id(), updated);
    logger.log(Level.FINE, "Updated task {0}: {1}", new Object[]{current.id(), changes});
  }

  // Caller holds writeLock.
  private TaskEvent appendEvent(long taskId, Map<String, ?> changed, List<String> errors, Instant now) {
    long eventId = lastEventId + 1;
    TaskEvent event = new TaskEvent(eventId, taskId, now, changed, errors);
    events.put(eventId, event);
    eventsByTask.computeIfAbsent(taskId, ignored -> new CopyOnWriteArrayList<>()).add(event);
    lastEventId = eventId;
    return event;
  }

  @Override
  public Optional<Task> getTask(long taskId) {
    return Optional.ofNullable(tasks.get(taskId));
  }

  @Override
  public Map<Long, Task> getTasks() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
  }

  @Override
  public Optional<TaskEvent> getEvent(long eventId) {
    return Optional.ofNullable(events.get(eventId));
  }

  @Override
  public Map<Long, TaskEvent> getEvents() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(events));
  }

  @Override
  public List<TaskEvent> eventsForTask(long taskId) {
    List<TaskEvent> forTask = eventsByTask.get(taskId);
    return forTask == null ? List.of() : List.copyOf(forTask);
  }
}
