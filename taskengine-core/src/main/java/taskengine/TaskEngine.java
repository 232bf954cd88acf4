package taskengine;

import taskengine.dispatch.ExecutionController;
import taskengine.dispatch.TaskDispatcher;
import taskengine.registry.DefaultTaskTypeRegistry;
import taskengine.registry.TaskTypeRegistry;
import taskengine.spi.MetricsExporter;
import taskengine.spi.TaskStore;
import taskengine.store.InMemoryTaskStore;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that wires a {@link TaskTypeRegistry}, a {@link TaskStore} and a
 * {@link TaskDispatcher} into a single {@link AutoCloseable} unit.
 *
 * <p>{@link #addTask} stores the task, writes its initiating event and hands it to the
 * dispatcher; everything after that happens on worker threads and is observable only
 * through the store: {@link #getTask}, {@link #getEvents} and friends.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (TaskEngine engine = TaskEngine.builder().parallelWorkers(2).build()) {
 *   engine.registerTaskType("echo", task -> task.payload(), Affinity.PARALLEL);
 *   engine.start();
 *   Task task = engine.addTask("echo", Map.of("x", 1));
 *   // poll engine.getTask(task.id()) until its state is terminal
 * }
 * }</pre>
 *
 * @see TaskDispatcher
 * @see InMemoryTaskStore
 */
public final class TaskEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TaskEngine.class.getName());

  private final TaskTypeRegistry registry;
  private final TaskStore store;
  private final TaskDispatcher dispatcher;
  private final MetricsExporter metrics;

  private TaskEngine(TaskTypeRegistry registry, TaskStore store, TaskDispatcher dispatcher,
      MetricsExporter metrics) {
    this.registry = registry;
    this.store = store;
    this.dispatcher = dispatcher;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the router and worker pools. Tasks added before this call wait in the dispatch
   * queue.
   *
   * @return {@code false} if the engine was already started
   */
  public boolean start() {
    boolean started = dispatcher.start();
    if (started) {
      logger.info("Task engine started");
    }
    return started;
  }

  /**
   * Registers a handler with the default {@link Affinity#SERIAL} affinity.
   *
   * @throws IllegalStateException if the engine was built with a registry that does not
   *     support registration
   */
  public TaskEngine registerTaskType(String type, TaskHandler handler) {
    return registerTaskType(type, handler, Affinity.SERIAL);
  }

  /**
   * Registers a handler. Re-registering a type replaces its handler and affinity.
   *
   * @throws IllegalStateException if the engine was built with a registry that does not
   *     support registration
   */
  public TaskEngine registerTaskType(String type, TaskHandler handler, Affinity affinity) {
    if (!(registry instanceof DefaultTaskTypeRegistry defaultRegistry)) {
      throw new IllegalStateException("Registry " + registry.getClass().getName()
          + " does not support registration");
    }
    defaultRegistry.register(type, handler, affinity);
    return this;
  }

  /**
   * Creates a task and queues it for execution.
   *
   * @param type a registered task type
   * @param options payload fields, may be {@code null}
   * @return the stored task, in state {@link TaskState#NEW}
   * @throws UnrecognizedTaskTypeException if the type is not registered
   * @throws IllegalStateException if the engine has been closed; nothing is stored
   */
  public Task addTask(String type, Map<String, ?> options) {
    if (dispatcher.isClosed()) {
      throw new IllegalStateException("TaskEngine has been closed");
    }
    Task task = store.addTask(type, options);
    metrics.incrementTaskCreated();
    try {
      dispatcher.dispatch(task);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while dispatching task {0}; it stays new", task.id());
    }
    return task;
  }

  /**
   * Applies field changes to a task and records them as one event.
   *
   * @return the task as it was before the update
   * @see TaskStore#updateTask(long, Map)
   */
  public Task updateTask(long taskId, Map<String, ?> changes) {
    return store.updateTask(taskId, changes);
  }

  /**
   * Varargs form, e.g. {@code updateTask(3, "state", TaskState.FAILED, "errors", List.of("x"))}.
   *
   * @see TaskStore#updateTask(long, Object...)
   */
  public Task updateTask(long taskId, Object... fieldValuePairs) {
    return store.updateTask(taskId, fieldValuePairs);
  }

  /**
   * Cancels a task that has not finished. A task still waiting in a queue will not run;
   * a handler already running is not interrupted, but its result is discarded.
   *
   * @return {@code true} if the task moved to {@link TaskState#CANCELLED}; {@code false} if
   *     it does not exist or already reached a terminal state
   */
  public boolean cancelTask(long taskId) {
    boolean cancelled = store.cancelTask(taskId);
    if (cancelled) {
      metrics.incrementTaskCancelled();
      logger.log(Level.FINE, "Cancelled task {0}", taskId);
    }
    return cancelled;
  }

  public Optional<Task> getTask(long taskId) {
    return store.getTask(taskId);
  }

  public Map<Long, Task> getTasks() {
    return store.getTasks();
  }

  public Optional<TaskEvent> getEvent(long eventId) {
    return store.getEvent(eventId);
  }

  public Map<Long, TaskEvent> getEvents() {
    return store.getEvents();
  }

  public List<TaskEvent> eventsForTask(long taskId) {
    return store.eventsForTask(taskId);
  }

  /** Stops pausable pools from starting new handlers. */
  public void pauseTaskExecution() {
    dispatcher.executionController().pause();
  }

  public void resumeTaskExecution() {
    dispatcher.executionController().resume();
  }

  public boolean isPaused() {
    return dispatcher.executionController().isPaused();
  }

  public TaskTypeRegistry registry() {
    return registry;
  }

  public TaskStore store() {
    return store;
  }

  /** Current number of waiting items per queue name. */
  public Map<String, Integer> queueDepths() {
    return dispatcher.queueDepths();
  }

  /**
   * Closes the dispatcher, letting queued tasks drain, then closes the metrics exporter if
   * it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link TaskEngine}. */
  public static final class Builder {
    private TaskTypeRegistry registry;
    private TaskStore store;
    private MetricsExporter metrics;
    private ExecutionController executionController;
    private Clock clock;
    private int parallelWorkers = 4;
    private int dispatchCapacity = 500;
    private int serialCapacity = 500;
    private int parallelCapacity = 50;
    private int highPriorityCapacity = 50;
    private long drainTimeoutMs = 5000;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the task type registry.
     *
     * <p>Optional. Defaults to a new {@link DefaultTaskTypeRegistry}.
     *
     * @param registry the registry
     * @return this builder
     */
    public Builder registry(TaskTypeRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the task store.
     *
     * <p>Optional. Defaults to an {@link InMemoryTaskStore} over the registry. A custom store
     * must resolve affinity from the same registry.
     *
     * @param store the store
     * @return this builder
     */
    public Builder store(TaskStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Shares a pause switch with other components.
     *
     * <p>Optional.
     *
     * @param executionController the execution controller
     * @return this builder
     */
    public Builder executionController(ExecutionController executionController) {
      this.executionController = executionController;
      return this;
    }

    /**
     * Sets the clock used for {@code created} timestamps of the default store.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the number of parallel workers.
     *
     * <p>Optional. Defaults to {@code 4}.
     *
     * @param parallelWorkers worker count for the parallel queue
     * @return this builder
     */
    public Builder parallelWorkers(int parallelWorkers) {
      this.parallelWorkers = parallelWorkers;
      return this;
    }

    public Builder dispatchCapacity(int dispatchCapacity) {
      this.dispatchCapacity = dispatchCapacity;
      return this;
    }

    public Builder serialCapacity(int serialCapacity) {
      this.serialCapacity = serialCapacity;
      return this;
    }

    public Builder parallelCapacity(int parallelCapacity) {
      this.parallelCapacity = parallelCapacity;
      return this;
    }

    public Builder highPriorityCapacity(int highPriorityCapacity) {
      this.highPriorityCapacity = highPriorityCapacity;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds to wait for queued and running tasks on close.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the engine. Workers are not started until {@link TaskEngine#start()}.
     *
     * @return a new engine
     * @throws IllegalStateException if {@code build()} was already called on this builder
     */
    public TaskEngine build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      TaskTypeRegistry reg = registry != null ? registry : new DefaultTaskTypeRegistry();
      TaskStore st = store != null
          ? store
          : new InMemoryTaskStore(reg, clock != null ? clock : Clock.systemUTC());
      MetricsExporter me = metrics != null ? metrics : MetricsExporter.NOOP;
      TaskDispatcher dispatcher = TaskDispatcher.builder()
          .store(st)
          .registry(reg)
          .metrics(me)
          .executionController(executionController)
          .parallelWorkers(parallelWorkers)
          .dispatchCapacity(dispatchCapacity)
          .serialCapacity(serialCapacity)
          .parallelCapacity(parallelCapacity)
          .highPriorityCapacity(highPriorityCapacity)
          .drainTimeoutMs(drainTimeoutMs)
          .build();
      return new TaskEngine(reg, st, dispatcher, me);
    }
  }
}
