package taskengine.dispatch;

import taskengine.Affinity;
import taskengine.Task;
import taskengine.registry.TaskTypeRegistry;
import taskengine.spi.MetricsExporter;
import taskengine.spi.TaskStore;
import taskengine.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes tasks to affinity-specific worker pools and executes them.
 *
 * <p>Newly created task ids enter a bounded <em>dispatch queue</em>. A single
 * {@linkplain DispatchRouter router} moves each task to the serial, parallel or
 * high-priority queue according to its stored {@link Affinity}. Each queue is drained by its
 * own {@linkplain WorkerPool pool}:
 * <ul>
 *   <li>serial: exactly one worker, so serial tasks never overlap</li>
 *   <li>parallel: {@code parallelWorkers} workers</li>
 *   <li>high-priority: one worker that ignores {@link ExecutionController#pause()}</li>
 * </ul>
 *
 * <p>Within a queue tasks run in FIFO order; there is no ordering across queues.
 * {@link #start()} may be called any number of times, the router and pools are created
 * once. Create instances via {@link #builder()}.
 *
 * @see TaskDispatcher.Builder
 */
public final class TaskDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TaskDispatcher.class.getName());

  public static final String DISPATCH_QUEUE = "dispatch";

  private final BoundedQueue<Long> dispatchQueue;
  private final Map<Affinity, BoundedQueue<Task>> affinityQueues = new EnumMap<>(Affinity.class);
  private final ExecutionController controller;
  private final DispatchRouter router;
  private final List<WorkerPool> pools = new ArrayList<>();
  private final ExecutorService routerThread;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;

  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private TaskDispatcher(Builder builder) {
    TaskStore store = Objects.requireNonNull(builder.store, "store");
    TaskTypeRegistry registry = Objects.requireNonNull(builder.registry, "registry");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.controller = builder.controller != null ? builder.controller : new ExecutionController();
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.parallelWorkers < 1) {
      throw new IllegalArgumentException("parallelWorkers must be >= 1");
    }
    if (builder.dispatchCapacity <= 0 || builder.serialCapacity <= 0
        || builder.parallelCapacity <= 0 || builder.highPriorityCapacity <= 0) {
      throw new IllegalArgumentException("Queue capacities must be > 0");
    }
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }

    this.dispatchQueue = new BoundedQueue<>(DISPATCH_QUEUE, builder.dispatchCapacity);
    affinityQueues.put(Affinity.SERIAL,
        new BoundedQueue<>(Affinity.SERIAL.queueName(), builder.serialCapacity));
    affinityQueues.put(Affinity.PARALLEL,
        new BoundedQueue<>(Affinity.PARALLEL.queueName(), builder.parallelCapacity));
    affinityQueues.put(Affinity.HIGH_PRIORITY,
        new BoundedQueue<>(Affinity.HIGH_PRIORITY.queueName(), builder.highPriorityCapacity));

    TaskRunner runner = new TaskRunner(registry, metrics);
    this.router = new DispatchRouter(dispatchQueue, affinityQueues, store, metrics);
    pools.add(new WorkerPool(affinityQueues.get(Affinity.HIGH_PRIORITY), 1,
        Affinity.HIGH_PRIORITY.isPausable(), controller, store, runner, metrics));
    pools.add(new WorkerPool(affinityQueues.get(Affinity.SERIAL), 1,
        Affinity.SERIAL.isPausable(), controller, store, runner, metrics));
    pools.add(new WorkerPool(affinityQueues.get(Affinity.PARALLEL), builder.parallelWorkers,
        Affinity.PARALLEL.isPausable(), controller, store, runner, metrics));
    this.routerThread = Executors.newSingleThreadExecutor(new DaemonThreadFactory("taskengine-router-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the router and worker pools.
   *
   * @return {@code false} if they were already started
   * @throws IllegalStateException if the dispatcher has been closed
   */
  public boolean start() {
    if (closed.get()) {
      throw new IllegalStateException("TaskDispatcher has been closed");
    }
    if (!initialized.compareAndSet(false, true)) {
      return false;
    }
    routerThread.submit(router);
    pools.forEach(WorkerPool::start);
    return true;
  }

  public boolean isStarted() {
    return initialized.get();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Queues a stored task for routing, waiting while the dispatch queue is full.
   *
   * @return {@code false} if the dispatcher is closed and the task will not run
   * @throws InterruptedException if interrupted while waiting for space
   */
  public boolean dispatch(Task task) throws InterruptedException {
    boolean accepted = dispatchQueue.put(task.id());
    if (accepted) {
      metrics.recordQueueDepth(DISPATCH_QUEUE, dispatchQueue.size());
    } else {
      logger.log(Level.WARNING, "Dispatcher closed; task {0} not dispatched", task.id());
    }
    return accepted;
  }

  public ExecutionController executionController() {
    return controller;
  }

  /** Current number of waiting items per queue name. */
  public Map<String, Integer> queueDepths() {
    Map<String, Integer> depths = new LinkedHashMap<>();
    depths.put(DISPATCH_QUEUE, dispatchQueue.size());
    affinityQueues.forEach((affinity, queue) -> depths.put(queue.name(), queue.size()));
    return depths;
  }

  /**
   * Closes the dispatch queue and lets the router and pools drain. Waits up to
   * {@code drainTimeoutMs} for them, then interrupts whatever is still running.
   * Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    dispatchQueue.close();
    if (!initialized.get()) {
      affinityQueues.values().forEach(BoundedQueue::close);
    }
    long deadline = System.currentTimeMillis() + drainTimeoutMs;
    try {
      routerThread.shutdown();
      if (!routerThread.awaitTermination(remaining(deadline), TimeUnit.MILLISECONDS)) {
        routerThread.shutdownNow();
      }
      for (WorkerPool pool : pools) {
        if (!pool.awaitTermination(remaining(deadline))) {
          logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown of {0} pool with {1} queued",
              new Object[]{pool.queueName(), pool.pending()});
          pool.shutdownNow();
        }
      }
    } catch (InterruptedException e) {
      routerThread.shutdownNow();
      pools.forEach(WorkerPool::shutdownNow);
      Thread.currentThread().interrupt();
    } finally {
      // wake producers and consumers the forced shutdown may have left behind
      affinityQueues.values().forEach(BoundedQueue::close);
    }
  }

  private static long remaining(long deadline) {
    return Math.max(0L, deadline - System.currentTimeMillis());
  }

  /** Builder for {@link TaskDispatcher}. */
  public static final class Builder {
    private TaskStore store;
    private TaskTypeRegistry registry;
    private MetricsExporter metrics;
    private ExecutionController controller;
    private int parallelWorkers = 4;
    private int dispatchCapacity = 500;
    private int serialCapacity = 500;
    private int parallelCapacity = 50;
    private int highPriorityCapacity = 50;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the store that tasks are read from and transitions are written to.
     *
     * <p><b>Required.</b>
     *
     * @param store the task store
     * @return this builder
     */
    public Builder store(TaskStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the registry used to resolve handlers at execution time.
     *
     * <p><b>Required.</b>
     *
     * @param registry the task type registry
     * @return this builder
     */
    public Builder registry(TaskTypeRegistry registry) {
      this.registry = registry;
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
     * Shares an existing pause switch.
     *
     * <p>Optional. Defaults to a new {@link ExecutionController} in the running state.
     *
     * @param controller the execution controller
     * @return this builder
     */
    public Builder executionController(ExecutionController controller) {
      this.controller = controller;
      return this;
    }

    /**
     * Sets the number of parallel workers.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     *
     * @param parallelWorkers worker count for the parallel queue
     * @return this builder
     */
    public Builder parallelWorkers(int parallelWorkers) {
      this.parallelWorkers = parallelWorkers;
      return this;
    }

    /** Optional. Defaults to {@code 500}. */
    public Builder dispatchCapacity(int dispatchCapacity) {
      this.dispatchCapacity = dispatchCapacity;
      return this;
    }

    /** Optional. Defaults to {@code 500}. */
    public Builder serialCapacity(int serialCapacity) {
      this.serialCapacity = serialCapacity;
      return this;
    }

    /** Optional. Defaults to {@code 50}. */
    public Builder parallelCapacity(int parallelCapacity) {
      this.parallelCapacity = parallelCapacity;
      return this;
    }

    /** Optional. Defaults to {@code 50}. */
    public Builder highPriorityCapacity(int highPriorityCapacity) {
      this.highPriorityCapacity = highPriorityCapacity;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds {@link #close()} waits for queued and running
     * tasks before interrupting workers.
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
     * Builds the dispatcher. Nothing runs until {@link TaskDispatcher#start()}.
     *
     * @return a new {@link TaskDispatcher}
     * @throws NullPointerException if {@code store} or {@code registry} is null
     * @throws IllegalArgumentException if {@code parallelWorkers < 1}, a capacity is
     *     &le; 0, or {@code drainTimeoutMs < 0}
     */
    public TaskDispatcher build() {
      return new TaskDispatcher(this);
    }
  }
}
