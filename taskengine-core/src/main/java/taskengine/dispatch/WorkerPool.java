package taskengine.dispatch;

import taskengine.Task;
import taskengine.TaskState;
import taskengine.spi.MetricsExporter;
import taskengine.spi.TaskStore;
import taskengine.util.DaemonThreadFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One or more worker loops draining a single affinity queue.
 *
 * <p>Each loop takes a task, marks it {@code PROCESSING}, waits for the
 * {@link ExecutionController} if the pool is pausable, runs the handler, and writes exactly
 * one terminal transition. A task cancelled before its handler starts is skipped; a result
 * that arrives after a cancellation is discarded. An interrupt left behind by a handler is
 * cleared; only {@link #shutdownNow()} stops a loop early. Otherwise loops exit when the queue
 * is closed and drained.
 */
final class WorkerPool {
  private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

  private static final Set<TaskState> RUNNABLE = Set.of(TaskState.NEW);
  private static final Set<TaskState> IN_FLIGHT = Set.of(TaskState.PROCESSING);

  private final BoundedQueue<Task> queue;
  private final int workerCount;
  private final boolean pausable;
  private final ExecutionController controller;
  private final TaskStore store;
  private final TaskRunner runner;
  private final MetricsExporter metrics;
  private final ExecutorService workers;
  private volatile boolean stopping;

  WorkerPool(BoundedQueue<Task> queue, int workerCount, boolean pausable,
      ExecutionController controller, TaskStore store, TaskRunner runner, MetricsExporter metrics) {
    if (workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    this.queue = Objects.requireNonNull(queue, "queue");
    this.workerCount = workerCount;
    this.pausable = pausable;
    this.controller = Objects.requireNonNull(controller, "controller");
    this.store = Objects.requireNonNull(store, "store");
    this.runner = Objects.requireNonNull(runner, "runner");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.workers = Executors.newFixedThreadPool(workerCount,
        new DaemonThreadFactory("taskengine-" + queue.name() + "-"));
  }

  void start() {
    for (int i = 0; i < workerCount; i++) {
      workers.submit(this::workerLoop);
    }
    logger.log(Level.INFO, "Started {0} worker(s) for {1} queue",
        new Object[]{workerCount, queue.name()});
  }

  private void workerLoop() {
    try {
      Task task;
      while ((task = queue.take()) != null) {
        metrics.recordQueueDepth(queue.name(), queue.size());
        try {
          process(task);
        } catch (InterruptedException e) {
          if (stopping) {
            throw e;
          }
          logger.log(Level.WARNING, "Worker interrupted on task {0}; continuing", task.id());
          fail(task.id(), e);
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Worker error on task " + task.id(), t);
          fail(task.id(), t);
        }
        // A handler may leave the flag set; only shutdownNow() ends the loop.
        if (Thread.interrupted() && !stopping) {
          logger.log(Level.FINE, "Cleared interrupt left by task {0}", task.id());
        }
        if (stopping) {
          Thread.currentThread().interrupt();
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  void process(Task task) throws InterruptedException {
    long taskId = task.id();
    Optional<Task> claimed = store.transition(taskId, RUNNABLE, Map.of(Task.STATE, TaskState.PROCESSING));
    if (claimed.isEmpty()) {
      logger.log(Level.FINE, "Skipping task {0}: no longer new", taskId);
      return;
    }

    if (pausable) {
      controller.awaitRunning();
    }

    Optional<Task> current = store.getTask(taskId);
    if (current.isEmpty() || current.get().state() != TaskState.PROCESSING) {
      logger.log(Level.FINE, "Skipping task {0}: cancelled while waiting", taskId);
      return;
    }

    TaskOutcome outcome = runner.run(current.get());
    if (store.transition(taskId, IN_FLIGHT, outcome.changes()).isEmpty()) {
      logger.log(Level.WARNING, "Discarding {0} outcome of task {1}: state changed during execution",
          new Object[]{outcome.state(), taskId});
      return;
    }
    if (outcome.isComplete()) {
      metrics.incrementTaskCompleted();
    } else {
      metrics.incrementTaskFailed();
    }
  }

  private void fail(long taskId, Throwable t) {
    try {
      String message = t.getMessage() == null ? t.getClass().getName() : t.getMessage();
      if (store.transition(taskId, Set.of(TaskState.NEW, TaskState.PROCESSING),
          Map.of(Task.STATE, TaskState.FAILED, Task.ERRORS, List.of(message))).isPresent()) {
        metrics.incrementTaskFailed();
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Could not mark task " + taskId + " failed", e);
    }
  }

  /**
   * Waits for the loops to finish after the queue was closed.
   *
   * @return {@code true} if every loop exited within the timeout
   */
  boolean awaitTermination(long timeoutMs) throws InterruptedException {
    workers.shutdown();
    return workers.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
  }

  /** Interrupts the loops, including any handler still running, and stops them taking more tasks. */
  void shutdownNow() {
    stopping = true;
    workers.shutdownNow();
  }

  String queueName() {
    return queue.name();
  }

  int pending() {
    return queue.size();
  }
}
