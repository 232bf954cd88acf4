package taskengine.dispatch;

import taskengine.Affinity;
import taskengine.Task;
import taskengine.spi.MetricsExporter;
import taskengine.spi.TaskStore;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single loop that moves newly created task ids from the dispatch queue to the queue
 * matching each task's stored affinity.
 *
 * <p>Routing is a pure forward: the router reads the task from the store and never writes.
 * When the dispatch queue is closed and drained, the router closes every affinity queue so
 * the worker pools drain and stop in turn.
 */
final class DispatchRouter implements Runnable {
  private static final Logger logger = Logger.getLogger(DispatchRouter.class.getName());

  private final BoundedQueue<Long> dispatchQueue;
  private final Map<Affinity, BoundedQueue<Task>> affinityQueues;
  private final TaskStore store;
  private final MetricsExporter metrics;

  DispatchRouter(BoundedQueue<Long> dispatchQueue, Map<Affinity, BoundedQueue<Task>> affinityQueues,
      TaskStore store, MetricsExporter metrics) {
    this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue");
    this.affinityQueues = new EnumMap<>(affinityQueues);
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    for (Affinity affinity : Affinity.values()) {
      if (!this.affinityQueues.containsKey(affinity)) {
        throw new IllegalArgumentException("Missing queue for affinity " + affinity);
      }
    }
  }

  @Override
  public void run() {
    try {
      Long taskId;
      while ((taskId = dispatchQueue.take()) != null) {
        metrics.recordQueueDepth(dispatchQueue.name(), dispatchQueue.size());
        try {
          route(taskId);
        } catch (InterruptedException e) {
          throw e;
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Failed to route task " + taskId, e);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warning("Dispatch router interrupted; " + dispatchQueue.size() + " task(s) not routed");
    } finally {
      affinityQueues.values().forEach(BoundedQueue::close);
    }
  }

  void route(long taskId) throws InterruptedException {
    Optional<Task> task = store.getTask(taskId);
    if (task.isEmpty()) {
      logger.log(Level.WARNING, "Dropping unknown task id {0}", taskId);
      return;
    }
    BoundedQueue<Task> target = affinityQueues.get(task.get().affinity());
    if (!target.put(task.get())) {
      logger.log(Level.WARNING, "Queue {0} closed; task {1} not routed",
          new Object[]{target.name(), taskId});
      return;
    }
    metrics.recordQueueDepth(target.name(), target.size());
  }
}
