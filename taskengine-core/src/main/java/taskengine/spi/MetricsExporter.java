package taskengine.spi;

/**
 * Observability hook for exporting engine counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of tasks accepted by {@code addTask}.
   */
  void incrementTaskCreated();

  /**
   * Increments the count of tasks whose handler returned normally.
   */
  void incrementTaskCompleted();

  /**
   * Increments the count of tasks that failed, including tasks with no handler.
   */
  void incrementTaskFailed();

  /**
   * Increments the count of tasks cancelled before they finished.
   */
  void incrementTaskCancelled();

  /**
   * Records the current depth of one queue.
   *
   * @param queue queue name: {@code dispatch}, {@code serial}, {@code parallel} or
   *     {@code high-priority}
   * @param depth number of waiting items
   */
  void recordQueueDepth(String queue, int depth);

  /**
   * Records the time spent inside a handler.
   *
   * @param durationMs handler execution time in milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementTaskCreated() {
    }

    @Override
    public void incrementTaskCompleted() {
    }

    @Override
    public void incrementTaskFailed() {
    }

    @Override
    public void incrementTaskCancelled() {
    }

    @Override
    public void recordQueueDepth(String queue, int depth) {
    }
  }
}
