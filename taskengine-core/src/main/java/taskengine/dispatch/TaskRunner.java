package taskengine.dispatch;

import taskengine.Task;
import taskengine.TaskHandler;
import taskengine.registry.TaskType;
import taskengine.registry.TaskTypeRegistry;
import taskengine.spi.MetricsExporter;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes the registered handler for a task and turns whatever happens into a
 * {@link TaskOutcome}. Never throws.
 */
public final class TaskRunner {
  private static final Logger logger = Logger.getLogger(TaskRunner.class.getName());

  private final TaskTypeRegistry registry;
  private final MetricsExporter metrics;

  public TaskRunner(TaskTypeRegistry registry, MetricsExporter metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the handler for {@code task}. The handler is resolved now, not at creation
   * time, so a type unregistered in between fails here.
   *
   * @param task the task to perform
   * @return {@code COMPLETE} with the handler's return value, or {@code FAILED} with the
   *     exception message or a missing-handler error. A handler's
   *     {@code InterruptedException} is a failure like any other and does not interrupt the
   *     calling worker.
   */
  public TaskOutcome run(Task task) {
    Optional<TaskHandler> handler = registry.lookup(task.type()).map(TaskType::handler);
    if (handler.isEmpty()) {
      logger.log(Level.WARNING, "No handler for task type {0} (task {1})",
          new Object[]{task.type(), task.id()});
      return TaskOutcome.failed("No handler for task type " + task.type());
    }

    long start = System.nanoTime();
    try {
      return TaskOutcome.complete(handler.get().handle(task));
    } catch (Exception e) {
      logger.log(Level.WARNING, "Handler for task " + task.id() + " failed", e);
      return TaskOutcome.failed(messageOf(e));
    } finally {
      metrics.recordHandlerDurationMs((System.nanoTime() - start) / 1_000_000L);
    }
  }

  private static String messageOf(Exception e) {
    String message = e.getMessage();
    return message == null || message.isEmpty() ? e.getClass().getName() : message;
  }
}
