package taskengine.registry;

import taskengine.Affinity;
import taskengine.TaskHandler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe registry of task types.
 *
 * <p>Registrations may happen concurrently with lookups. Registering a type again
 * replaces the previous handler and affinity (last write wins). Tasks already created keep
 * the affinity they were created with.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultTaskTypeRegistry registry = new DefaultTaskTypeRegistry()
 *     .register("plan", planner::plan)
 *     .register("status", task -> robot.status(), Affinity.PARALLEL)
 *     .register("stop", task -> robot.stop(), Affinity.HIGH_PRIORITY);
 * }</pre>
 */
public final class DefaultTaskTypeRegistry implements TaskTypeRegistry {
  private static final Logger logger = Logger.getLogger(DefaultTaskTypeRegistry.class.getName());

  private final Map<String, TaskType> types = new ConcurrentHashMap<>();

  /**
   * Registers a handler with the default {@link Affinity#SERIAL} affinity.
   *
   * @param type the task type name
   * @param handler the handler
   * @return this registry for chaining
   */
  public DefaultTaskTypeRegistry register(String type, TaskHandler handler) {
    return register(type, handler, Affinity.SERIAL);
  }

  /**
   * Registers a handler with an explicit affinity.
   *
   * @param type the task type name
   * @param handler the handler
   * @param affinity the affinity for tasks created from now on
   * @return this registry for chaining
   */
  public DefaultTaskTypeRegistry register(String type, TaskHandler handler, Affinity affinity) {
    TaskType taskType = new TaskType(type, handler, affinity);
    types.put(type, taskType);
    logger.log(Level.INFO, "Registered task type {0} ({1})", new Object[]{type, affinity});
    return this;
  }

  @Override
  public Optional<TaskType> lookup(String type) {
    if (type == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(types.get(type));
  }

  @Override
  public Map<String, TaskHandler> handlers() {
    Map<String, TaskHandler> snapshot = new LinkedHashMap<>();
    types.forEach((name, taskType) -> snapshot.put(name, taskType.handler()));
    return Map.copyOf(snapshot);
  }
}
