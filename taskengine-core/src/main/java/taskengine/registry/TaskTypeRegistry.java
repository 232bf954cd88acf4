package taskengine.registry;

import taskengine.TaskHandler;

import java.util.Map;
import java.util.Optional;

/**
 * Lookup of task types by name.
 *
 * <p>The store consults the registry once, at creation time, to resolve a task's affinity.
 * Workers consult it again at execution time to find the handler, so a type removed or
 * replaced in between is observed by the worker.
 *
 * @see DefaultTaskTypeRegistry
 */
public interface TaskTypeRegistry {

  /**
   * Returns the registration for {@code type}.
   *
   * @param type the task type name
   * @return the registration, or empty if the type is unknown
   */
  Optional<TaskType> lookup(String type);

  /**
   * Returns a snapshot of all handlers keyed by type name.
   *
   * @return immutable map of type name to handler
   */
  Map<String, TaskHandler> handlers();
}
