package taskengine.registry;

import taskengine.Affinity;
import taskengine.TaskHandler;

import java.util.Objects;

/**
 * Registration entry: the handler for a task type and its declared affinity.
 */
public record TaskType(String name, TaskHandler handler, Affinity affinity) {

  public TaskType {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(affinity, "affinity");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
  }
}
