package taskengine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds a task from its events.
 *
 * <p>Events are applied in id order. The initiating event supplies the type, creation time,
 * affinity and payload; every later event merges its {@code changed} map.
 */
public final class TaskHistory {

  private TaskHistory() {}

  /**
   * Replays the events of a single task.
   *
   * @param events events of one task, in any order
   * @return the reconstructed task, or empty if {@code events} is empty
   * @throws IllegalArgumentException if the events belong to more than one task or the
   *     first event is not an initiating event
   */
  public static Optional<Task> replay(List<TaskEvent> events) {
    if (events.isEmpty()) {
      return Optional.empty();
    }
    List<TaskEvent> ordered = new ArrayList<>(events);
    ordered.sort(Comparator.comparingLong(TaskEvent::id));

    TaskEvent first = ordered.get(0);
    long taskId = first.taskId();
    Map<String, Object> initial = first.changed();
    if (!(initial.get(Task.TYPE) instanceof String type)
        || !(initial.get(Task.CREATED) instanceof Instant created)
        || !(initial.get(Task.AFFINITY) instanceof Affinity affinity)) {
      throw new IllegalArgumentException("Event " + first.id() + " is not an initiating event");
    }

    Map<String, Object> firstChanges = new LinkedHashMap<>(initial);
    firstChanges.keySet().removeAll(Task.RESERVED_FIELDS);
    Task task = Task.builder(taskId, type)
        .created(created)
        .affinity(affinity)
        .build()
        .withChanges(firstChanges, first.id());

    for (TaskEvent event : ordered.subList(1, ordered.size())) {
      if (event.taskId() != taskId) {
        throw new IllegalArgumentException("Event " + event.id() + " belongs to task " + event.taskId());
      }
      task = task.withChanges(event.changed(), event.id());
    }
    return Optional.of(task);
  }
}
