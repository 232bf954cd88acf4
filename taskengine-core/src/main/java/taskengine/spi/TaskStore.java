package taskengine.spi;

import taskengine.Task;
import taskengine.TaskEvent;
import taskengine.TaskState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Source of truth for task records, the event log, and their id counters.
 *
 * <p>All mutating operations are serialized with respect to each other: id assignment,
 * event append, and task merge of one call are indivisible. Reads return immutable
 * snapshots and never block writers.
 *
 * <p>Every change to a task goes through {@link #updateTask(long, Map)} or
 * {@link #transition(long, Set, Map)}, which always append exactly one event.
 *
 * @see taskengine.store.InMemoryTaskStore
 */
public interface TaskStore {

  /**
   * Creates a task of the given type.
   *
   * <p>The type is validated before an id is assigned, so a rejected call leaves no gap in
   * the task id sequence. The stored task is in state {@link TaskState#NEW} and its
   * {@code update} points at the initiating event.
   *
   * @param type the registered task type
   * @param options caller fields, kept as the task payload; may be {@code null}
   * @return the stored task
   * @throws taskengine.UnrecognizedTaskTypeException if the type is not registered
   */
  Task addTask(String type, Map<String, ?> options);

  /**
   * Appends an event holding {@code changes} and merges them into the task.
   *
   * @param taskId the task id
   * @param changes field/value pairs; becomes the event's {@code changed} map as is
   * @return the task as it was before this update
   * @throws taskengine.TaskNotFoundException if no such task exists
   * @throws IllegalArgumentException if a change targets a reserved field
   */
  Task updateTask(long taskId, Map<String, ?> changes);

  /**
   * Varargs form of {@link #updateTask(long, Map)}, e.g.
   * {@code updateTask(7, "state", TaskState.COMPLETE, "result", 42)}.
   *
   * @throws IllegalArgumentException if the number of arguments is odd or a field name is
   *     not a string
   */
  default Task updateTask(long taskId, Object... fieldValuePairs) {
    return updateTask(taskId, pairs(fieldValuePairs));
  }

  /**
   * Applies {@code changes} only if the task's current state is one of {@code expected}.
   * The check and the update are one atomic step.
   *
   * @return the task as it was before the update, or empty if the task does not exist or
   *     was in another state (nothing is written in that case)
   */
  Optional<Task> transition(long taskId, Set<TaskState> expected, Map<String, ?> changes);

  /**
   * Cancels a task that has not reached a terminal state.
   *
   * @return {@code true} if the task moved to {@link TaskState#CANCELLED}
   */
  default boolean cancelTask(long taskId) {
    return transition(taskId, Set.of(TaskState.NEW, TaskState.PROCESSING),
        Map.of(Task.STATE, TaskState.CANCELLED)).isPresent();
  }

  Optional<Task> getTask(long taskId);

  /** Snapshot of all tasks keyed by id, in id order. */
  Map<Long, Task> getTasks();

  Optional<TaskEvent> getEvent(long eventId);

  /** Snapshot of the full event log keyed by id, in id order. */
  Map<Long, TaskEvent> getEvents();

  /** Events of one task in id order; empty for unknown tasks. */
  List<TaskEvent> eventsForTask(long taskId);

  /**
   * Turns alternating field/value arguments into an ordered map.
   *
   * @throws IllegalArgumentException on an odd count or a non-string field name
   */
  static Map<String, Object> pairs(Object... fieldValuePairs) {
    if (fieldValuePairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Expected field/value pairs, got " + fieldValuePairs.length + " arguments");
    }
    Map<String, Object> changes = new LinkedHashMap<>();
    for (int i = 0; i < fieldValuePairs.length; i += 2) {
      if (!(fieldValuePairs[i] instanceof String field)) {
        throw new IllegalArgumentException("Field name at position " + i + " must be a string");
      }
      changes.put(field, fieldValuePairs[i + 1]);
    }
    return changes;
  }
}
