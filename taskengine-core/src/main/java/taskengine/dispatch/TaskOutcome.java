package taskengine.dispatch;

import taskengine.Task;
import taskengine.TaskState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal result of running a task's handler: either {@link TaskState#COMPLETE} with a
 * result or {@link TaskState#FAILED} with errors.
 */
public record TaskOutcome(TaskState state, Object result, List<String> errors) {

  public TaskOutcome {
    Objects.requireNonNull(state, "state");
    if (state != TaskState.COMPLETE && state != TaskState.FAILED) {
      throw new IllegalArgumentException("Outcome must be COMPLETE or FAILED, got " + state);
    }
    errors = errors == null ? null : List.copyOf(errors);
  }

  public static TaskOutcome complete(Object result) {
    return new TaskOutcome(TaskState.COMPLETE, result, null);
  }

  public static TaskOutcome failed(String error) {
    return new TaskOutcome(TaskState.FAILED, null, List.of(error));
  }

  public boolean isComplete() {
    return state == TaskState.COMPLETE;
  }

  /** Field changes to record for this outcome. */
  public Map<String, Object> changes() {
    Map<String, Object> changes = new LinkedHashMap<>();
    changes.put(Task.STATE, state);
    if (isComplete()) {
      changes.put(Task.RESULT, result);
    } else {
      changes.put(Task.ERRORS, errors);
    }
    return changes;
  }
}
