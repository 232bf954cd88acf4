package taskengine;

/**
 * Thrown by {@code addTask} when the requested task type has no registered handler.
 * No task is created and no task id is consumed.
 */
public class UnrecognizedTaskTypeException extends RuntimeException {

  private final String taskType;

  public UnrecognizedTaskTypeException(String taskType) {
    super("Unrecognized task type " + taskType);
    this.taskType = taskType;
  }

  public String taskType() {
    return taskType;
  }
}
