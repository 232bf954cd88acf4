package taskengine;

/**
 * Thrown when a mutation targets a task id that was never created.
 */
public class TaskNotFoundException extends RuntimeException {

  private final long taskId;

  public TaskNotFoundException(long taskId) {
    super("No task with id " + taskId);
    this.taskId = taskId;
  }

  public long taskId() {
    return taskId;
  }
}
