package taskengine;

/**
 * Handler that performs the work of one task type.
 *
 * <p>Handlers run <b>synchronously</b> on a worker thread of the pool matching the task
 * type's {@link Affinity}. The returned value is recorded as the task's {@code result}.
 *
 * <h2>Error Handling</h2>
 * <p>Any exception thrown by a handler is caught by the worker and turned into a
 * {@link TaskState#FAILED} transition carrying the exception message. The worker then
 * continues with the next task.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * engine.registerTaskType("move", task -> {
 *   arm.moveThrough(task.payload().get("waypoints"));
 *   return "done";
 * }, Affinity.SERIAL);
 * }</pre>
 *
 * @see taskengine.registry.TaskTypeRegistry
 */
@FunctionalInterface
public interface TaskHandler {

  /**
   * Performs the task.
   *
   * @param task the task as stored when the worker picked it up
   * @return the result value, may be {@code null}
   * @throws Exception if the task fails
   */
  Object handle(Task task) throws Exception;
}
