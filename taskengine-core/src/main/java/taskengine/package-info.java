/**
 * Root API of the task engine: task and event records, handlers, and the
 * {@link taskengine.TaskEngine} facade.
 *
 * <h2>Core Design</h2>
 * <p>A task is created with {@link taskengine.TaskEngine#addTask}. The store assigns a
 * sequential id, resolves the type's {@link taskengine.Affinity} from the
 * {@linkplain taskengine.registry.TaskTypeRegistry registry} and writes the initiating
 * {@link taskengine.TaskEvent}. The id then enters the dispatch queue; a router forwards the
 * task to the serial, parallel or high-priority queue, and a worker pool runs its handler.
 *
 * <p>Every state change is one event. Event ids are assigned in the order the store
 * serializes updates, which is the true order of transitions across all queues.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>taskengine-core</b>: model, registry, store, dispatcher (zero external deps)</li>
 *   <li><b>taskengine-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>taskengine-spring-boot-starter</b>: auto-configuration and annotated handlers</li>
 * </ul>
 *
 * @see taskengine.TaskEngine
 * @see taskengine.Task
 * @see taskengine.TaskEvent
 * @see taskengine.TaskHandler
 */
package taskengine;
