/**
 * Dispatch engine: bounded queues, the affinity router, worker pools and the pause switch.
 *
 * <p>{@link taskengine.dispatch.TaskDispatcher} wires a dispatch queue, a single router and
 * one pool per {@link taskengine.Affinity}. Handlers are invoked through
 * {@link taskengine.dispatch.TaskRunner}, which turns every failure into a task state.
 *
 * @see taskengine.dispatch.TaskDispatcher
 * @see taskengine.dispatch.ExecutionController
 * @see taskengine.dispatch.BoundedQueue
 */
package taskengine.dispatch;
