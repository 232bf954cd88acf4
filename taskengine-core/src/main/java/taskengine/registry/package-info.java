/**
 * Task type registration: maps each type name to its {@link taskengine.TaskHandler} and
 * {@link taskengine.Affinity}.
 *
 * @see taskengine.registry.TaskTypeRegistry
 * @see taskengine.registry.DefaultTaskTypeRegistry
 */
package taskengine.registry;
