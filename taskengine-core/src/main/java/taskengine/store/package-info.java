/**
 * Store implementations.
 *
 * @see taskengine.store.InMemoryTaskStore
 */
package taskengine.store;
