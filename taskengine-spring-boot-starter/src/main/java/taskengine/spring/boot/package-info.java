/**
 * Spring Boot auto-configuration for the task engine.
 *
 * <p>Handlers are Spring beans implementing {@link taskengine.TaskHandler} and annotated
 * with {@link taskengine.spring.boot.TaskHandlerType}. Settings live under the
 * {@code taskengine} prefix, see {@link taskengine.spring.boot.TaskEngineProperties}.
 */
package taskengine.spring.boot;
