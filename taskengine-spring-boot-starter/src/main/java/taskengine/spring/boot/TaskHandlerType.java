package taskengine.spring.boot;

import taskengine.Affinity;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for a task type.
 *
 * <p>The annotated bean must implement {@link taskengine.TaskHandler}.
 *
 * <pre>{@code
 * @Component
 * @TaskHandlerType(value = "status", affinity = Affinity.PARALLEL)
 * public class StatusHandler implements TaskHandler {
 *   public Object handle(Task task) { ... }
 * }
 * }</pre>
 *
 * @see TaskHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TaskHandlerType {

    /**
     * Task type name.
     */
    String value();

    /**
     * Queue the type's tasks are routed to. Defaults to {@link Affinity#SERIAL}.
     */
    Affinity affinity() default Affinity.SERIAL;
}
