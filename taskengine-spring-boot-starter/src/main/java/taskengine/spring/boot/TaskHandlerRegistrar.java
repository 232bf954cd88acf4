package taskengine.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import taskengine.TaskHandler;
import taskengine.registry.DefaultTaskTypeRegistry;

import java.util.Map;

/**
 * Scans for beans annotated with {@link TaskHandlerType} and registers them in the
 * {@link DefaultTaskTypeRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * Tasks added before that point fail with an unrecognized type.
 *
 * @see TaskHandlerType
 */
public class TaskHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultTaskTypeRegistry registry;

    public TaskHandlerRegistrar(ListableBeanFactory beanFactory, DefaultTaskTypeRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(TaskHandlerType.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof TaskHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @TaskHandlerType must implement TaskHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // proxies may hide the annotation
            TaskHandlerType annotation = AnnotationUtils.findAnnotation(bean.getClass(), TaskHandlerType.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @TaskHandlerType annotation on " + bean.getClass().getName());
            }
            if (annotation.value().isEmpty()) {
                throw new BeanCreationException(beanName, "@TaskHandlerType value must not be empty");
            }

            registry.register(annotation.value(), handler, annotation.affinity());
        }
    }
}
