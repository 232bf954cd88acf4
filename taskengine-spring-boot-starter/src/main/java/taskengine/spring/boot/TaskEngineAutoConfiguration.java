package taskengine.spring.boot;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import taskengine.TaskEngine;
import taskengine.registry.DefaultTaskTypeRegistry;
import taskengine.spi.MetricsExporter;

/**
 * Auto-configuration for the task engine.
 *
 * <p>Wires a {@link TaskEngine} with an in-memory store from {@link TaskEngineProperties},
 * registers every {@link TaskHandlerType} bean, and starts the worker pools unless
 * {@code taskengine.auto-start=false}. The engine is closed with the context, draining
 * queued tasks.
 *
 * @see TaskEngineProperties
 * @see TaskEngineMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(TaskEngine.class)
@EnableConfigurationProperties(TaskEngineProperties.class)
public class TaskEngineAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public DefaultTaskTypeRegistry taskTypeRegistry() {
    return new DefaultTaskTypeRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public TaskHandlerRegistrar taskHandlerRegistrar(
      ListableBeanFactory beanFactory, DefaultTaskTypeRegistry taskTypeRegistry) {
    return new TaskHandlerRegistrar(beanFactory, taskTypeRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public TaskEngine taskEngine(TaskEngineProperties props,
      DefaultTaskTypeRegistry taskTypeRegistry,
      ObjectProvider<MetricsExporter> metricsProvider) {

    TaskEngineProperties.Queues queues = props.getQueues();
    var builder = TaskEngine.builder()
        .registry(taskTypeRegistry)
        .parallelWorkers(props.getParallelWorkers())
        .dispatchCapacity(queues.getDispatchCapacity())
        .serialCapacity(queues.getSerialCapacity())
        .parallelCapacity(queues.getParallelCapacity())
        .highPriorityCapacity(queues.getHighPriorityCapacity())
        .drainTimeoutMs(props.getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    TaskEngine engine = builder.build();
    if (props.isAutoStart()) {
      engine.start();
    }
    return engine;
  }
}
