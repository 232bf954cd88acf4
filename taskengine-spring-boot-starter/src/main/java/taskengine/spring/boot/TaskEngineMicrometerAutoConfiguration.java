package taskengine.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import taskengine.micrometer.MicrometerMetricsExporter;
import taskengine.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code taskengine.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link TaskEngineAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the engine. The engine closes the exporter, so no destroy method
 * is declared here.
 */
@AutoConfiguration(before = TaskEngineAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "taskengine.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(TaskEngineProperties.class)
public class TaskEngineMicrometerAutoConfiguration {

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, TaskEngineProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
