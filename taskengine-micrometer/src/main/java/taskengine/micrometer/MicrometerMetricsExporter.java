package taskengine.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import taskengine.Affinity;
import taskengine.dispatch.TaskDispatcher;
import taskengine.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a distribution summary with a {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code taskengine.tasks.created}: tasks accepted by {@code addTask}</li>
 *   <li>{@code taskengine.tasks.completed}: handlers that returned normally</li>
 *   <li>{@code taskengine.tasks.failed}: handlers that threw, or had no handler</li>
 *   <li>{@code taskengine.tasks.cancelled}: tasks cancelled before finishing</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code taskengine.queue.dispatch.depth}</li>
 *   <li>{@code taskengine.queue.serial.depth}</li>
 *   <li>{@code taskengine.queue.parallel.depth}</li>
 *   <li>{@code taskengine.queue.high-priority.depth}</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code taskengine.handler.duration.ms}: handler execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter created;
  private final Counter completed;
  private final Counter failed;
  private final Counter cancelled;
  private final Map<String, AtomicInteger> depths = new LinkedHashMap<>();
  private final List<Gauge> depthGauges = new ArrayList<>();
  private final DistributionSummary handlerDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "taskengine"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "taskengine");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several engines in
   * one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "robot.tasks"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.created = Counter.builder(namePrefix + ".tasks.created")
        .description("Tasks accepted by addTask")
        .register(registry);
    this.completed = Counter.builder(namePrefix + ".tasks.completed")
        .description("Tasks whose handler returned normally")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".tasks.failed")
        .description("Tasks whose handler failed or was missing")
        .register(registry);
    this.cancelled = Counter.builder(namePrefix + ".tasks.cancelled")
        .description("Tasks cancelled before finishing")
        .register(registry);

    List<String> queues = new ArrayList<>();
    queues.add(TaskDispatcher.DISPATCH_QUEUE);
    for (Affinity affinity : Affinity.values()) {
      queues.add(affinity.queueName());
    }
    for (String queue : queues) {
      AtomicInteger depth = new AtomicInteger();
      depths.put(queue, depth);
      depthGauges.add(Gauge.builder(namePrefix + ".queue." + queue + ".depth", depth, AtomicInteger::get)
          .description("Items waiting in the " + queue + " queue")
          .register(registry));
    }

    this.handlerDuration = DistributionSummary.builder(namePrefix + ".handler.duration.ms")
        .description("Handler execution time in milliseconds")
        .register(registry);
  }

  @Override
  public void incrementTaskCreated() {
    if (closed) return;
    created.increment();
  }

  @Override
  public void incrementTaskCompleted() {
    if (closed) return;
    completed.increment();
  }

  @Override
  public void incrementTaskFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementTaskCancelled() {
    if (closed) return;
    cancelled.increment();
  }

  /** Unknown queue names are ignored. */
  @Override
  public void recordQueueDepth(String queue, int depth) {
    if (closed) return;
    AtomicInteger gauge = depths.get(queue);
    if (gauge != null) {
      gauge.set(depth);
    }
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link taskengine.TaskEngine#close()} so stale gauges do not outlive the
   * engine.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(created, completed, failed, cancelled, handlerDuration));
    meters.addAll(depthGauges);
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
