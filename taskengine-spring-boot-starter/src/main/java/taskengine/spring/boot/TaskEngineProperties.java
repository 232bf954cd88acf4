package taskengine.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the task engine.
 *
 * @see TaskEngineAutoConfiguration
 */
@ConfigurationProperties(prefix = "taskengine")
public class TaskEngineProperties {

    /**
     * Number of workers draining the parallel queue.
     */
    private int parallelWorkers = 4;

    /**
     * Start the worker pools when the engine bean is created.
     */
    private boolean autoStart = true;

    /**
     * How long {@code close()} waits for queued tasks before interrupting workers.
     */
    private long drainTimeoutMs = 5000;

    private final Queues queues = new Queues();
    private final Metrics metrics = new Metrics();

    public int getParallelWorkers() {
        return parallelWorkers;
    }

    public void setParallelWorkers(int parallelWorkers) {
        this.parallelWorkers = parallelWorkers;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public Queues getQueues() {
        return queues;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Queues {
        private int dispatchCapacity = 500;
        private int serialCapacity = 500;
        private int parallelCapacity = 50;
        private int highPriorityCapacity = 50;

        public int getDispatchCapacity() {
            return dispatchCapacity;
        }

        public void setDispatchCapacity(int dispatchCapacity) {
            this.dispatchCapacity = dispatchCapacity;
        }

        public int getSerialCapacity() {
            return serialCapacity;
        }

        public void setSerialCapacity(int serialCapacity) {
            this.serialCapacity = serialCapacity;
        }

        public int getParallelCapacity() {
            return parallelCapacity;
        }

        public void setParallelCapacity(int parallelCapacity) {
            this.parallelCapacity = parallelCapacity;
        }

        public int getHighPriorityCapacity() {
            return highPriorityCapacity;
        }

        public void setHighPriorityCapacity(int highPriorityCapacity) {
            this.highPriorityCapacity = highPriorityCapacity;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "taskengine";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
