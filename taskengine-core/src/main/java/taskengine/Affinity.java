package taskengine;

import java.util.Locale;

/**
 * Execution affinity of a task type. Decides which queue and worker pool a task is routed to.
 */
public enum Affinity {
  /** Exclusive: one serial worker system-wide. */
  SERIAL(true),
  /** May run concurrently with other parallel tasks. */
  PARALLEL(true),
  /** Dedicated always-on worker that ignores the pause flag. */
  HIGH_PRIORITY(false);

  private final boolean pausable;

  Affinity(boolean pausable) {
    this.pausable = pausable;
  }

  /**
   * Returns whether workers for this affinity honour
   * {@link taskengine.dispatch.ExecutionController#pause()}.
   */
  public boolean isPausable() {
    return pausable;
  }

  /** Queue name, e.g. {@code "high-priority"}. */
  public String queueName() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
