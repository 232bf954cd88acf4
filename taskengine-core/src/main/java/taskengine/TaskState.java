package taskengine;

import java.util.Locale;

/**
 * Lifecycle states of a {@link Task}.
 *
 * <p>{@link #NEW} is initial; {@link #COMPLETE}, {@link #FAILED} and {@link #CANCELLED}
 * are terminal.
 */
public enum TaskState {
  /** Created and waiting in a queue. */
  NEW,
  /** Taken by a worker. The handler may not have started yet if execution is paused. */
  PROCESSING,
  /** Handler returned normally; {@code result} is set. */
  COMPLETE,
  /** Handler threw or no handler was registered; {@code errors} is set. */
  FAILED,
  /** Cancelled before a result was recorded. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETE || this == FAILED || this == CANCELLED;
  }

  /** Lower-case name used on the wire, e.g. {@code "processing"}. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
