package taskengine;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one change applied to a {@link Task}.
 *
 * <p>Events form an append-only log. Ids come from a counter independent of task ids and
 * are strictly increasing in the order the store serialized the updates, which is the
 * system-wide order of all observed transitions.
 *
 * <p>{@link #changed()} holds exactly the field/value pairs of the update. The initiating
 * event of a task holds its initial fields, so replaying all events of a task
 * reproduces it (see {@link TaskHistory}).
 */
public final class TaskEvent {
  public static final String ID = "id";
  public static final String TASK = "task";
  public static final String CREATED = "created";
  public static final String CHANGED = "changed";
  public static final String ERRORS = "errors";

  private final long id;
  private final long taskId;
  private final Instant created;
  private final Map<String, Object> changed;
  private final List<String> errors;

  public TaskEvent(long id, long taskId, Instant created, Map<String, ?> changed, List<String> errors) {
    if (id <= 0) {
      throw new IllegalArgumentException("id must be > 0");
    }
    this.id = id;
    this.taskId = taskId;
    this.created = Objects.requireNonNull(created, "created");
    this.changed = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(changed, "changed")));
    this.errors = errors == null ? null : List.copyOf(errors);
  }

  public long id() {
    return id;
  }

  /** Id of the task this event describes. */
  public long taskId() {
    return taskId;
  }

  public Instant created() {
    return created;
  }

  public Map<String, Object> changed() {
    return changed;
  }

  /** Errors carried by a failing transition, otherwise {@code null}. */
  public List<String> errors() {
    return errors;
  }

  /** Wire shape: {@code {id, task, created, changed, errors?}}. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(ID, id);
    map.put(TASK, taskId);
    map.put(CREATED, created.toEpochMilli());
    Map<String, Object> wireChanged = new LinkedHashMap<>();
    changed.forEach((field, value) -> wireChanged.put(field, toWire(value)));
    map.put(CHANGED, Collections.unmodifiableMap(wireChanged));
    if (errors != null) {
      map.put(ERRORS, errors);
    }
    return Collections.unmodifiableMap(map);
  }

  private static Object toWire(Object value) {
    if (value instanceof TaskState s) return s.wireName();
    if (value instanceof Affinity a) return a.queueName();
    if (value instanceof Instant i) return i.toEpochMilli();
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TaskEvent other)) return false;
    return id == other.id
        && taskId == other.taskId
        && created.equals(other.created)
        && changed.equals(other.changed)
        && Objects.equals(errors, other.errors);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, taskId, created, changed, errors);
  }

  @Override
  public String toString() {
    return "TaskEvent{id=" + id + ", task=" + taskId + ", changed=" + changed + "}";
  }
}
