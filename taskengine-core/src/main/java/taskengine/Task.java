package taskengine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a task record.
 *
 * <p>Tasks are created by the store with a sequential {@code id} and are never deleted.
 * Every mutation produces a new snapshot through {@link #withChanges(Map, long)}, paired
 * with exactly one {@link TaskEvent}. The {@link #affinity()} is resolved from the
 * registry at creation time and cannot be changed afterwards.
 *
 * <p>Fields that are not part of the core record (for example {@code waypoints}) are kept
 * as an opaque {@linkplain #payload() payload} map.
 *
 * @see TaskEvent
 * @see taskengine.spi.TaskStore
 */
public final class Task {
    public static final String ID = "id";
    public static final String TYPE = "type";
    public static final String CREATED = "created";
    public static final String UPDATE = "update";
    public static final String STATE = "state";
    public static final String AFFINITY = "affinity";
    public static final String RESULT = "result";
    public static final String ERRORS = "errors";

    /** Fields owned by the store; they cannot be changed through an update. */
    public static final Set<String> RESERVED_FIELDS = Set.of(ID, TYPE, CREATED, UPDATE, AFFINITY);

    private final long id;
    private final String type;
    private final Instant created;
    private final long update;
    private final TaskState state;
    private final Affinity affinity;
    private final Object result;
    private final List<String> errors;
    private final Map<String, Object> payload;

    private Task(Builder builder) {
        if (builder.id <= 0) {
            throw new IllegalArgumentException("id must be > 0");
        }
        this.id = builder.id;
        this.type = Objects.requireNonNull(builder.type, "type");
        this.created = Objects.requireNonNull(builder.created, "created");
        this.update = builder.update;
        this.state = builder.state;
        this.affinity = Objects.requireNonNull(builder.affinity, "affinity");
        this.result = builder.result;
        this.errors = builder.errors == null ? null : List.copyOf(builder.errors);
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
    }

    public static Builder builder(long id, String type) {
        return new Builder(id, type);
    }

    public long id() {
        return id;
    }

    public String type() {
        return type;
    }

    public Instant created() {
        return created;
    }

    /** Id of the most recent event that changed this task, {@code 0} before the first one. */
    public long update() {
        return update;
    }

    /** Current state, {@code null} only before the initiating event is written. */
    public TaskState state() {
        return state;
    }

    public Affinity affinity() {
        return affinity;
    }

    public Object result() {
        return result;
    }

    /** Failure diagnostics, {@code null} unless a transition recorded errors. */
    public List<String> errors() {
        return errors;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    /**
     * Returns a copy with the given field changes merged in and {@code update} set to
     * {@code eventId}.
     *
     * @throws IllegalArgumentException if a change targets a reserved field or carries a
     *     value of the wrong type for a core field
     */
    public Task withChanges(Map<String, ?> changes, long eventId) {
        Builder b = toBuilder().update(eventId);
        for (Map.Entry<String, ?> change : changes.entrySet()) {
            String field = Objects.requireNonNull(change.getKey(), "field");
            Object value = change.getValue();
            if (RESERVED_FIELDS.contains(field)) {
                throw new IllegalArgumentException("Field '" + field + "' cannot be updated");
            }
            switch (field) {
                case STATE -> b.state(toState(value));
                case RESULT -> b.result(value);
                case ERRORS -> b.errors(toErrors(value));
                default -> b.payload.put(field, value);
            }
        }
        return b.build();
    }

    /**
     * Renders the task in its wire shape:
     * {@code {id, type, created, update, state, affinity, result?, errors?, ...payload}}.
     * {@code created} is rendered as epoch milliseconds.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(ID, id);
        map.put(TYPE, type);
        map.put(CREATED, created.toEpochMilli());
        map.put(UPDATE, update);
        map.put(STATE, state == null ? null : state.wireName());
        map.put(AFFINITY, affinity.queueName());
        if (result != null) {
            map.put(RESULT, result);
        }
        if (errors != null) {
            map.put(ERRORS, errors);
        }
        payload.forEach(map::putIfAbsent);
        return Collections.unmodifiableMap(map);
    }

    Builder toBuilder() {
        Builder b = new Builder(id, type)
                .created(created)
                .update(update)
                .state(state)
                .affinity(affinity)
                .result(result)
                .errors(errors);
        b.payload.putAll(payload);
        return b;
    }

    static TaskState toState(Object value) {
        if (value instanceof TaskState s) {
            return s;
        }
        if (value instanceof String s) {
            return TaskState.valueOf(s.toUpperCase(Locale.ROOT));
        }
        throw new IllegalArgumentException("state must be a TaskState, got " + value);
    }

    static List<String> toErrors(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> c) {
            List<String> out = new ArrayList<>(c.size());
            for (Object o : c) {
                out.add(String.valueOf(o));
            }
            return out;
        }
        return List.of(String.valueOf(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task other)) return false;
        return id == other.id
                && update == other.update
                && type.equals(other.type)
                && created.equals(other.created)
                && state == other.state
                && affinity == other.affinity
                && Objects.equals(result, other.result)
                && Objects.equals(errors, other.errors)
                && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, created, update, state, affinity, result, errors, payload);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", type=" + type + ", state=" + state
                + ", affinity=" + affinity + ", update=" + update + "}";
    }

    /** Builder for {@link Task}. Used by store implementations. */
    public static final class Builder {
        private final long id;
        private final String type;
        private Instant created;
        private long update;
        private TaskState state;
        private Affinity affinity;
        private Object result;
        private List<String> errors;
        private final Map<String, Object> payload = new LinkedHashMap<>();

        private Builder(long id, String type) {
            this.id = id;
            this.type = type;
        }

        public Builder created(Instant created) {
            this.created = created;
            return this;
        }

        public Builder update(long update) {
            this.update = update;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder affinity(Affinity affinity) {
            this.affinity = affinity;
            return this;
        }

        public Builder result(Object result) {
            this.result = result;
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors = errors;
            return this;
        }

        /**
         * Copies caller-supplied options into the payload. Reserved and core fields in
         * {@code options} are ignored; the store owns them.
         */
        public Builder payload(Map<String, ?> options) {
            if (options != null) {
                options.forEach((field, value) -> {
                    if (!RESERVED_FIELDS.contains(field) && !STATE.equals(field)
                            && !RESULT.equals(field) && !ERRORS.equals(field)) {
                        payload.put(field, value);
                    }
                });
            }
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
