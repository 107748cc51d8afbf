package ai.kasino.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, append-only record of executed moves.
 * <p>
 * The log keeps at most {@link #capacity()} entries; appending to a full log drops the oldest
 * entry. Instances are immutable: {@link #append(GameAction)} returns a new log.
 */
public final class ActionLog {
    /** Default retention used by the engine. */
    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final List<GameAction> entries;

    private ActionLog(int capacity, List<GameAction> entries) {
        this.capacity = capacity;
        this.entries = entries;
    }

    /**
     * Creates an empty log.
     *
     * @param capacity maximum number of retained entries; must be positive
     * @return the empty log
     */
    public static ActionLog empty(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Action log capacity must be positive: " + capacity);
        }
        return new ActionLog(capacity, List.of());
    }

    /**
     * Returns a log with the action appended, dropping the oldest entries beyond capacity.
     */
    public ActionLog append(GameAction action) {
        Objects.requireNonNull(action, "action");
        List<GameAction> next = new ArrayList<>(Math.min(entries.size() + 1, capacity));
        int skip = Math.max(0, entries.size() + 1 - capacity);
        next.addAll(entries.subList(skip, entries.size()));
        next.add(action);
        return new ActionLog(capacity, Collections.unmodifiableList(next));
    }

    /** Entries from oldest to newest. */
    public List<GameAction> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** The most recent entry, or {@code null} if the log is empty. */
    public GameAction last() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActionLog)) {
            return false;
        }
        ActionLog other = (ActionLog) o;
        return capacity == other.capacity && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, entries);
    }

    @Override
    public String toString() {
        return "ActionLog(size=" + entries.size() + ", capacity=" + capacity + ")";
    }
}
