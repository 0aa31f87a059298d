package io.surfworks.crane.state;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only record of the states an entity went through and when.
 *
 * <p>Timestamps are unix seconds. A history is never empty: it starts with
 * the initial state of its transition table, every consecutive pair of
 * states is a declared transition, and timestamps never decrease.
 *
 * <p>Histories are immutable; {@link #transition} returns a new history.
 *
 * @param <S> the state enum
 */
public final class StateHistory<S extends Enum<S> & State<S>> {

    private final TransitionTable<S> table;
    private final List<Double> timestamps;
    private final List<S> states;

    private StateHistory(TransitionTable<S> table, List<Double> timestamps, List<S> states) {
        this.table = table;
        this.timestamps = timestamps;
        this.states = states;
    }

    /**
     * Creates a history holding only the initial state, stamped now.
     */
    public static <S extends Enum<S> & State<S>> StateHistory<S> fromInit(Class<S> type) {
        return fromInit(type, Clock.systemUTC());
    }

    /**
     * Creates a history holding only the initial state, stamped with {@code clock}.
     */
    public static <S extends Enum<S> & State<S>> StateHistory<S> fromInit(Class<S> type, Clock clock) {
        TransitionTable<S> table = tableOf(type);
        return new StateHistory<>(table, List.of(epochSeconds(clock)), List.of(table.initial()));
    }

    /**
     * Rebuilds a history from recorded states and timestamps.
     *
     * @throws IllegalArgumentException  if the lists are empty, differ in length, do not
     *                                   start with the initial state or go back in time
     * @throws StateTransitionException if two consecutive states are not a declared transition
     */
    public static <S extends Enum<S> & State<S>> StateHistory<S> of(
            Class<S> type, List<Double> timestamps, List<S> states) {
        Objects.requireNonNull(timestamps, "timestamps cannot be null");
        Objects.requireNonNull(states, "states cannot be null");
        TransitionTable<S> table = tableOf(type);

        if (states.isEmpty()) {
            throw new IllegalArgumentException("State history cannot be empty");
        }
        if (states.size() != timestamps.size()) {
            throw new IllegalArgumentException(String.format(
                    "%d states but %d timestamps", states.size(), timestamps.size()));
        }
        if (states.get(0) != table.initial()) {
            throw new IllegalArgumentException(String.format(
                    "State history must start with %s, not %s", table.initial(), states.get(0)));
        }
        for (int i = 1; i < states.size(); i++) {
            table.validate(states.get(i - 1), states.get(i));
            if (timestamps.get(i) < timestamps.get(i - 1)) {
                throw new IllegalArgumentException("Timestamps must be non-decreasing at index " + i);
            }
        }
        return new StateHistory<>(table, List.copyOf(timestamps), List.copyOf(states));
    }

    private static <S extends Enum<S> & State<S>> TransitionTable<S> tableOf(Class<S> type) {
        S[] constants = type.getEnumConstants();
        if (constants == null || constants.length == 0) {
            throw new IllegalArgumentException(type.getName() + " declares no states");
        }
        return constants[0].transitions();
    }

    private static double epochSeconds(Clock clock) {
        Instant now = clock.instant();
        return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
    }

    /**
     * Moves to {@code next}, stamped now.
     *
     * @return a new history ending in {@code next}
     * @throws StateTransitionException if the current state may not move to {@code next}
     */
    public StateHistory<S> transition(S next) {
        return transition(next, Clock.systemUTC());
    }

    /**
     * Moves to {@code next}, stamped with {@code clock}. A clock reading earlier than the
     * last timestamp is raised to it.
     *
     * @return a new history ending in {@code next}
     * @throws StateTransitionException if the current state may not move to {@code next}
     */
    public StateHistory<S> transition(S next, Clock clock) {
        Objects.requireNonNull(next, "next cannot be null");
        table.validate(curr(), next);

        double timestamp = Math.max(epochSeconds(clock), timestamp());

        List<Double> newTimestamps = new ArrayList<>(timestamps.size() + 1);
        newTimestamps.addAll(timestamps);
        newTimestamps.add(timestamp);

        List<S> newStates = new ArrayList<>(states.size() + 1);
        newStates.addAll(states);
        newStates.add(next);

        return new StateHistory<>(table, Collections.unmodifiableList(newTimestamps),
                Collections.unmodifiableList(newStates));
    }

    /**
     * Returns a fresh history holding only the initial state.
     */
    public StateHistory<S> reset() {
        return fromInit(table.type());
    }

    public StateHistory<S> reset(Clock clock) {
        return fromInit(table.type(), clock);
    }

    /**
     * Returns the current state.
     */
    public S curr() {
        return states.get(states.size() - 1);
    }

    /**
     * Returns the time of the latest transition.
     */
    public double timestamp() {
        return timestamps.get(timestamps.size() - 1);
    }

    /**
     * Returns the time the history was created.
     */
    public double created() {
        return timestamps.get(0);
    }

    /**
     * Returns the time elapsed since creation.
     */
    public Duration elapsed(Clock clock) {
        return secondsBetween(created(), epochSeconds(clock));
    }

    public Duration elapsed() {
        return elapsed(Clock.systemUTC());
    }

    /**
     * Returns the time spent in the current state so far.
     */
    public Duration timeInCurrentState(Clock clock) {
        return secondsBetween(timestamp(), epochSeconds(clock));
    }

    private static Duration secondsBetween(double from, double to) {
        return Duration.ofNanos(Math.round(Math.max(0.0, to - from) * 1_000_000_000.0));
    }

    /**
     * Returns the {@code index}-th transition.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public StateEntry<S> get(int index) {
        return new StateEntry<>(states.get(index), timestamps.get(index));
    }

    /**
     * Returns the transitions from {@code fromIndex} (inclusive) to {@code toIndex} (exclusive).
     */
    public List<StateEntry<S>> subList(int fromIndex, int toIndex) {
        List<StateEntry<S>> entries = new ArrayList<>(Math.max(0, toIndex - fromIndex));
        for (int i = fromIndex; i < toIndex; i++) {
            entries.add(get(i));
        }
        return Collections.unmodifiableList(entries);
    }

    public List<StateEntry<S>> entries() {
        return subList(0, size());
    }

    public int size() {
        return states.size();
    }

    public List<S> states() {
        return states;
    }

    public List<Double> timestamps() {
        return timestamps;
    }

    public TransitionTable<S> table() {
        return table;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateHistory<?> that)) return false;
        return table.type() == that.table.type()
                && states.equals(that.states)
                && timestamps.equals(that.timestamps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table.type(), states, timestamps);
    }

    @Override
    public String toString() {
        return "StateHistory(states=" + states + ", timestamps=" + timestamps + ")";
    }
}
