package io.surfworks.crane.state;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declared transitions of a state machine.
 *
 * <p>Each row maps a state to the set of states it may move to. A state
 * without a row is terminal. Every state carries an integer flag,
 * {@code 1 << ordinal}, which is its wire representation.
 *
 * <p>Tables are immutable and meant to be built once per state type, in a
 * static initializer of the state enum.
 *
 * @param <S> the state enum
 */
public final class TransitionTable<S extends Enum<S>> {

    private final Class<S> type;
    private final S initial;
    private final Map<S, Set<S>> rows;

    private TransitionTable(Class<S> type, S initial, Map<S, Set<S>> rows) {
        this.type = type;
        this.initial = initial;
        this.rows = rows;
    }

    /**
     * Starts a table for the given state type.
     *
     * @param type    the state enum class
     * @param initial the state every history starts in
     */
    public static <S extends Enum<S>> Builder<S> builder(Class<S> type, S initial) {
        return new Builder<>(type, initial);
    }

    public Class<S> type() {
        return type;
    }

    public S initial() {
        return initial;
    }

    /**
     * Returns every declared state, in declaration order.
     */
    public Set<S> states() {
        return Collections.unmodifiableSet(EnumSet.allOf(type));
    }

    /**
     * Returns the states {@code from} may move to; empty for a terminal state.
     */
    public Set<S> successors(S from) {
        Set<S> next = rows.get(from);
        return next == null ? Collections.unmodifiableSet(EnumSet.noneOf(type)) : next;
    }

    public boolean isTerminal(S state) {
        return !rows.containsKey(state);
    }

    public boolean canTransition(S from, S to) {
        Set<S> next = rows.get(from);
        return next != null && next.contains(to);
    }

    /**
     * Returns true if {@code from} may move to at least one state of {@code mask}.
     */
    public boolean canTransitionToAny(S from, Set<S> mask) {
        Set<S> next = rows.get(from);
        return next != null && !Collections.disjoint(next, mask);
    }

    /**
     * Checks a transition.
     *
     * @throws StateTransitionException if {@code from} may not move to {@code to}
     */
    public void validate(S from, S to) {
        if (!canTransition(from, to)) {
            throw new StateTransitionException(from, to);
        }
    }

    /**
     * Checks that {@code from} may move to at least one state of {@code mask}.
     *
     * @throws StateTransitionException if no state of {@code mask} is a successor of {@code from}
     */
    public void validateAny(S from, Set<S> mask) {
        if (!canTransitionToAny(from, mask)) {
            throw new StateTransitionException(from, mask);
        }
    }

    /**
     * Returns the integer flag of a state.
     */
    public int flag(S state) {
        return 1 << state.ordinal();
    }

    /**
     * Returns the integer mask of a set of states.
     */
    public int mask(Set<S> states) {
        int mask = 0;
        for (S state : states) {
            mask |= flag(state);
        }
        return mask;
    }

    /**
     * Returns the state with the given flag.
     *
     * @throws IllegalArgumentException if no single state has this flag
     */
    public S fromFlag(int flag) {
        for (S state : type.getEnumConstants()) {
            if (flag(state) == flag) {
                return state;
            }
        }
        throw new IllegalArgumentException("No " + type.getSimpleName() + " with flag " + flag);
    }

    /**
     * Builder for {@link TransitionTable}.
     */
    public static final class Builder<S extends Enum<S>> {

        private final Class<S> type;
        private final S initial;
        private final Map<S, Set<S>> rows;

        private Builder(Class<S> type, S initial) {
            this.type = Objects.requireNonNull(type, "type cannot be null");
            this.initial = Objects.requireNonNull(initial, "initial cannot be null");
            this.rows = new EnumMap<>(type);
        }

        /**
         * Allows {@code from} to move to the given states. Repeated calls for
         * the same state merge their targets.
         */
        @SafeVarargs
        public final Builder<S> allow(S from, S first, S... rest) {
            return allow(from, EnumSet.of(first, rest));
        }

        /**
         * Allows {@code from} to move to every state of {@code mask}.
         */
        public Builder<S> allow(S from, Set<S> mask) {
            Objects.requireNonNull(from, "from cannot be null");
            if (mask.isEmpty()) {
                throw new IllegalArgumentException("Transition mask of " + from + " is empty");
            }
            rows.computeIfAbsent(from, s -> EnumSet.noneOf(type)).addAll(mask);
            return this;
        }

        public TransitionTable<S> build() {
            if (type.getEnumConstants().length > Integer.SIZE - 1) {
                throw new IllegalStateException(type.getSimpleName() + " has too many states for an int flag");
            }
            Map<S, Set<S>> frozen = new EnumMap<>(type);
            rows.forEach((from, next) -> frozen.put(from, Collections.unmodifiableSet(EnumSet.copyOf(next))));
            return new TransitionTable<>(type, initial, Collections.unmodifiableMap(frozen));
        }
    }
}
