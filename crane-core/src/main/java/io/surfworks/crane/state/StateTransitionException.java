package io.surfworks.crane.state;

import java.util.Set;

/**
 * Thrown when a state transition is not allowed by the transition table.
 */
public class StateTransitionException extends IllegalStateException {

    private final Enum<?> from;
    private final Set<? extends Enum<?>> targets;

    public StateTransitionException(Enum<?> from, Enum<?> to) {
        super("Invalid state transition from " + from + " to " + to);
        this.from = from;
        this.targets = Set.of(to);
    }

    /**
     * Creates an exception for a state that may move to none of {@code targets}.
     */
    public StateTransitionException(Enum<?> from, Set<? extends Enum<?>> targets) {
        super("Invalid state transition from " + from + " to any of " + targets);
        this.from = from;
        this.targets = Set.copyOf(targets);
    }

    /**
     * Returns the state the transition started from.
     */
    public Enum<?> from() {
        return from;
    }

    /**
     * Returns the rejected target state, or null if a set of targets was rejected.
     */
    public Enum<?> to() {
        return targets.size() == 1 ? targets.iterator().next() : null;
    }

    /**
     * Returns every rejected target state.
     */
    public Set<? extends Enum<?>> targets() {
        return targets;
    }
}
