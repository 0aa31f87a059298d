package io.surfworks.crane.state;

import java.time.Clock;
import java.util.Objects;

/**
 * Base class for entities that own a {@link StateHistory}.
 *
 * <p>The current state is always the last state of the history. Transitions
 * replace the held history under the entity's lock, so concurrent callers
 * observe transitions in order and never a partially applied one.
 *
 * @param <S> the state enum
 */
public abstract class StatefulEntity<S extends Enum<S> & State<S>> {

    private volatile StateHistory<S> stateHistory;

    protected StatefulEntity(StateHistory<S> stateHistory) {
        this.stateHistory = Objects.requireNonNull(stateHistory, "stateHistory cannot be null");
    }

    /**
     * Returns the current state.
     */
    public S state() {
        return stateHistory.curr();
    }

    public StateHistory<S> stateHistory() {
        return stateHistory;
    }

    /**
     * Moves the entity to {@code next}.
     *
     * @throws StateTransitionException if the current state may not move to {@code next}
     */
    public synchronized void transition(S next) {
        stateHistory = stateHistory.transition(next);
    }

    public synchronized void transition(S next, Clock clock) {
        stateHistory = stateHistory.transition(next, clock);
    }

    /**
     * Discards the history and starts over from the initial state.
     */
    public synchronized void resetState() {
        stateHistory = stateHistory.reset();
    }
}
