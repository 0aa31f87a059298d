package io.surfworks.crane.state;

import java.util.Set;

/**
 * A lifecycle state backed by a {@link TransitionTable}.
 *
 * <p>Implemented by enums. Each enum builds its table once and returns it
 * from {@link #transitions()}:
 * <pre>{@code
 * public enum LampState implements State<LampState> {
 *     OFF, ON, BROKEN;
 *
 *     private static final TransitionTable<LampState> TRANSITIONS =
 *             TransitionTable.builder(LampState.class, OFF)
 *                     .allow(OFF, ON, BROKEN)
 *                     .allow(ON, OFF, BROKEN)
 *                     .build();
 *
 *     public TransitionTable<LampState> transitions() {
 *         return TRANSITIONS;
 *     }
 * }
 * }</pre>
 *
 * @param <S> the implementing enum
 */
public interface State<S extends Enum<S> & State<S>> {

    /**
     * Returns the transition table of this state type.
     */
    TransitionTable<S> transitions();

    /**
     * Checks that this state may move to {@code next}.
     *
     * @throws StateTransitionException if the transition is not declared
     */
    default void validate(S next) {
        transitions().validate(self(), next);
    }

    /**
     * Checks that this state may move to at least one state of {@code mask}.
     *
     * @throws StateTransitionException if none of {@code mask} is a declared successor
     */
    default void validateAny(Set<S> mask) {
        transitions().validateAny(self(), mask);
    }

    default boolean canTransitionTo(S next) {
        return transitions().canTransition(self(), next);
    }

    /**
     * Returns true if this state may move to at least one state of {@code mask}.
     */
    default boolean canTransitionToAny(Set<S> mask) {
        return transitions().canTransitionToAny(self(), mask);
    }

    /**
     * Returns true if no transition leaves this state.
     */
    default boolean isTerminal() {
        return transitions().isTerminal(self());
    }

    /**
     * Returns the integer flag of this state ({@code 1 << ordinal}).
     */
    default int flag() {
        return transitions().flag(self());
    }

    @SuppressWarnings("unchecked")
    private S self() {
        return (S) this;
    }
}
