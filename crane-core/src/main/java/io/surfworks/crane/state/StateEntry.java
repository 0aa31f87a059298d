package io.surfworks.crane.state;

import java.util.Objects;

/**
 * One transition of a {@link StateHistory}.
 *
 * @param state     the state entered
 * @param timestamp when it was entered, in unix seconds
 */
public record StateEntry<S>(S state, double timestamp) {

    public StateEntry {
        Objects.requireNonNull(state, "state cannot be null");
    }
}
