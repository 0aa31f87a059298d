package io.surfworks.crane.container;

import io.surfworks.crane.state.State;
import io.surfworks.crane.state.TransitionTable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a physical container.
 *
 * <p>The node manager updates container state; the cluster manager reads it.
 */
public enum ContainerState implements State<ContainerState> {
    /** Container is down, not yet picked up by the node manager */
    DOWN,

    /** Container is launching */
    READY,

    /** Container is running */
    RUNNING,

    /** Container exited successfully */
    DONE,

    /** Container exited unsuccessfully */
    ERROR,

    /** Container configuration is invalid */
    INVALID;

    public static final Set<ContainerState> FAILURE = Collections.unmodifiableSet(EnumSet.of(INVALID, ERROR));

    public static final Set<ContainerState> TERMINATED =
            Collections.unmodifiableSet(EnumSet.of(INVALID, ERROR, DONE));

    private static final TransitionTable<ContainerState> TRANSITIONS =
            TransitionTable.builder(ContainerState.class, DOWN)
                    .allow(DOWN, READY, ERROR)
                    .allow(READY, RUNNING)
                    .allow(READY, FAILURE)
                    .allow(RUNNING, DONE, ERROR)
                    .build();

    @Override
    public TransitionTable<ContainerState> transitions() {
        return TRANSITIONS;
    }

    /**
     * Returns true if the container ended with an error or an invalid configuration.
     */
    public boolean isFailure() {
        return FAILURE.contains(this);
    }
}
