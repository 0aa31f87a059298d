package io.surfworks.crane.minicluster;

import io.surfworks.crane.state.State;
import io.surfworks.crane.state.TransitionTable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a mini cluster (a job and the resources it claims).
 */
public enum MiniClusterState implements State<MiniClusterState> {
    /** Waiting for resources */
    QUEUED,

    /** Holding resources and running */
    RUNNING,

    /** Resources fully preempted */
    PAUSED,

    /** Exited with an error */
    ERROR,

    /** Configuration is invalid */
    INVALID,

    /** Finished gracefully */
    DONE;

    public static final Set<MiniClusterState> TERMINATED =
            Collections.unmodifiableSet(EnumSet.of(INVALID, DONE, ERROR));

    private static final TransitionTable<MiniClusterState> TRANSITIONS =
            TransitionTable.builder(MiniClusterState.class, QUEUED)
                    .allow(QUEUED, RUNNING, ERROR)
                    .allow(RUNNING, QUEUED, PAUSED)
                    .allow(RUNNING, TERMINATED)
                    .allow(PAUSED, RUNNING, ERROR)
                    .build();

    @Override
    public TransitionTable<MiniClusterState> transitions() {
        return TRANSITIONS;
    }

    /**
     * Returns true while the mini cluster may still hold or wait for resources.
     */
    public boolean isActive() {
        return !TERMINATED.contains(this);
    }
}
