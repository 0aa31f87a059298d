package io.surfworks.crane.minicluster;

import io.surfworks.crane.resource.Logical;
import io.surfworks.crane.resource.Physical;
import io.surfworks.crane.resource.ResourceException;
import io.surfworks.crane.resource.ResourceGroup;
import io.surfworks.crane.state.StateTransitionException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MiniCluster, MiniClusterState and ResourceSpec.
 */
class MiniClusterTest {

    // ===== MiniClusterState tests =====

    @Test
    void runningMayReturnToQueueOrPauseOrTerminate() {
        assertEquals(EnumSet.of(MiniClusterState.QUEUED, MiniClusterState.PAUSED, MiniClusterState.ERROR,
                        MiniClusterState.INVALID, MiniClusterState.DONE),
                MiniClusterState.RUNNING.transitions().successors(MiniClusterState.RUNNING));
    }

    @Test
    void queuedCannotFinishWithoutRunning() {
        assertThrows(StateTransitionException.class, () -> MiniClusterState.QUEUED.validate(MiniClusterState.DONE));
        assertTrue(MiniClusterState.QUEUED.canTransitionTo(MiniClusterState.ERROR));
    }

    @Test
    void pausedMayResumeOrFail() {
        assertTrue(MiniClusterState.PAUSED.canTransitionTo(MiniClusterState.RUNNING));
        assertTrue(MiniClusterState.PAUSED.canTransitionTo(MiniClusterState.ERROR));
        assertFalse(MiniClusterState.PAUSED.canTransitionTo(MiniClusterState.QUEUED));
    }

    @Test
    void terminatedStatesAreInactive() {
        for (MiniClusterState state : MiniClusterState.values()) {
            assertEquals(!MiniClusterState.TERMINATED.contains(state), state.isActive());
            assertEquals(MiniClusterState.TERMINATED.contains(state), state.isTerminal());
        }
    }

    // ===== ResourceSpec tests =====

    @Test
    void missingMinAndMaxDefaultToAppManager() {
        ResourceSpec spec = ResourceSpec.of(Logical.gpus(2));

        assertEquals(Logical.gpus(2), spec.minResource());
        assertEquals(Logical.gpus(2), spec.maxResource());
    }

    @Test
    void missingMaxDefaultsToMin() {
        ResourceSpec spec = new ResourceSpec(Logical.gpus(1), Logical.gpus(3), null);

        assertEquals(Logical.gpus(3), spec.maxResource());
    }

    @Test
    void invalidSpecsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ResourceSpec.gpus(4, 2));
        assertThrows(IllegalArgumentException.class,
                () -> new ResourceSpec(Logical.gpus(2), Logical.gpus(1), Logical.gpus(4)));
        assertThrows(IllegalArgumentException.class, () -> ResourceSpec.of(Logical.empty()));
        assertThrows(NullPointerException.class, () -> new ResourceSpec(null, Logical.gpus(1), Logical.gpus(1)));
    }

    @Test
    void gpusUsesOneGpuAppManager() {
        ResourceSpec spec = ResourceSpec.gpus(2, 8);

        assertEquals(Logical.gpus(1), spec.amResource());
        assertEquals(Logical.gpus(2), spec.minResource());
        assertEquals(Logical.gpus(8), spec.maxResource());
    }

    // ===== MiniCluster tests =====

    @Test
    void miniClusterStartsQueuedWithNothingClaimed() {
        MiniCluster miniCluster = new MiniCluster("job-1", ResourceSpec.gpus(1, 1));

        assertEquals(MiniClusterState.QUEUED, miniCluster.state());
        assertTrue(miniCluster.claimed().isEmpty());
    }

    @Test
    void claimAccumulatesAndUnclaimReturnsEverything() {
        MiniCluster miniCluster = new MiniCluster("job-1", ResourceSpec.gpus(1, 4));

        miniCluster.claim(ResourceGroup.of("node-a", Physical.of(0)));
        miniCluster.claim(ResourceGroup.of("node-a", Physical.of(1)));
        miniCluster.claim(ResourceGroup.of("node-b", Physical.of(0)));

        ResourceGroup<Physical> released = miniCluster.unclaim();

        assertEquals(Physical.of(0, 1), released.get("node-a").orElseThrow());
        assertEquals(Physical.of(0), released.get("node-b").orElseThrow());
        assertTrue(miniCluster.claimed().isEmpty());
    }

    @Test
    void claimingTheSameGpuTwiceConflicts() {
        MiniCluster miniCluster = new MiniCluster("job-1", ResourceSpec.gpus(1, 4));
        miniCluster.claim(ResourceGroup.of("node-a", Physical.of(0)));

        ResourceException e = assertThrows(ResourceException.class,
                () -> miniCluster.claim(ResourceGroup.of("node-a", Physical.of(0))));
        assertEquals(ResourceException.ErrorCode.RESOURCE_CONFLICT, e.errorCode());
    }

    @Test
    void lifecycleFollowsTransitionTable() {
        MiniCluster miniCluster = new MiniCluster("job-1", ResourceSpec.gpus(1, 1));

        miniCluster.transition(MiniClusterState.RUNNING);
        miniCluster.transition(MiniClusterState.PAUSED);
        miniCluster.transition(MiniClusterState.RUNNING);
        miniCluster.transition(MiniClusterState.DONE);

        assertEquals(5, miniCluster.stateHistory().size());
        assertThrows(StateTransitionException.class, () -> miniCluster.transition(MiniClusterState.RUNNING));
    }
}
