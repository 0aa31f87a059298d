package io.surfworks.crane.minicluster;

import io.surfworks.crane.resource.Physical;
import io.surfworks.crane.resource.ResourceGroup;
import io.surfworks.crane.state.StateHistory;
import io.surfworks.crane.state.StatefulEntity;

import java.util.Objects;

/**
 * A mini cluster: one job together with the GPUs it currently claims.
 *
 * <p>The claimed group is empty unless the mini cluster is running.
 */
public final class MiniCluster extends StatefulEntity<MiniClusterState> {

    private final String id;
    private final ResourceSpec resourceSpec;
    private volatile ResourceGroup<Physical> claimed = ResourceGroup.empty();

    public MiniCluster(String id, ResourceSpec resourceSpec) {
        this(id, resourceSpec, StateHistory.fromInit(MiniClusterState.class));
    }

    public MiniCluster(String id, ResourceSpec resourceSpec, StateHistory<MiniClusterState> stateHistory) {
        super(stateHistory);
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.resourceSpec = Objects.requireNonNull(resourceSpec, "resourceSpec cannot be null");
    }

    public String id() {
        return id;
    }

    public ResourceSpec resourceSpec() {
        return resourceSpec;
    }

    /**
     * Returns the GPUs currently claimed, per node.
     */
    public ResourceGroup<Physical> claimed() {
        return claimed;
    }

    /**
     * Records a newly claimed group of GPUs.
     */
    public synchronized void claim(ResourceGroup<Physical> group) {
        claimed = claimed.plus(group);
    }

    /**
     * Forgets every claimed GPU.
     *
     * @return the group that was claimed
     */
    public synchronized ResourceGroup<Physical> unclaim() {
        ResourceGroup<Physical> previous = claimed;
        claimed = ResourceGroup.empty();
        return previous;
    }

    @Override
    public String toString() {
        return "MiniCluster(id=" + id + ", state=" + state() + ", claimed=" + claimed + ")";
    }
}
