package io.surfworks.crane.container;

import io.surfworks.crane.state.StateHistory;
import io.surfworks.crane.state.StatefulEntity;

import java.util.Objects;

/**
 * A physical container: one process with its configuration, placement and lifecycle.
 */
public final class Container extends StatefulEntity<ContainerState> {

    private final String id;
    private final ContainerConfig config;
    private final ContainerAllocation allocation;

    public Container(String id, ContainerConfig config, ContainerAllocation allocation) {
        this(id, config, allocation, StateHistory.fromInit(ContainerState.class));
    }

    public Container(String id, ContainerConfig config, ContainerAllocation allocation,
                     StateHistory<ContainerState> stateHistory) {
        super(stateHistory);
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.allocation = Objects.requireNonNull(allocation, "allocation cannot be null");
    }

    public String id() {
        return id;
    }

    public ContainerConfig config() {
        return config;
    }

    public ContainerAllocation allocation() {
        return allocation;
    }

    @Override
    public String toString() {
        return "Container(id=" + id + ", node=" + allocation.nodeName() + ", state=" + state() + ")";
    }
}
