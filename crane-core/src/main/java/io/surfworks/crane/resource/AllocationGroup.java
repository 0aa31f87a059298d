package io.surfworks.crane.resource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A mapping from node name to an {@link Allocation}, tracking acquisition across a cluster.
 *
 * <p>Group-wise algebra is delegated to a {@link ResourceGroup} of allocations.
 * {@link #acquire} and {@link #release} check the requested nodes before touching
 * any entry, and any per-node failure aborts the whole operation.
 *
 * @param <R> the resource unit type
 */
public final class AllocationGroup<R extends Resource<R>> implements Resource<AllocationGroup<R>> {

    private static final AllocationGroup<?> EMPTY = new AllocationGroup<Logical>(ResourceGroup.empty());

    private final ResourceGroup<Allocation<R>> allocations;

    private AllocationGroup(ResourceGroup<Allocation<R>> allocations) {
        this.allocations = Objects.requireNonNull(allocations, "allocations cannot be null");
    }

    /**
     * Creates an allocation group.
     *
     * @throws IllegalArgumentException if an allocation is empty
     */
    public static <R extends Resource<R>> AllocationGroup<R> of(Map<String, Allocation<R>> allocations) {
        return new AllocationGroup<>(ResourceGroup.of(allocations));
    }

    /**
     * Creates an allocation group with every node's resources released.
     */
    public static <R extends Resource<R>> AllocationGroup<R> released(ResourceGroup<R> totals) {
        return new AllocationGroup<>(totals.project(total -> Allocation.of(total)));
    }

    @SuppressWarnings("unchecked")
    public static <R extends Resource<R>> AllocationGroup<R> empty() {
        return (AllocationGroup<R>) EMPTY;
    }

    /**
     * Projects every allocation of a physical group onto its logical counterpart.
     */
    public static <P extends PhysicalResource<P, L>, L extends Resource<L>> AllocationGroup<L> asLogical(
            AllocationGroup<P> group) {
        return new AllocationGroup<>(group.allocations.project(allocation -> Allocation.asLogical(allocation)));
    }

    /**
     * Returns the allocations two physical groups have in common, dropping empty results.
     */
    public static <P extends PhysicalResource<P, L>, L extends Resource<L>> AllocationGroup<P> intersection(
            AllocationGroup<P> left, AllocationGroup<P> right) {
        return new AllocationGroup<>(
                left.allocations.intersect(right.allocations, (a, b) -> Allocation.intersection(a, b)));
    }

    public Optional<Allocation<R>> get(String node) {
        return allocations.get(node);
    }

    public boolean contains(String node) {
        return allocations.contains(node);
    }

    public Set<String> nodes() {
        return allocations.nodes();
    }

    public Map<String, Allocation<R>> asMap() {
        return allocations.asMap();
    }

    public int size() {
        return allocations.size();
    }

    /**
     * Returns the total resource of every node.
     */
    public ResourceGroup<R> total() {
        return allocations.project(allocation -> allocation.total());
    }

    /**
     * Returns the acquired resource of every node, omitting nodes with nothing acquired.
     */
    public ResourceGroup<R> acquired() {
        return allocations.project(allocation -> allocation.acquired());
    }

    /**
     * Returns the released resource of every node, omitting nodes with nothing released.
     */
    public ResourceGroup<R> released() {
        return allocations.project(allocation -> allocation.released());
    }

    /**
     * Acquires a resource group.
     *
     * @return a new allocation group
     * @throws ResourceException if a node is unknown or cannot provide its block
     */
    public AllocationGroup<R> acquire(ResourceGroup<R> group) {
        return apply(group, Allocation::acquire);
    }

    /**
     * Releases a resource group.
     *
     * @return a new allocation group
     * @throws ResourceException if a node is unknown or the block was not acquired
     */
    public AllocationGroup<R> release(ResourceGroup<R> group) {
        return apply(group, Allocation::release);
    }

    private AllocationGroup<R> apply(ResourceGroup<R> group, BiFunction<Allocation<R>, R, Allocation<R>> operation) {
        if (!allocations.nodes().containsAll(group.nodes())) {
            throw ResourceException.invalidKeySet(allocations.nodes(), group.nodes());
        }
        Map<String, Allocation<R>> updated = new LinkedHashMap<>(allocations.asMap());
        group.asMap().forEach((node, block) -> updated.put(node, operation.apply(updated.get(node), block)));
        return of(updated);
    }

    /**
     * Maps every allocation onto another resource type.
     */
    public <T extends Resource<T>> AllocationGroup<T> project(Function<? super R, T> projection) {
        return new AllocationGroup<>(allocations.project(allocation -> allocation.project(projection)));
    }

    @Override
    public AllocationGroup<R> plus(AllocationGroup<R> other) {
        return new AllocationGroup<>(allocations.plus(other.allocations));
    }

    @Override
    public AllocationGroup<R> minus(AllocationGroup<R> other) {
        return new AllocationGroup<>(allocations.minus(other.allocations));
    }

    @Override
    public boolean isEmpty() {
        return allocations.isEmpty();
    }

    @Override
    public boolean isLessThan(AllocationGroup<R> other) {
        return allocations.isLessThan(other.allocations);
    }

    @Override
    public boolean isGreaterThan(AllocationGroup<R> other) {
        return allocations.isGreaterThan(other.allocations);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AllocationGroup<?> that)) return false;
        return allocations.equals(that.allocations);
    }

    @Override
    public int hashCode() {
        return allocations.hashCode();
    }

    @Override
    public String toString() {
        return "AllocationGroup" + allocations.asMap();
    }
}
