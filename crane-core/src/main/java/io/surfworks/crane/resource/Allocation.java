package io.surfworks.crane.resource;

import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Allocation status of one resource unit at one node.
 *
 * <p>{@code total} is the maximum resource that can be acquired and
 * {@code released} the part currently available. The invariant
 * {@code released <= total} is checked on construction, so every value
 * returned by {@link #acquire} or {@link #release} satisfies it too.
 *
 * <p>Allocations are ordered lexicographically on {@code (total, released)}.
 *
 * @param <R> the resource unit type
 */
public final class Allocation<R extends Resource<R>> implements Resource<Allocation<R>> {

    private final R total;
    private final R released;

    private Allocation(R total, R released, ResourceException.ErrorCode violation) {
        this.total = Objects.requireNonNull(total, "total cannot be null");
        this.released = Objects.requireNonNull(released, "released cannot be null");
        if (!total.isGreaterOrEqual(released)) {
            throw new ResourceException(
                    String.format("Released %s cannot exceed total %s", released, total), violation);
        }
    }

    /**
     * Creates an allocation.
     *
     * @throws ResourceException if {@code released} is not contained in {@code total}
     */
    public static <R extends Resource<R>> Allocation<R> of(R total, R released) {
        return new Allocation<>(total, released, ResourceException.ErrorCode.INVALID_CONSTRUCTION);
    }

    /**
     * Creates an allocation with everything released.
     */
    public static <R extends Resource<R>> Allocation<R> of(R total) {
        return new Allocation<>(total, total, ResourceException.ErrorCode.INVALID_CONSTRUCTION);
    }

    /**
     * Returns the empty allocation of a resource unit type.
     *
     * @param emptyUnit the empty value of the unit type
     */
    public static <R extends Resource<R>> Allocation<R> empty(R emptyUnit) {
        return new Allocation<>(emptyUnit, emptyUnit, ResourceException.ErrorCode.INVALID_CONSTRUCTION);
    }

    /**
     * Projects a physical allocation onto its logical counterpart.
     */
    public static <P extends PhysicalResource<P, L>, L extends Resource<L>> Allocation<L> asLogical(
            Allocation<P> allocation) {
        return allocation.project(resource -> resource.asLogical());
    }

    /**
     * Returns the component-wise intersection of two physical allocations.
     */
    public static <P extends PhysicalResource<P, L>, L extends Resource<L>> Allocation<P> intersection(
            Allocation<P> left, Allocation<P> right) {
        return left.combine(right, (a, b) -> a.intersect(b));
    }

    public R total() {
        return total;
    }

    public R released() {
        return released;
    }

    /**
     * Returns the acquired part, {@code total - released}.
     */
    public R acquired() {
        return total.minus(released);
    }

    /**
     * Returns {@code (total, acquired, released)}.
     */
    public List<R> asTuple() {
        return List.of(total, acquired(), released);
    }

    /**
     * Acquires a block from the released part.
     *
     * @return a new allocation with {@code released - block} released
     * @throws ResourceException if {@code block} exceeds the released part
     */
    public Allocation<R> acquire(R block) {
        return new Allocation<>(total, released.minus(block), ResourceException.ErrorCode.INSUFFICIENT_RESOURCE);
    }

    /**
     * Releases a previously acquired block.
     *
     * @return a new allocation with {@code released + block} released
     * @throws ResourceException if the released part would exceed the total
     */
    public Allocation<R> release(R block) {
        return new Allocation<>(total, released.plus(block), ResourceException.ErrorCode.INSUFFICIENT_RESOURCE);
    }

    /**
     * Maps both components onto another resource type.
     */
    public <T extends Resource<T>> Allocation<T> project(Function<? super R, T> projection) {
        return of(projection.apply(total), projection.apply(released));
    }

    /**
     * Combines two allocations component by component.
     */
    public Allocation<R> combine(Allocation<R> other, BinaryOperator<R> operator) {
        return of(operator.apply(total, other.total), operator.apply(released, other.released));
    }

    @Override
    public Allocation<R> plus(Allocation<R> other) {
        return of(total.plus(other.total), released.plus(other.released));
    }

    @Override
    public Allocation<R> minus(Allocation<R> other) {
        return new Allocation<>(total.minus(other.total), released.minus(other.released),
                ResourceException.ErrorCode.INSUFFICIENT_RESOURCE);
    }

    @Override
    public boolean isEmpty() {
        return total.isEmpty();
    }

    @Override
    public boolean isLessThan(Allocation<R> other) {
        if (!total.equals(other.total)) {
            return total.isLessThan(other.total);
        }
        return released.isLessThan(other.released);
    }

    @Override
    public boolean isGreaterThan(Allocation<R> other) {
        if (!total.equals(other.total)) {
            return total.isGreaterThan(other.total);
        }
        return released.isGreaterThan(other.released);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Allocation<?> that)) return false;
        return total.equals(that.total) && released.equals(that.released);
    }

    @Override
    public int hashCode() {
        return Objects.hash(total, released);
    }

    @Override
    public String toString() {
        return "Allocation(total=" + total + ", released=" + released + ")";
    }
}
