package io.surfworks.crane.resource;

import java.util.Objects;

/**
 * Algebraic contract shared by every resource-like value.
 *
 * <p>Implementations are immutable. {@link #plus} and {@link #minus} return new
 * values and throw {@link ResourceException} when the result would be invalid.
 *
 * <p>The ordering is partial: {@code a.isLessThan(b)} means {@code b} can fully
 * absorb {@code a}, so {@code b.minus(a)} does not fail. Two values may be
 * neither less, greater nor equal.
 *
 * @param <R> the implementing type
 */
public interface Resource<R extends Resource<R>> {

    /**
     * Combines two resources.
     *
     * @throws ResourceException if the combination is structurally invalid
     */
    R plus(R other);

    /**
     * Removes {@code other} from this resource.
     *
     * @throws ResourceException if {@code other} is not contained in this resource
     */
    R minus(R other);

    /**
     * Returns true if this is the zero value of its type.
     */
    boolean isEmpty();

    /**
     * Returns true if {@code other} can contain this resource and they are not equal.
     */
    boolean isLessThan(R other);

    /**
     * Returns true if this resource can contain {@code other} and they are not equal.
     */
    boolean isGreaterThan(R other);

    default boolean nonEmpty() {
        return !isEmpty();
    }

    default boolean isLessOrEqual(R other) {
        return isLessThan(other) || equals(other);
    }

    default boolean isGreaterOrEqual(R other) {
        return isGreaterThan(other) || equals(other);
    }

    /**
     * Returns true if this resource is contained in {@code other}.
     */
    default boolean isSubsetOf(R other) {
        return isLessOrEqual(other);
    }

    /**
     * Folds resources into one aggregated resource.
     *
     * @param identity  the empty value of the resource type
     * @param resources resources to add up
     * @return the sum, or {@code identity} when there is nothing to add
     * @throws ResourceException if any addition fails
     */
    static <R extends Resource<R>> R sum(R identity, Iterable<? extends R> resources) {
        Objects.requireNonNull(identity, "identity cannot be null");
        R total = identity;
        for (R resource : resources) {
            total = total.plus(resource);
        }
        return total;
    }
}
