package io.github.cyfko.tgrep.core.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable path of child indexes leading from a tree's root to one of its nodes.
 * <p>
 * The root sits at the empty position {@code ()}; its second child's first child sits at
 * {@code (1, 0)}. Positions are unique within one tree and are ordered lexicographically,
 * a strict prefix comparing less than any of its extensions:
 * </p>
 * <pre>{@code
 * () < (0) < (0, 0) < (0, 1) < (1)
 * }</pre>
 *
 * <p>
 * That ordering is the pre-order of the tree, which is why search results sorted by position
 * come out in document order.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TreePosition implements Comparable<TreePosition> {

    private static final TreePosition ROOT = new TreePosition(new int[0]);

    private final int[] indexes;

    private TreePosition(int[] indexes) {
        this.indexes = indexes;
    }

    /**
     * Returns the position of a tree's root, the empty path.
     *
     * @return the root position
     */
    public static TreePosition root() {
        return ROOT;
    }

    /**
     * Creates a position from child indexes, outermost first.
     *
     * @param indexes the child indexes
     * @return the position
     * @throws IllegalArgumentException if an index is negative
     */
    public static TreePosition of(int... indexes) {
        if (indexes.length == 0) {
            return ROOT;
        }
        for (int index : indexes) {
            if (index < 0) {
                throw new IllegalArgumentException("Tree position indexes must be non-negative, got: " + index);
            }
        }
        return new TreePosition(indexes.clone());
    }

    /**
     * Creates a position from a list of child indexes.
     *
     * @param indexes the child indexes
     * @return the position
     */
    public static TreePosition of(List<Integer> indexes) {
        return of(indexes.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * @return the number of steps from the root, {@code 0} for the root itself
     */
    public int length() {
        return indexes.length;
    }

    /**
     * @return {@code true} if this is the empty root position
     */
    public boolean isRoot() {
        return indexes.length == 0;
    }

    /**
     * Returns the child index at the given depth.
     *
     * @param depth zero-based step in the path
     * @return the child index taken at that step
     */
    public int get(int depth) {
        return indexes[depth];
    }

    /**
     * @return the index of this node within its parent
     * @throws IllegalStateException for the root position
     */
    public int last() {
        if (isRoot()) {
            throw new IllegalStateException("The root position has no last index");
        }
        return indexes[indexes.length - 1];
    }

    /**
     * Returns this position extended with one more child index.
     *
     * @param index the child index
     * @return the child position
     */
    public TreePosition child(int index) {
        int[] extended = Arrays.copyOf(indexes, indexes.length + 1);
        extended[indexes.length] = index;
        return of(extended);
    }

    /**
     * Returns the first {@code length} steps of this position. Lengths beyond this position's
     * own length return the position unchanged.
     *
     * @param length number of steps to keep
     * @return the truncated position
     */
    public TreePosition prefix(int length) {
        if (length >= indexes.length) {
            return this;
        }
        return length <= 0 ? ROOT : new TreePosition(Arrays.copyOf(indexes, length));
    }

    /**
     * Returns this position followed by every step of {@code suffix}.
     *
     * @param suffix a position relative to this one
     * @return the concatenated position
     */
    public TreePosition concat(TreePosition suffix) {
        if (suffix.isRoot()) {
            return this;
        }
        int[] joined = Arrays.copyOf(indexes, indexes.length + suffix.indexes.length);
        System.arraycopy(suffix.indexes, 0, joined, indexes.length, suffix.indexes.length);
        return new TreePosition(joined);
    }

    /**
     * @param other another position
     * @return {@code true} if {@code other} starts with every step of this position
     */
    public boolean isPrefixOf(TreePosition other) {
        if (other.indexes.length < indexes.length) {
            return false;
        }
        for (int i = 0; i < indexes.length; i++) {
            if (indexes[i] != other.indexes[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the child indexes as an unmodifiable list
     */
    public List<Integer> toList() {
        List<Integer> list = new ArrayList<>(indexes.length);
        for (int index : indexes) {
            list.add(index);
        }
        return Collections.unmodifiableList(list);
    }

    @Override
    public int compareTo(TreePosition other) {
        int shared = Math.min(indexes.length, other.indexes.length);
        for (int i = 0; i < shared; i++) {
            int cmp = Integer.compare(indexes[i], other.indexes[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(indexes.length, other.indexes.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreePosition)) return false;
        return Arrays.equals(indexes, ((TreePosition) o).indexes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(indexes);
    }

    /**
     * Formats the position as a tuple, e.g. {@code (0, 1)}, {@code (2,)} or {@code ()}.
     */
    @Override
    public String toString() {
        if (indexes.length == 1) {
            return "(" + indexes[0] + ",)";
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < indexes.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(indexes[i]);
        }
        return sb.append(')').toString();
    }
}
