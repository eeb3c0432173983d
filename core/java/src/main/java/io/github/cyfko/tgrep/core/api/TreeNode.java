package io.github.cyfko.tgrep.core.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of an ordered, labeled tree, as required by compiled queries.
 * <p>
 * Only {@link #value()}, {@link #children()} and {@link #parent()} must be implemented; every other
 * capability is derived from them. Implementations backed by their own navigation structures may
 * override the derived methods for speed, as long as the results stay consistent.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li><strong>Identity:</strong> two nodes are the same node only if they are the same instance.
 *       {@link #children()} must return the same instances on every call.</li>
 *   <li><strong>Literal value:</strong> the label of an internal node, the word of a leaf.</li>
 *   <li><strong>Parent:</strong> non-owning back-reference; {@link Optional#empty()} for the root.
 *       A tree that never reports parents stays searchable by label, but every relation that needs
 *       to climb the tree evaluates to {@code false}.</li>
 *   <li><strong>Immutability:</strong> a tree must not change while it is being searched.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see TreePosition
 */
public interface TreeNode {

    /**
     * @return the label of an internal node or the word of a leaf
     */
    String value();

    /**
     * @return the ordered children, empty for a leaf; never {@code null}
     */
    List<? extends TreeNode> children();

    /**
     * @return the node owning this one, or empty for a root
     */
    Optional<TreeNode> parent();

    /**
     * @return {@code true} if this node has no children
     */
    default boolean isLeaf() {
        return children().isEmpty();
    }

    /**
     * Returns the index of this node among its parent's children.
     *
     * @return the child index, or {@code -1} for a root
     * @throws IllegalStateException if the parent does not list this node among its children
     */
    default int indexInParent() {
        Optional<TreeNode> parent = parent();
        if (parent.isEmpty()) {
            return -1;
        }
        List<? extends TreeNode> siblings = parent.get().children();
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == this) {
                return i;
            }
        }
        throw new IllegalStateException("Node '" + value() + "' is not a child of its own parent");
    }

    /**
     * Derived from {@link #parent()}. A node reporting no parent is its own root, so on a tree
     * without parent navigation every node is at {@link TreePosition#root()}.
     *
     * @return the path of child indexes from {@link #root()} to this node
     */
    default TreePosition position() {
        Optional<TreeNode> parent = parent();
        if (parent.isEmpty()) {
            return TreePosition.root();
        }
        return parent.get().position().child(indexInParent());
    }

    /**
     * @return the topmost node of the tree containing this node, possibly this node itself
     */
    default TreeNode root() {
        TreeNode current = this;
        Optional<TreeNode> parent = current.parent();
        while (parent.isPresent()) {
            current = parent.get();
            parent = current.parent();
        }
        return current;
    }

    /**
     * Resolves a position relative to this node.
     *
     * @param position path of child indexes, relative to this node
     * @return the node at that position
     * @throws IllegalArgumentException if the path leaves the tree
     */
    default TreeNode get(TreePosition position) {
        TreeNode current = this;
        for (int depth = 0; depth < position.length(); depth++) {
            List<? extends TreeNode> children = current.children();
            int index = position.get(depth);
            if (index >= children.size()) {
                throw new IllegalArgumentException("No node at position " + position + " below '" + value() + "'");
            }
            current = children.get(index);
        }
        return current;
    }

    /**
     * Enumerates the positions of this node and all of its descendants in pre-order, relative to
     * this node. When this node is listed, its entry {@link TreePosition#root()} comes first.
     *
     * @param includeLeaves whether childless nodes are listed
     * @return positions in pre-order
     */
    default List<TreePosition> positions(boolean includeLeaves) {
        List<TreePosition> out = new ArrayList<>();
        collectPositions(this, TreePosition.root(), includeLeaves, out);
        return out;
    }

    private static void collectPositions(TreeNode node, TreePosition at, boolean includeLeaves, List<TreePosition> out) {
        List<? extends TreeNode> children = node.children();
        if (includeLeaves || !children.isEmpty()) {
            out.add(at);
        }
        for (int i = 0; i < children.size(); i++) {
            collectPositions(children.get(i), at.child(i), includeLeaves, out);
        }
    }
}
