package io.github.cyfko.tgrep.core.utils;

import io.github.cyfko.tgrep.core.api.TreeNode;
import io.github.cyfko.tgrep.core.api.TreePosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Node-set computations over an ordered tree: ancestry, descent, sisterhood and precedence.
 * <p>
 * Every method is a pure function of the node's place in its tree. Structure that is not there
 * (no parent, no children, no sister) yields an empty result, never an exception, so relation
 * predicates built on these lists simply evaluate to {@code false} at the edges of a tree.
 * </p>
 *
 * <h2>Precedence model</h2>
 * <p>
 * Precedence is derived from {@link TreePosition} ordering. Two positions are compared on their
 * shared length only, so a node neither precedes nor follows its own ancestors and descendants:
 * </p>
 * <pre>
 * node at (0, 1)   precedes  (1), (1, 0), (1, 0, 0) ...
 *                  follows   (0, 0), (0, 0, 0) ...
 *                  unordered with (), (0), (0, 1, 0) ...
 * </pre>
 *
 * <p>All returned lists compare nodes by identity and are freshly allocated.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TreeAlgebra {

    private TreeAlgebra() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param node a tree node
     * @return every node dominating {@code node}, nearest first
     */
    public static List<TreeNode> ancestors(TreeNode node) {
        List<TreeNode> result = new ArrayList<>();
        Optional<TreeNode> current = node.parent();
        while (current.isPresent()) {
            result.add(current.get());
            current = current.get().parent();
        }
        return result;
    }

    /**
     * Returns the ancestors of {@code node} reached through single-child links only: the climb stops
     * before the first ancestor having more than one child.
     *
     * @param node a tree node
     * @return the unary ancestor chain, nearest first
     */
    public static List<TreeNode> uniqueAncestors(TreeNode node) {
        List<TreeNode> result = new ArrayList<>();
        Optional<TreeNode> current = node.parent();
        while (current.isPresent() && current.get().children().size() == 1) {
            result.add(current.get());
            current = current.get().parent();
        }
        return result;
    }

    /**
     * @param node a tree node
     * @return every node dominated by {@code node}, in pre-order
     */
    public static List<TreeNode> descendants(TreeNode node) {
        List<TreeNode> result = new ArrayList<>();
        for (TreeNode child : node.children()) {
            collectPreOrder(child, result);
        }
        return result;
    }

    /**
     * Returns the chain of first children below {@code node}: the descendants whose position
     * relative to {@code node} contains only zeros.
     *
     * @param node a tree node
     * @return the leftmost descendants, top-down
     */
    public static List<TreeNode> leftmostDescendants(TreeNode node) {
        List<TreeNode> result = new ArrayList<>();
        TreeNode current = node;
        while (!current.children().isEmpty()) {
            current = current.children().get(0);
            result.add(current);
        }
        return result;
    }

    /**
     * Returns the chain of last children below {@code node}, down to the lexicographically greatest
     * position of its subtree.
     *
     * @param node a tree node
     * @return the rightmost descendants, top-down
     */
    public static List<TreeNode> rightmostDescendants(TreeNode node) {
        List<TreeNode> result = new ArrayList<>();
        TreeNode current = node;
        while (!current.children().isEmpty()) {
            List<? extends TreeNode> children = current.children();
            current = children.get(children.size() - 1);
            result.add(current);
        }
        return result;
    }

    /**
     * Returns the nodes below {@code node} reachable through single-child links only.
     *
     * @param node a tree node
     * @return the unary descent chain, top-down
     */
    public static List<TreeNode> uniqueDescendants(TreeNode node) {
        List<TreeNode> result = new ArrayList<>();
        TreeNode current = node;
        while (current.children().size() == 1) {
            current = current.children().get(0);
            result.add(current);
        }
        return result;
    }

    /**
     * @param node a tree node
     * @return every node of {@code node}'s tree lying entirely to its left, in pre-order
     */
    public static List<TreeNode> before(TreeNode node) {
        return ordered(node, true);
    }

    /**
     * @param node a tree node
     * @return every node of {@code node}'s tree lying entirely to its right, in pre-order
     */
    public static List<TreeNode> after(TreeNode node) {
        return ordered(node, false);
    }

    /**
     * Returns the nodes whose last terminal immediately precedes the first terminal of
     * {@code node}: the nearest left sister subtree found while climbing, followed by its rightmost
     * descendants.
     *
     * @param node a tree node
     * @return the immediately preceding nodes, empty if {@code node} is leftmost in its tree
     */
    public static List<TreeNode> immediatelyBefore(TreeNode node) {
        TreePosition position = node.position();
        int depth = position.length() - 1;
        while (depth >= 0 && position.get(depth) == 0) {
            depth--;
        }
        if (depth < 0) {
            return new ArrayList<>();
        }
        TreePosition target = position.prefix(depth).child(position.get(depth) - 1);
        TreeNode before = node.root().get(target);

        List<TreeNode> result = new ArrayList<>();
        result.add(before);
        result.addAll(rightmostDescendants(before));
        return result;
    }

    /**
     * Returns the nodes whose first terminal immediately follows the last terminal of
     * {@code node}: the nearest right sister subtree found while climbing, followed by its
     * leftmost descendants.
     *
     * @param node a tree node
     * @return the immediately following nodes, empty if {@code node} is rightmost in its tree
     */
    public static List<TreeNode> immediatelyAfter(TreeNode node) {
        TreePosition position = node.position();
        int depth = position.length() - 1;
        Optional<TreeNode> current = node.parent();
        while (depth >= 0 && current.isPresent()
                && position.get(depth) == current.get().children().size() - 1) {
            depth--;
            current = current.get().parent();
        }
        if (depth < 0 || current.isEmpty()) {
            return new ArrayList<>();
        }
        TreeNode after = current.get().children().get(position.get(depth) + 1);

        List<TreeNode> result = new ArrayList<>();
        result.add(after);
        result.addAll(leftmostDescendants(after));
        return result;
    }

    /**
     * @param node a tree node
     * @return the other children of {@code node}'s parent, in order; empty for a root
     */
    public static List<TreeNode> sisters(TreeNode node) {
        List<TreeNode> result = new ArrayList<>();
        node.parent().ifPresent(parent -> {
            for (TreeNode sister : parent.children()) {
                if (sister != node) {
                    result.add(sister);
                }
            }
        });
        return result;
    }

    /**
     * @param node a tree node
     * @return the sisters to the left of {@code node}, in order
     */
    public static List<TreeNode> leftSisters(TreeNode node) {
        Optional<TreeNode> parent = node.parent();
        if (parent.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(parent.get().children().subList(0, node.indexInParent()));
    }

    /**
     * @param node a tree node
     * @return the sisters to the right of {@code node}, in order
     */
    public static List<TreeNode> rightSisters(TreeNode node) {
        Optional<TreeNode> parent = node.parent();
        if (parent.isEmpty()) {
            return new ArrayList<>();
        }
        List<? extends TreeNode> children = parent.get().children();
        return new ArrayList<>(children.subList(node.indexInParent() + 1, children.size()));
    }

    /**
     * @param node a tree node
     * @return the sister immediately to the left of {@code node}, if any
     */
    public static Optional<TreeNode> leftSister(TreeNode node) {
        Optional<TreeNode> parent = node.parent();
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        int index = node.indexInParent();
        return index > 0 ? Optional.of(parent.get().children().get(index - 1)) : Optional.empty();
    }

    /**
     * @param node a tree node
     * @return the sister immediately to the right of {@code node}, if any
     */
    public static Optional<TreeNode> rightSister(TreeNode node) {
        Optional<TreeNode> parent = node.parent();
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        List<? extends TreeNode> children = parent.get().children();
        int index = node.indexInParent();
        return index + 1 < children.size() ? Optional.of(children.get(index + 1)) : Optional.empty();
    }

    /**
     * Identity membership test, as required by the relation semantics.
     *
     * @param nodes candidate nodes
     * @param node  the node to look for
     * @return {@code true} if {@code nodes} contains that very instance
     */
    public static boolean containsNode(List<? extends TreeNode> nodes, TreeNode node) {
        for (TreeNode candidate : nodes) {
            if (candidate == node) {
                return true;
            }
        }
        return false;
    }

    private static List<TreeNode> ordered(TreeNode node, boolean before) {
        TreePosition position = node.position();
        List<TreeNode> result = new ArrayList<>();
        collectOrdered(node.root(), TreePosition.root(), position, before, result);
        return result;
    }

    private static void collectOrdered(TreeNode current, TreePosition at, TreePosition reference,
                                       boolean before, List<TreeNode> out) {
        int shared = Math.min(at.length(), reference.length());
        int cmp = at.prefix(shared).compareTo(reference.prefix(shared));
        if (before ? cmp < 0 : cmp > 0) {
            out.add(current);
        }
        List<? extends TreeNode> children = current.children();
        for (int i = 0; i < children.size(); i++) {
            collectOrdered(children.get(i), at.child(i), reference, before, out);
        }
    }

    private static void collectPreOrder(TreeNode node, List<TreeNode> out) {
        out.add(node);
        for (TreeNode child : node.children()) {
            collectPreOrder(child, out);
        }
    }
}
