package io.github.cyfko.tgrep.core.tree;

import io.github.cyfko.tgrep.core.api.TreeNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable labeled tree whose nodes know their parent.
 * <p>
 * Trees are built bottom-up: {@link #of(String, ParentedTree...)} adopts its children, and a node
 * can be adopted only once. After that the structure never changes, so every node reports a stable
 * parent, index and position for as long as the tree lives.
 * </p>
 *
 * <pre>{@code
 * ParentedTree tree = ParentedTree.of("S",
 *         ParentedTree.of("NP", ParentedTree.of("DT", ParentedTree.leaf("the")),
 *                               ParentedTree.of("NN", ParentedTree.leaf("dog"))),
 *         ParentedTree.of("VP", ParentedTree.of("VBD", ParentedTree.leaf("ran"))));
 *
 * tree.toString();   // (S (NP (DT the) (NN dog)) (VP (VBD ran)))
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ParentedTree implements TreeNode {

    private final String value;
    private final boolean terminal;
    private final List<ParentedTree> children;
    private ParentedTree parent;
    private int indexInParent = -1;

    private ParentedTree(String value, boolean terminal, List<ParentedTree> children) {
        this.value = value;
        this.terminal = terminal;
        this.children = children;
    }

    /**
     * Creates an internal node and adopts its children.
     *
     * @param label    the node label, possibly empty
     * @param children the children, in order
     * @return the new node
     * @throws IllegalArgumentException if a child already has a parent or appears twice
     */
    public static ParentedTree of(String label, ParentedTree... children) {
        return of(label, Arrays.asList(children));
    }

    /**
     * @param label    the node label, possibly empty
     * @param children the children, in order
     * @return the new node
     * @throws IllegalArgumentException if a child already has a parent or appears twice
     */
    public static ParentedTree of(String label, List<ParentedTree> children) {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(children, "children");

        ParentedTree[] adopted = children.toArray(new ParentedTree[0]);
        Set<ParentedTree> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (ParentedTree child : adopted) {
            Objects.requireNonNull(child, "child");
            if (child.parent != null) {
                throw new IllegalArgumentException("Node '" + child.value + "' already has a parent");
            }
            if (!seen.add(child)) {
                throw new IllegalArgumentException("Node '" + child.value + "' appears twice among the children");
            }
        }
        ParentedTree node = new ParentedTree(label, false, Collections.unmodifiableList(Arrays.asList(adopted)));
        for (int i = 0; i < adopted.length; i++) {
            adopted[i].parent = node;
            adopted[i].indexInParent = i;
        }
        return node;
    }

    /**
     * @param word the terminal word
     * @return a new leaf
     */
    public static ParentedTree leaf(String word) {
        Objects.requireNonNull(word, "word");
        return new ParentedTree(word, true, List.of());
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public List<ParentedTree> children() {
        return children;
    }

    @Override
    public Optional<TreeNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public int indexInParent() {
        return indexInParent;
    }

    /**
     * @return {@code true} for nodes created with {@link #leaf(String)}
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * @return the bracketed form, {@code (label child ...)} for internal nodes and the bare word
     *         for leaves
     */
    @Override
    public String toString() {
        if (terminal) {
            return value;
        }
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb) {
        if (terminal) {
            sb.append(value);
            return;
        }
        sb.append('(').append(value);
        for (ParentedTree child : children) {
            sb.append(' ');
            child.appendTo(sb);
        }
        sb.append(')');
    }
}
