package io.github.cyfko.tgrep.core.api;

import java.util.Objects;

/**
 * Compiled boolean test over one tree node, parameterized by the macro environment of the query
 * it belongs to.
 * <p>
 * Predicates are the unit of composition of the query compiler: node literals, relations,
 * groups and whole statements all compile to a {@code NodePredicate}, and the grammar combines
 * them with {@link #and(NodePredicate)}, {@link #or(NodePredicate)} and {@link #not()}.
 * </p>
 *
 * <h2>Purity</h2>
 * <p>
 * A predicate holds no mutable state and never modifies the tree it inspects. For a fixed tree and
 * environment it always returns the same answer, so compiled predicates can be shared freely,
 * including across threads searching distinct trees.
 * </p>
 *
 * <h2>Macros</h2>
 * <p>
 * The {@link MacroEnvironment} is passed on every call instead of being captured at compile time,
 * which is what lets a macro be used textually before its definition.
 * </p>
 *
 * <pre>{@code
 * NodePredicate np = (n, m) -> "NP".equals(n.value());
 * NodePredicate leaf = (n, m) -> n.isLeaf();
 * NodePredicate phrase = np.and(leaf.not());
 * boolean hit = phrase.test(node, MacroEnvironment.empty());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface NodePredicate {

    /**
     * Evaluates this predicate on a node.
     *
     * @param node   the candidate node
     * @param macros the macro environment of the enclosing query
     * @return {@code true} if the node satisfies this predicate
     * @throws io.github.cyfko.tgrep.core.exception.UndefinedMacroException if evaluation reaches a
     *         macro that {@code macros} does not define
     */
    boolean test(TreeNode node, MacroEnvironment macros);

    /**
     * @param other the right operand, evaluated only if this predicate holds
     * @return a predicate true when both predicates hold
     */
    default NodePredicate and(NodePredicate other) {
        Objects.requireNonNull(other);
        return (node, macros) -> test(node, macros) && other.test(node, macros);
    }

    /**
     * @param other the right operand, evaluated only if this predicate fails
     * @return a predicate true when either predicate holds
     */
    default NodePredicate or(NodePredicate other) {
        Objects.requireNonNull(other);
        return (node, macros) -> test(node, macros) || other.test(node, macros);
    }

    /**
     * @return the negation of this predicate
     */
    default NodePredicate not() {
        return (node, macros) -> !test(node, macros);
    }

    /**
     * @return a predicate matching every node
     */
    static NodePredicate always() {
        return (node, macros) -> true;
    }
}
