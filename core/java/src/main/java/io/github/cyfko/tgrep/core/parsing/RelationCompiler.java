package io.github.cyfko.tgrep.core.parsing;

import io.github.cyfko.tgrep.core.api.MacroEnvironment;
import io.github.cyfko.tgrep.core.api.NodePredicate;
import io.github.cyfko.tgrep.core.api.Relation;
import io.github.cyfko.tgrep.core.api.TreeNode;
import io.github.cyfko.tgrep.core.utils.TreeAlgebra;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates a relation operator applied to a target predicate into a predicate on the source node.
 * <p>
 * For {@code A op B}, the returned predicate is evaluated on {@code A} and holds when some node
 * standing in the relation {@code op} to {@code A} satisfies the target {@code B}. Structure the
 * relation needs but the tree does not have (no parent, no children, no sister) makes it false.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * NodePredicate dt = NodeLiteralCompiler.compile("DT");
 * NodePredicate hasDeterminer = RelationCompiler.compile("<", dt);
 * NodePredicate noSecondChild = RelationCompiler.negate(RelationCompiler.compile("<2", NodePredicate.always()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see Relation
 */
public final class RelationCompiler {

    private static final Pattern INDEXED_OPERATOR = Pattern.compile("([<>])(-?)(\\d+)");

    private RelationCompiler() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Compiles an operator token, fixed ({@code <<}, {@code $.}) or indexed ({@code <3},
     * {@code >-2}).
     *
     * @param operator the operator symbol, without negation
     * @param target   the predicate the related node must satisfy
     * @return the predicate on the source node
     * @throws IllegalArgumentException if {@code operator} denotes no relation
     */
    public static NodePredicate compile(String operator, NodePredicate target) {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(target, "target");

        Optional<Relation> fixed = Relation.fromSymbol(operator);
        if (fixed.isPresent()) {
            return compile(fixed.get(), target);
        }

        Matcher matcher = INDEXED_OPERATOR.matcher(operator);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unknown relation operator '" + operator + "'");
        }
        int index;
        try {
            index = Integer.parseInt(matcher.group(3));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Child index out of range in operator '" + operator + "'", e);
        }
        boolean fromEnd = !matcher.group(2).isEmpty();
        Relation relation = matcher.group(1).equals("<")
                ? (fromEnd ? Relation.NTH_LAST_CHILD : Relation.NTH_CHILD)
                : (fromEnd ? Relation.NTH_LAST_CHILD_OF : Relation.NTH_CHILD_OF);
        return indexed(relation, index, target);
    }

    /**
     * Compiles a relation with a fixed operator.
     *
     * @param relation a non-indexed relation
     * @param target   the predicate the related node must satisfy
     * @return the predicate on the source node
     * @throws IllegalArgumentException if {@code relation} is indexed
     */
    public static NodePredicate compile(Relation relation, NodePredicate target) {
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(target, "target");

        return switch (relation) {
            case PARENT_OF -> (n, m) -> anyMatch(n.children(), target, m);
            case CHILD_OF -> (n, m) -> n.parent().map(p -> target.test(p, m)).orElse(false);
            case FIRST_CHILD -> (n, m) -> !n.children().isEmpty() && target.test(n.children().get(0), m);
            case FIRST_CHILD_OF -> (n, m) -> n.parent()
                    .map(p -> p.children().get(0) == n && target.test(p, m))
                    .orElse(false);
            case LAST_CHILD -> (n, m) -> !n.children().isEmpty() && target.test(last(n.children()), m);
            case LAST_CHILD_OF -> (n, m) -> n.parent()
                    .map(p -> last(p.children()) == n && target.test(p, m))
                    .orElse(false);
            case ONLY_CHILD -> (n, m) -> n.children().size() == 1 && target.test(n.children().get(0), m);
            case ONLY_CHILD_OF -> (n, m) -> n.parent()
                    .map(p -> p.children().size() == 1 && target.test(p, m))
                    .orElse(false);
            case DOMINATES -> (n, m) -> anyMatch(TreeAlgebra.descendants(n), target, m);
            case DOMINATED_BY -> (n, m) -> anyMatch(TreeAlgebra.ancestors(n), target, m);
            case LEFTMOST_DESCENDANT -> (n, m) -> anyMatch(TreeAlgebra.leftmostDescendants(n), target, m);
            case LEFTMOST_DESCENDANT_OF -> (n, m) -> TreeAlgebra.ancestors(n).stream().anyMatch(a ->
                    target.test(a, m) && TreeAlgebra.containsNode(TreeAlgebra.leftmostDescendants(a), n));
            case RIGHTMOST_DESCENDANT -> (n, m) -> anyMatch(TreeAlgebra.rightmostDescendants(n), target, m);
            case RIGHTMOST_DESCENDANT_OF -> (n, m) -> TreeAlgebra.ancestors(n).stream().anyMatch(a ->
                    target.test(a, m) && TreeAlgebra.containsNode(TreeAlgebra.rightmostDescendants(a), n));
            case UNARY_DESCENDANT -> (n, m) -> anyMatch(TreeAlgebra.uniqueDescendants(n), target, m);
            case UNARY_DESCENDANT_OF -> (n, m) -> anyMatch(TreeAlgebra.uniqueAncestors(n), target, m);
            case IMMEDIATELY_PRECEDES -> (n, m) -> anyMatch(TreeAlgebra.immediatelyAfter(n), target, m);
            case IMMEDIATELY_FOLLOWS -> (n, m) -> anyMatch(TreeAlgebra.immediatelyBefore(n), target, m);
            case PRECEDES -> (n, m) -> anyMatch(TreeAlgebra.after(n), target, m);
            case FOLLOWS -> (n, m) -> anyMatch(TreeAlgebra.before(n), target, m);
            case SISTER -> (n, m) -> anyMatch(TreeAlgebra.sisters(n), target, m);
            case IMMEDIATE_LEFT_SISTER_OF -> (n, m) -> TreeAlgebra.rightSister(n).map(s -> target.test(s, m)).orElse(false);
            case IMMEDIATE_RIGHT_SISTER_OF -> (n, m) -> TreeAlgebra.leftSister(n).map(s -> target.test(s, m)).orElse(false);
            case LEFT_SISTER_OF -> (n, m) -> anyMatch(TreeAlgebra.rightSisters(n), target, m);
            case RIGHT_SISTER_OF -> (n, m) -> anyMatch(TreeAlgebra.leftSisters(n), target, m);
            default -> throw new IllegalArgumentException("Relation " + relation + " requires a child index");
        };
    }

    /**
     * Compiles an indexed relation. Indexes count from 1; index 0 never matches.
     *
     * @param relation one of the four indexed relations
     * @param index    the 1-based child index, counted from the end for the {@code NTH_LAST} forms
     * @param target   the predicate the related node must satisfy
     * @return the predicate on the source node
     * @throws IllegalArgumentException if {@code relation} is not indexed or {@code index} is negative
     */
    public static NodePredicate indexed(Relation relation, int index, NodePredicate target) {
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(target, "target");
        if (index < 0) {
            throw new IllegalArgumentException("Child index must be non-negative, got: " + index);
        }

        return switch (relation) {
            case NTH_CHILD -> (n, m) -> {
                List<? extends TreeNode> children = n.children();
                int i = index - 1;
                return i >= 0 && i < children.size() && target.test(children.get(i), m);
            };
            case NTH_CHILD_OF -> (n, m) -> n.parent().map(p -> {
                List<? extends TreeNode> sisters = p.children();
                int i = index - 1;
                return i >= 0 && i < sisters.size() && sisters.get(i) == n && target.test(p, m);
            }).orElse(false);
            case NTH_LAST_CHILD -> (n, m) -> {
                List<? extends TreeNode> children = n.children();
                int i = children.size() - index;
                return i >= 0 && i < children.size() && target.test(children.get(i), m);
            };
            case NTH_LAST_CHILD_OF -> (n, m) -> n.parent().map(p -> {
                List<? extends TreeNode> sisters = p.children();
                int i = sisters.size() - index;
                return i >= 0 && i < sisters.size() && sisters.get(i) == n && target.test(p, m);
            }).orElse(false);
            default -> throw new IllegalArgumentException("Relation " + relation + " takes no child index");
        };
    }

    /**
     * @param relation a relation predicate
     * @return its negation
     */
    public static NodePredicate negate(NodePredicate relation) {
        return relation.not();
    }

    private static boolean anyMatch(List<? extends TreeNode> nodes, NodePredicate target,
                                    MacroEnvironment macros) {
        for (TreeNode node : nodes) {
            if (target.test(node, macros)) {
                return true;
            }
        }
        return false;
    }

    private static TreeNode last(List<? extends TreeNode> nodes) {
        return nodes.get(nodes.size() - 1);
    }
}
