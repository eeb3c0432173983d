package io.github.cyfko.tgrep.core.api;

import java.util.Objects;

/**
 * A fully compiled query: its top-level predicate closed over the macro environment collected from
 * the query's own definitions.
 * <p>
 * Instances are immutable and reusable; the same compiled query can be matched against any number
 * of trees, concurrently if the trees are distinct.
 * </p>
 *
 * @param query     the source text the query was compiled from
 * @param predicate the disjunction of the query's search expressions
 * @param macros    the macros defined by the query
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CompiledQuery(String query, NodePredicate predicate, MacroEnvironment macros) {

    public CompiledQuery {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(macros, "macros");
    }

    /**
     * Tests a node against this query.
     *
     * @param node the candidate node
     * @return {@code true} if the node matches
     * @throws io.github.cyfko.tgrep.core.exception.UndefinedMacroException if evaluation reaches an
     *         undefined macro
     */
    public boolean matches(TreeNode node) {
        return predicate.test(node, macros);
    }

    @Override
    public String toString() {
        return "CompiledQuery[" + query + "]";
    }
}
