package io.github.cyfko.tgrep.core.parsing;

import io.github.cyfko.tgrep.core.api.MacroEnvironment;
import io.github.cyfko.tgrep.core.api.NodePredicate;

import java.util.List;

/**
 * Output of a full grammar pass over a query: one predicate per search statement, the macro
 * environment built from the definition statements, and the raw tokens read.
 *
 * @param expressions the search expression predicates, in statement order
 * @param macros      the bound macro definitions
 * @param tokens      the raw tokens
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParsedQuery(List<NodePredicate> expressions, MacroEnvironment macros, List<String> tokens) {

    public ParsedQuery {
        expressions = List.copyOf(expressions);
        tokens = List.copyOf(tokens);
    }

    /**
     * @return the disjunction of all search expressions
     */
    public NodePredicate predicate() {
        NodePredicate result = expressions.get(0);
        for (int i = 1; i < expressions.size(); i++) {
            result = result.or(expressions.get(i));
        }
        return result;
    }
}
