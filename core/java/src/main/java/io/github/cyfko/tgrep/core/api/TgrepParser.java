package io.github.cyfko.tgrep.core.api;

import io.github.cyfko.tgrep.core.exception.TgrepSyntaxException;

import java.util.List;

/**
 * Compiler for TGrep2-style tree pattern queries.
 * <p>
 * A query is a {@code ;}-separated list of statements. Each statement is either a search
 * expression or a macro definition; the compiled query matches a node when any of its search
 * expressions does.
 * </p>
 *
 * <h2>Grammar</h2>
 * <pre>
 * query          := statement (';' statement)*
 * statement      := macroDef | expr
 * macroDef       := '@' WS name expr | '@'name WS expr
 * expr           := node relations?
 * node           := '@'name | '(' expr ')' | 'N(' i, j, ... ')' | "'"? nodeExpr ('|' nodeExpr)*
 * nodeExpr       := '"'string'"' | '/'regex'/' | 'i@"'string'"' | 'i@/'regex'/' | '*' | literal
 * relations      := relConjunction ('|' relations)*
 * relConjunction := relation ('&'? relConjunction)*
 * relation       := '!'? '[' relations ']' | '!'? operator node
 * </pre>
 *
 * <h2>Examples</h2>
 * <pre>{@code
 * parser.compile("NP < DT");                       // NP whose child is DT
 * parser.compile("NP !<< /^VB/");                  // NP dominating no verb
 * parser.compile("S < (NP $. VP)");                // S with an NP immediately followed by a VP sister
 * parser.compile("@ NOUN /^NN/ ; NP <- @NOUN");    // macro definition and use
 * parser.compile("A [< B | < C] > D");             // bracket grouping
 * }</pre>
 *
 * <h2>Errors</h2>
 * <p>
 * Malformed text, text not entirely consumed by the grammar, unknown operators and invalid regular
 * expressions are reported at compile time with {@link TgrepSyntaxException}. Undefined macros are
 * reported only when evaluation reaches them.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see CompiledQuery
 */
public interface TgrepParser {

    /**
     * Compiles a query.
     *
     * @param query the query text
     * @return the compiled query with its macro environment bound
     * @throws TgrepSyntaxException if the text is blank, malformed, exceeds the parser's policy,
     *                              or is not consumed in full
     * @throws NullPointerException if {@code query} is null
     */
    CompiledQuery compile(String query) throws TgrepSyntaxException;

    /**
     * Splits a query into its raw tokens without compiling it. Scanning stops at the end of the
     * longest well-formed prefix. Meant for diagnostics.
     *
     * @param query the query text
     * @return the raw tokens in order
     * @throws TgrepSyntaxException if not even a first statement can be read
     */
    List<String> tokenize(String query) throws TgrepSyntaxException;
}
