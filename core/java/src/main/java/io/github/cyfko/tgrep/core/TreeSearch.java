package io.github.cyfko.tgrep.core;

import io.github.cyfko.tgrep.core.api.CompiledQuery;
import io.github.cyfko.tgrep.core.api.TgrepParser;
import io.github.cyfko.tgrep.core.api.TreeNode;
import io.github.cyfko.tgrep.core.api.TreePosition;
import io.github.cyfko.tgrep.core.exception.TgrepSyntaxException;
import io.github.cyfko.tgrep.core.impl.BasicTgrepParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade for searching trees with TGrep queries.
 * <p>
 * Query text is compiled by a shared {@link BasicTgrepParser} with default policies, so repeated
 * searches with the same text reuse the cached {@link CompiledQuery}. Each search walks the tree in
 * pre-order and tests every position once.
 * </p>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * TreeNode tree = TreeReader.read("(S (NP (DT the) (NN dog)) (VP (VBD ran)))");
 *
 * List<TreePosition> positions = TreeSearch.findPositions(tree, "NP < DT");   // [(0,)]
 * List<TreeNode> nouns = TreeSearch.findNodes(tree, "/^NN/");                   // [NN]
 *
 * CompiledQuery query = TreeSearch.compile("* . ran");
 * List<TreeNode> before = TreeSearch.findNodes(tree, query);                   // [NP, NN, dog]
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link TgrepSyntaxException} - malformed query text, raised before any node is visited</li>
 *   <li>{@link io.github.cyfko.tgrep.core.exception.UndefinedMacroException} - a macro used but
 *       never defined, raised when evaluation first reaches it; the search is aborted</li>
 * </ul>
 *
 * <p>
 * Returned positions are relative to the tree passed in. When that tree is itself a subtree,
 * relations still see its enclosing tree.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see TgrepParser
 */
public final class TreeSearch {

    private static final Logger log = Logger.getLogger(TreeSearch.class.getName());

    private static final BasicTgrepParser PARSER = new BasicTgrepParser();

    private TreeSearch() {}

    /**
     * Splits a query into raw tokens without compiling it.
     *
     * @param query the query text
     * @return the tokens of the longest well-formed prefix
     * @see TgrepParser#tokenize(String)
     */
    public static List<String> tokenize(String query) {
        return PARSER.tokenize(query);
    }

    /**
     * Compiles a query with the shared parser.
     *
     * @param query the query text
     * @return the compiled query
     * @throws TgrepSyntaxException if the text is malformed
     */
    public static CompiledQuery compile(String query) {
        return PARSER.compile(query);
    }

    /**
     * Equivalent to {@code findPositions(tree, query, true)}.
     *
     * @param tree  the tree to search
     * @param query the query text
     * @return the matching positions, in pre-order
     */
    public static List<TreePosition> findPositions(TreeNode tree, String query) {
        return findPositions(tree, query, true);
    }

    /**
     * @param tree          the tree to search
     * @param query         the query text
     * @param includeLeaves whether leaf positions are candidates
     * @return the matching positions, in pre-order
     */
    public static List<TreePosition> findPositions(TreeNode tree, String query, boolean includeLeaves) {
        return findPositions(tree, compile(query), includeLeaves);
    }

    /**
     * Equivalent to {@code findPositions(tree, query, true)}.
     *
     * @param tree  the tree to search
     * @param query a compiled query
     * @return the matching positions, in pre-order
     */
    public static List<TreePosition> findPositions(TreeNode tree, CompiledQuery query) {
        return findPositions(tree, query, true);
    }

    /**
     * Tests every position of {@code tree} against {@code query}.
     *
     * @param tree          the tree to search
     * @param query         a compiled query
     * @param includeLeaves whether leaf positions are candidates
     * @return the matching positions, in pre-order
     */
    public static List<TreePosition> findPositions(TreeNode tree, CompiledQuery query, boolean includeLeaves) {
        Objects.requireNonNull(tree, "Tree cannot be null");
        Objects.requireNonNull(query, "Query cannot be null");

        long start = System.nanoTime();
        List<TreePosition> candidates = tree.positions(includeLeaves);
        List<TreePosition> matches = new ArrayList<>();
        for (TreePosition position : candidates) {
            if (query.matches(tree.get(position))) {
                matches.add(position);
            }
        }

        long durationMicros = (System.nanoTime() - start) / 1000;
        log.fine(() -> String.format("Searched %d position(s) with '%s': %d match(es) in %d µs",
                candidates.size(), query.query(), matches.size(), durationMicros));
        return matches;
    }

    /**
     * Equivalent to {@code findNodes(tree, query, true)}.
     *
     * @param tree  the tree to search
     * @param query the query text
     * @return the matching nodes, in pre-order
     */
    public static List<TreeNode> findNodes(TreeNode tree, String query) {
        return findNodes(tree, query, true);
    }

    /**
     * @param tree          the tree to search
     * @param query         the query text
     * @param includeLeaves whether leaves are candidates
     * @return the matching nodes, in pre-order
     */
    public static List<TreeNode> findNodes(TreeNode tree, String query, boolean includeLeaves) {
        return findNodes(tree, compile(query), includeLeaves);
    }

    /**
     * Equivalent to {@code findNodes(tree, query, true)}.
     *
     * @param tree  the tree to search
     * @param query a compiled query
     * @return the matching nodes, in pre-order
     */
    public static List<TreeNode> findNodes(TreeNode tree, CompiledQuery query) {
        return findNodes(tree, query, true);
    }

    /**
     * @param tree          the tree to search
     * @param query         a compiled query
     * @param includeLeaves whether leaves are candidates
     * @return the matching nodes, in the order of {@link #findPositions(TreeNode, CompiledQuery, boolean)}
     */
    public static List<TreeNode> findNodes(TreeNode tree, CompiledQuery query, boolean includeLeaves) {
        List<TreeNode> nodes = new ArrayList<>();
        for (TreePosition position : findPositions(tree, query, includeLeaves)) {
            nodes.add(tree.get(position));
        }
        return nodes;
    }
}
