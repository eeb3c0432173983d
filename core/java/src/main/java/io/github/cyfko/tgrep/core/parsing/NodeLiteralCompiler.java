package io.github.cyfko.tgrep.core.parsing;

import io.github.cyfko.tgrep.core.api.NodePredicate;
import io.github.cyfko.tgrep.core.api.TreeNode;
import io.github.cyfko.tgrep.core.api.TreePosition;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles node tokens into label predicates.
 * <p>
 * A node token describes the label a node must carry, independently of any relation. The literal
 * value tested is the node's {@link TreeNode#value()}: the label of an internal node, the word of a
 * leaf.
 * </p>
 *
 * <table border="1">
 * <caption>Supported node tokens</caption>
 * <tr><th>Token</th><th>Matches when the value...</th></tr>
 * <tr><td>{@code *}, {@code __}</td><td>is anything</td></tr>
 * <tr><td>{@code NP}</td><td>equals {@code NP}</td></tr>
 * <tr><td>{@code "a b"}</td><td>equals {@code a b}; {@code \"} and {@code \\} are unescaped</td></tr>
 * <tr><td>{@code /^NN/}</td><td>contains a match of the regular expression</td></tr>
 * <tr><td>{@code i@"np"}</td><td>equals the literal, ignoring case</td></tr>
 * <tr><td>{@code i@/^nn/}</td><td>contains a case-insensitive match of the regular expression</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NodeLiteralCompiler {

    private static final String CASE_INSENSITIVE_PREFIX = "i@";

    private NodeLiteralCompiler() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Compiles a single node token.
     *
     * @param token the raw token, quotes and slashes included
     * @return the label predicate
     * @throws PatternSyntaxException if the token is a regular expression that does not compile
     * @throws IllegalArgumentException if the token is empty or an unterminated string or regex
     */
    public static NodePredicate compile(String token) {
        Objects.requireNonNull(token, "token");
        if (token.isEmpty()) {
            throw new IllegalArgumentException("Empty node token");
        }
        if (token.equals("*") || token.equals("__")) {
            return NodePredicate.always();
        }
        if (token.startsWith(CASE_INSENSITIVE_PREFIX) && token.length() > 2) {
            String body = token.substring(CASE_INSENSITIVE_PREFIX.length());
            char quote = body.charAt(0);
            if (quote == '"') {
                String literal = unescape(unquote(body, '"')).toLowerCase(Locale.ROOT);
                return (node, macros) -> node.value().toLowerCase(Locale.ROOT).equals(literal);
            }
            if (quote == '/') {
                Pattern pattern = Pattern.compile(unquote(body, '/'),
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                return (node, macros) -> pattern.matcher(node.value().toLowerCase(Locale.ROOT)).find();
            }
        }
        char first = token.charAt(0);
        if (first == '"') {
            String literal = unescape(unquote(token, '"'));
            return (node, macros) -> node.value().equals(literal);
        }
        if (first == '/') {
            Pattern pattern = Pattern.compile(unquote(token, '/'));
            return (node, macros) -> pattern.matcher(node.value()).find();
        }
        return (node, macros) -> node.value().equals(token);
    }

    /**
     * Compiles a {@code |}-separated alternation of node tokens.
     *
     * @param tokens the alternatives, at least one
     * @return a predicate true when any alternative matches
     */
    public static NodePredicate compileAlternatives(List<String> tokens) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("At least one node token is required");
        }
        NodePredicate result = compile(tokens.get(0));
        for (int i = 1; i < tokens.size(); i++) {
            result = result.or(compile(tokens.get(i)));
        }
        return result;
    }

    /**
     * Positions are read through {@link TreeNode#position()}. On a tree that reports no parents
     * every node sits at the root position, so {@code N()} matches every node of such a tree and
     * any other position matches none.
     *
     * @param position the exact position required
     * @return a predicate true for the node standing at {@code position} in its tree
     */
    public static NodePredicate position(TreePosition position) {
        Objects.requireNonNull(position, "position");
        return (node, macros) -> node.position().equals(position);
    }

    /**
     * Builds a deferred macro reference. The name is resolved against the environment passed at
     * evaluation time, so a macro may be used before the statement defining it.
     *
     * @param name the macro name, without {@code @}
     * @return a predicate delegating to the macro's definition
     */
    public static NodePredicate macro(String name) {
        Objects.requireNonNull(name, "name");
        return (node, macros) -> macros.lookup(name).test(node, macros);
    }

    private static String unquote(String token, char quote) {
        if (token.length() < 2 || token.charAt(token.length() - 1) != quote) {
            throw new IllegalArgumentException("Unterminated node token: " + token);
        }
        return token.substring(1, token.length() - 1);
    }

    private static String unescape(String literal) {
        if (literal.indexOf('\\') < 0) {
            return literal;
        }
        StringBuilder sb = new StringBuilder(literal.length());
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '\\' && i + 1 < literal.length()) {
                char next = literal.charAt(i + 1);
                if (next == '"' || next == '\\') {
                    sb.append(next);
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
