package io.github.cyfko.tgrep.core.parsing;

import io.github.cyfko.tgrep.core.api.NodePredicate;
import io.github.cyfko.tgrep.core.api.TreePosition;
import io.github.cyfko.tgrep.core.config.QueryPolicy;
import io.github.cyfko.tgrep.core.exception.TgrepSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Scannerless recursive-descent parser for TGrep queries.
 * <p>
 * Tokens are recognized on the fly and every production builds its predicate as soon as it
 * succeeds, so no syntax tree is ever materialized. Alternatives are tried in a fixed order; a
 * production that fails restores the cursor and the token list before the next alternative is
 * tried.
 * </p>
 *
 * <p><strong>Two modes share the same productions:</strong></p>
 * <ul>
 *   <li>{@link #parse(String, QueryPolicy)} builds predicates, validates operators and regular
 *       expressions, and requires the whole text to be consumed;</li>
 *   <li>{@link #tokenize(String, QueryPolicy)} only records raw tokens and stops at the end of the
 *       longest well-formed prefix.</li>
 * </ul>
 *
 * <p>
 * {@code &} binds tighter than {@code |}; juxtaposed relations are conjoined. Conjunctions and
 * disjunctions are folded from the right, which for boolean {@code and} / {@code or} gives the same
 * truth value as any other grouping.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.tgrep.core.api.TgrepParser
 */
public final class TgrepGrammar {

    private static final Logger log = Logger.getLogger(TgrepGrammar.class.getName());

    private static final String LITERAL_STOP_CHARS = "][ \r\t\n;:.,&|<>()$!@%'^=";
    private static final String MACRO_NAME_STOP_CHARS = "];:.,&|<>()[$!@%'^=\r\t\n ";
    private static final String OPERATOR_START_CHARS = "$%,.<>";
    private static final String OPERATOR_CHARS = "%,.<>0123456789-':";
    private static final String CASE_INSENSITIVE_PREFIX = "i@";
    private static final String TREE_POSITION_PREFIX = "N(";
    private static final NodePredicate RECOGNIZED = NodePredicate.always();

    private final String text;
    private final boolean building;
    private final int maxNestingDepth;
    private final List<String> tokens = new ArrayList<>();
    private final List<NodePredicate> expressions = new ArrayList<>();
    private final MacroBinder macros = new MacroBinder();

    private int pos;
    private int depth;
    private boolean lastStatementWasExpression;
    private int failurePosition = -1;
    private String failureExpectation;

    private TgrepGrammar(String text, boolean building, int maxNestingDepth) {
        this.text = text;
        this.building = building;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses a complete query and builds its predicates.
     *
     * @param query  the query text
     * @param policy the limits to enforce
     * @return the parsed statements
     * @throws TgrepSyntaxException if the text is malformed, exceeds the policy, uses an unknown
     *                              operator or an invalid regular expression, defines macros
     *                              without searching for anything, or is not consumed in full
     */
    public static ParsedQuery parse(String query, QueryPolicy policy) {
        TgrepGrammar grammar = newGrammar(query, policy, true);
        grammar.query();
        grammar.skipIgnorable();
        if (grammar.pos < grammar.text.length()) {
            throw grammar.unexpectedInput();
        }

        ParsedQuery parsed = new ParsedQuery(grammar.expressions, grammar.macros.bind(), grammar.tokens);
        log.fine(() -> String.format("Parsed query '%s': %d token(s), %d expression(s), %d macro(s)",
                query, parsed.tokens().size(), parsed.expressions().size(), parsed.macros().size()));
        return parsed;
    }

    /**
     * Reads the raw tokens of the longest well-formed prefix of a query. Operator names and
     * regular expressions are not validated.
     *
     * @param query  the query text
     * @param policy the limits to enforce
     * @return the raw tokens, in order
     * @throws TgrepSyntaxException if no statement can be read at all or the policy is exceeded
     */
    public static List<String> tokenize(String query, QueryPolicy policy) {
        TgrepGrammar grammar = newGrammar(query, policy, false);
        grammar.query();
        return List.copyOf(grammar.tokens);
    }

    private static TgrepGrammar newGrammar(String query, QueryPolicy policy, boolean building) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(policy, "policy");
        if (query.length() > policy.maxQueryLength()) {
            throw new TgrepSyntaxException(String.format(
                    "Query too long (%d characters, max: %d). Policy applied: %s",
                    query.length(), policy.maxQueryLength(), policy.policyName()));
        }
        return new TgrepGrammar(query, building, policy.maxNestingDepth());
    }

    // ---------------------------------------------------------------- statements

    private void query() {
        int expressionCount = 0;
        if (!statement()) {
            throw unexpectedInput();
        }
        expressionCount += lastStatementWasExpression ? 1 : 0;

        while (true) {
            long mark = mark();
            skipIgnorable();
            if (!accept(';') || !statement()) {
                reset(mark);
                break;
            }
            expressionCount += lastStatementWasExpression ? 1 : 0;
        }

        if (expressionCount == 0) {
            throw new TgrepSyntaxException("Query defines macros but contains no search expression", pos);
        }
    }

    private boolean statement() {
        if (macroDefinition()) {
            lastStatementWasExpression = false;
            return true;
        }
        NodePredicate expression = expr();
        if (expression == null) {
            return false;
        }
        if (building) {
            expressions.add(expression);
        }
        lastStatementWasExpression = true;
        return true;
    }

    /**
     * {@code '@' WS name expr} or {@code '@'name WS expr}.
     */
    private boolean macroDefinition() {
        long mark = mark();
        skipIgnorable();
        if (peek() != '@') {
            reset(mark);
            return false;
        }

        String name;
        if (isWhitespace(peekAt(pos + 1))) {
            pos++;
            tokens.add("@");
            while (isWhitespace(peek())) {
                pos++;
            }
            name = scanMacroName();
            if (name.isEmpty()) {
                reset(mark);
                return false;
            }
            tokens.add(name);
        } else {
            int start = pos;
            pos++;
            name = scanMacroName();
            if (name.isEmpty() || !isWhitespace(peek())) {
                reset(mark);
                return false;
            }
            tokens.add(text.substring(start, pos));
        }

        NodePredicate body = expr();
        if (body == null) {
            reset(mark);
            return false;
        }
        if (building) {
            macros.define(name, body);
        }
        return true;
    }

    // ---------------------------------------------------------------- expressions

    private NodePredicate expr() {
        NodePredicate node = node();
        if (node == null) {
            return null;
        }
        NodePredicate relations = relations();
        return relations == null ? node : combine(node, relations, true);
    }

    private NodePredicate node() {
        long mark = mark();
        skipIgnorable();
        int start = pos;

        if (peek() == '@' && isMacroNameChar(peekAt(pos + 1))) {
            pos++;
            String name = scanMacroName();
            tokens.add("@" + name);
            return building ? NodeLiteralCompiler.macro(name) : RECOGNIZED;
        }

        if (peek() == '(') {
            NodePredicate inner = parenthesized(start);
            if (inner != null) {
                return inner;
            }
            reset(mark);
            return null;
        }

        if (text.startsWith(TREE_POSITION_PREFIX, pos)) {
            NodePredicate position = treePosition();
            if (position != null) {
                return position;
            }
            reset(mark);
            skipIgnorable();
        }

        if (peek() == '\'') {
            pos++;
            tokens.add("'");
        }
        List<String> alternatives = new ArrayList<>();
        String first = nodeExpr();
        if (first == null) {
            expect("a node", start);
            reset(mark);
            return null;
        }
        alternatives.add(first);
        while (true) {
            long alternativeMark = mark();
            skipIgnorable();
            if (!accept('|')) {
                reset(alternativeMark);
                break;
            }
            String next = nodeExpr();
            if (next == null) {
                reset(alternativeMark);
                break;
            }
            alternatives.add(next);
        }
        return building ? compileAlternatives(alternatives, start) : RECOGNIZED;
    }

    private NodePredicate parenthesized(int start) {
        pos++;
        tokens.add("(");
        enterNesting(start);
        try {
            NodePredicate inner = expr();
            if (inner == null) {
                return null;
            }
            skipIgnorable();
            if (!accept(')')) {
                expect("')'", pos);
                return null;
            }
            return inner;
        } finally {
            depth--;
        }
    }

    /**
     * {@code N( [digits (',' digits)* ','?] )}.
     */
    private NodePredicate treePosition() {
        pos += TREE_POSITION_PREFIX.length();
        tokens.add(TREE_POSITION_PREFIX);

        List<Integer> indexes = new ArrayList<>();
        skipIgnorable();
        if (isDigit(peek())) {
            indexes.add(scanIndex());
            while (true) {
                long mark = mark();
                skipIgnorable();
                if (!accept(',')) {
                    reset(mark);
                    break;
                }
                skipIgnorable();
                if (!isDigit(peek())) {
                    break;
                }
                indexes.add(scanIndex());
            }
        }
        skipIgnorable();
        if (!accept(')')) {
            expect("')' closing a tree position", pos);
            return null;
        }
        return building ? NodeLiteralCompiler.position(TreePosition.of(indexes)) : RECOGNIZED;
    }

    private int scanIndex() {
        int start = pos;
        while (isDigit(peek())) {
            pos++;
        }
        String digits = text.substring(start, pos);
        tokens.add(digits);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new TgrepSyntaxException("Tree position index out of range: " + digits, start, e);
        }
    }

    /**
     * Reads one node token: case-insensitive string or regex, string, regex, or bare literal.
     *
     * @return the raw token, or {@code null} if none starts here
     */
    private String nodeExpr() {
        skipIgnorable();
        int start = pos;
        int end;
        if (text.startsWith(CASE_INSENSITIVE_PREFIX + "\"", pos) || text.startsWith(CASE_INSENSITIVE_PREFIX + "/", pos)) {
            end = scanDelimited(pos + CASE_INSENSITIVE_PREFIX.length());
        } else if (peek() == '"' || peek() == '/') {
            end = scanDelimited(pos);
        } else {
            end = pos;
            while (end < text.length() && LITERAL_STOP_CHARS.indexOf(text.charAt(end)) < 0) {
                end++;
            }
            if (end == start) {
                return null;
            }
        }
        if (end < 0) {
            if (building) {
                throw new TgrepSyntaxException("Unterminated string or regular expression", start);
            }
            return null;
        }
        pos = end;
        String token = text.substring(start, end);
        tokens.add(token);
        return token;
    }

    /**
     * Scans a {@code "..."} or {@code /.../} token starting at {@code from}. A backslash escapes the
     * next character; line breaks are not allowed inside.
     *
     * @return the index just past the closing delimiter, or -1 if unterminated
     */
    private int scanDelimited(int from) {
        char delimiter = text.charAt(from);
        int i = from + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == delimiter) {
                return i + 1;
            }
            if (c == '\n' || c == '\r') {
                return -1;
            }
            if (c == '\\') {
                if (i + 1 >= text.length()) {
                    return -1;
                }
                i++;
            }
            i++;
        }
        return -1;
    }

    private NodePredicate compileAlternatives(List<String> alternatives, int start) {
        try {
            return NodeLiteralCompiler.compileAlternatives(alternatives);
        } catch (PatternSyntaxException e) {
            throw new TgrepSyntaxException("Invalid regular expression: " + e.getDescription(), start, e);
        }
    }

    // ---------------------------------------------------------------- relations

    /**
     * {@code relConjunction ('|' relConjunction)*}.
     */
    private NodePredicate relations() {
        NodePredicate first = relConjunction();
        if (first == null) {
            return null;
        }
        List<NodePredicate> disjuncts = new ArrayList<>();
        disjuncts.add(first);
        while (true) {
            long mark = mark();
            skipIgnorable();
            if (!accept('|')) {
                reset(mark);
                break;
            }
            NodePredicate next = relConjunction();
            if (next == null) {
                reset(mark);
                break;
            }
            disjuncts.add(next);
        }
        return foldRight(disjuncts, false);
    }

    /**
     * {@code relation ('&'? relation)*}.
     */
    private NodePredicate relConjunction() {
        NodePredicate first = relation();
        if (first == null) {
            return null;
        }
        List<NodePredicate> conjuncts = new ArrayList<>();
        conjuncts.add(first);
        while (true) {
            long mark = mark();
            skipIgnorable();
            accept('&');
            NodePredicate next = relation();
            if (next == null) {
                reset(mark);
                break;
            }
            conjuncts.add(next);
        }
        return foldRight(conjuncts, true);
    }

    /**
     * {@code '!'? '[' relations ']'} or {@code '!'? operator node}.
     */
    private NodePredicate relation() {
        NodePredicate bracketed = bracketedRelations();
        if (bracketed != null) {
            return bracketed;
        }

        long mark = mark();
        skipIgnorable();
        boolean negated = accept('!');
        skipIgnorable();
        int operatorStart = pos;
        String operator = scanOperator();
        if (operator == null) {
            expect("a relation operator", operatorStart);
            reset(mark);
            return null;
        }
        NodePredicate target = node();
        if (target == null) {
            reset(mark);
            return null;
        }
        if (!building) {
            return RECOGNIZED;
        }

        NodePredicate relation;
        try {
            relation = RelationCompiler.compile(operator, target);
        } catch (IllegalArgumentException e) {
            throw new TgrepSyntaxException(e.getMessage(), operatorStart, e);
        }
        return negated ? RelationCompiler.negate(relation) : relation;
    }

    private NodePredicate bracketedRelations() {
        long mark = mark();
        skipIgnorable();
        int start = pos;
        boolean negated = accept('!');
        skipIgnorable();
        if (!accept('[')) {
            reset(mark);
            return null;
        }

        enterNesting(start);
        try {
            NodePredicate inner = relations();
            skipIgnorable();
            if (inner == null || !accept(']')) {
                expect("']'", pos);
                reset(mark);
                return null;
            }
            if (!building) {
                return RECOGNIZED;
            }
            return negated ? RelationCompiler.negate(inner) : inner;
        } finally {
            depth--;
        }
    }

    private String scanOperator() {
        if (OPERATOR_START_CHARS.indexOf(peek()) < 0) {
            return null;
        }
        int start = pos;
        pos++;
        while (pos < text.length() && OPERATOR_CHARS.indexOf(text.charAt(pos)) >= 0) {
            pos++;
        }
        String operator = text.substring(start, pos);
        tokens.add(operator);
        return operator;
    }

    private NodePredicate foldRight(List<NodePredicate> operands, boolean conjunction) {
        if (!building) {
            return RECOGNIZED;
        }
        NodePredicate result = operands.get(operands.size() - 1);
        for (int i = operands.size() - 2; i >= 0; i--) {
            result = combine(operands.get(i), result, conjunction);
        }
        return result;
    }

    private NodePredicate combine(NodePredicate left, NodePredicate right, boolean conjunction) {
        if (!building) {
            return RECOGNIZED;
        }
        return conjunction ? left.and(right) : left.or(right);
    }

    // ---------------------------------------------------------------- cursor

    /**
     * Packs the token count (high bits) and the cursor (low bits) into one restorable mark.
     */
    private long mark() {
        return ((long) tokens.size() << 32) | pos;
    }

    private void reset(long mark) {
        pos = (int) mark;
        int tokenCount = (int) (mark >>> 32);
        while (tokens.size() > tokenCount) {
            tokens.remove(tokens.size() - 1);
        }
    }

    private boolean accept(char expected) {
        if (peek() == expected) {
            pos++;
            tokens.add(String.valueOf(expected));
            return true;
        }
        return false;
    }

    private void skipIgnorable() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private String scanMacroName() {
        int start = pos;
        while (pos < text.length() && isMacroNameChar(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private void enterNesting(int start) {
        depth++;
        if (depth > maxNestingDepth) {
            throw new TgrepSyntaxException(String.format(
                    "Nesting depth exceeds the maximum of %d", maxNestingDepth), start);
        }
    }

    private void expect(String what, int at) {
        if (at >= failurePosition) {
            failurePosition = at;
            failureExpectation = what;
        }
    }

    private TgrepSyntaxException unexpectedInput() {
        if (pos >= text.length() && failureExpectation == null) {
            return new TgrepSyntaxException("Unexpected end of query", pos);
        }
        if (failurePosition > pos) {
            return new TgrepSyntaxException("Expected " + failureExpectation, failurePosition);
        }
        String found = pos < text.length() ? "'" + excerpt(pos) + "'" : "end of query";
        return new TgrepSyntaxException("Unexpected " + found, pos);
    }

    private String excerpt(int from) {
        int end = Math.min(text.length(), from + 20);
        return text.substring(from, end);
    }

    private char peek() {
        return peekAt(pos);
    }

    private char peekAt(int index) {
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isMacroNameChar(char c) {
        return c != '\0' && MACRO_NAME_STOP_CHARS.indexOf(c) < 0;
    }
}
