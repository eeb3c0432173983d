package io.github.cyfko.tgrep.core.api;

import java.util.List;
import java.util.Optional;

/**
 * Enumeration of the relations a query can require between two nodes {@code A op B}, where
 * {@code A} is the node being tested and {@code B} any node satisfying the operator's target.
 * <p>
 * Each relation carries the operator symbols that denote it. Symbols prefixed with {@code %} are
 * accepted as synonyms of the {@code $} sister operators. The four indexed relations have no fixed
 * symbol: they are written with a number, as in {@code <2} or {@code >-1}, and are resolved by the
 * relation compiler.
 * </p>
 *
 * <p><strong>Operator reference:</strong></p>
 * <table border="1">
 * <caption>TGrep relation operators</caption>
 * <tr><th>Family</th><th>Symbols</th><th>Meaning</th></tr>
 * <tr><td>Direct dominance</td><td>{@code < > <N >N <-N >-N <, >, <' >' <: >:}</td>
 *     <td>child / parent, by position among the children</td></tr>
 * <tr><td>Deep dominance</td><td>{@code << >> <<, >>, <<' >>' <<: >>:}</td>
 *     <td>descendant / ancestor, optionally along the left, right or single-child path</td></tr>
 * <tr><td>Precedence</td><td>{@code . , .. ,,}</td>
 *     <td>terminal yield order, immediate or not</td></tr>
 * <tr><td>Sisterhood</td><td>{@code $ $. $, $.. $,,}</td>
 *     <td>shared parent, optionally ordered</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Relation {

    /** {@code A < B}: A is the parent of B. */
    PARENT_OF("<"),

    /** {@code A > B}: A is a child of B. */
    CHILD_OF(">"),

    /** {@code A <, B}: B is the first child of A. */
    FIRST_CHILD("<,", "<1"),

    /** {@code A >, B}: A is the first child of B. */
    FIRST_CHILD_OF(">,", ">1"),

    /** {@code A <' B}: B is the last child of A. */
    LAST_CHILD("<'", "<-", "<-1"),

    /** {@code A >' B}: A is the last child of B. */
    LAST_CHILD_OF(">'", ">-", ">-1"),

    /** {@code A <N B}: B is the Nth child of A, counting from 1. */
    NTH_CHILD,

    /** {@code A >N B}: A is the Nth child of B, counting from 1. */
    NTH_CHILD_OF,

    /** {@code A <-N B}: B is the Nth-to-last child of A, the last child being 1. */
    NTH_LAST_CHILD,

    /** {@code A >-N B}: A is the Nth-to-last child of B, the last child being 1. */
    NTH_LAST_CHILD_OF,

    /** {@code A <: B}: B is the only child of A. */
    ONLY_CHILD("<:"),

    /** {@code A >: B}: A is the only child of B. */
    ONLY_CHILD_OF(">:"),

    /** {@code A << B}: A dominates B. */
    DOMINATES("<<"),

    /** {@code A >> B}: A is dominated by B. */
    DOMINATED_BY(">>"),

    /** {@code A <<, B}: B is a leftmost descendant of A. */
    LEFTMOST_DESCENDANT("<<,", "<<1"),

    /** {@code A >>, B}: A is a leftmost descendant of B. */
    LEFTMOST_DESCENDANT_OF(">>,"),

    /** {@code A <<' B}: B is a rightmost descendant of A. */
    RIGHTMOST_DESCENDANT("<<'"),

    /** {@code A >>' B}: A is a rightmost descendant of B. */
    RIGHTMOST_DESCENDANT_OF(">>'"),

    /** {@code A <<: B}: there is a single path of descent from A and B is on it. */
    UNARY_DESCENDANT("<<:"),

    /** {@code A >>: B}: there is a single path of descent from B and A is on it. */
    UNARY_DESCENDANT_OF(">>:"),

    /** {@code A . B}: A immediately precedes B. */
    IMMEDIATELY_PRECEDES("."),

    /** {@code A , B}: A immediately follows B. */
    IMMEDIATELY_FOLLOWS(","),

    /** {@code A .. B}: A precedes B. */
    PRECEDES(".."),

    /** {@code A ,, B}: A follows B. */
    FOLLOWS(",,"),

    /** {@code A $ B}: A is a sister of B, and A is not B. */
    SISTER("$", "%"),

    /** {@code A $. B}: A is a sister of B and immediately precedes it. */
    IMMEDIATE_LEFT_SISTER_OF("$.", "%."),

    /** {@code A $, B}: A is a sister of B and immediately follows it. */
    IMMEDIATE_RIGHT_SISTER_OF("$,", "%,"),

    /** {@code A $.. B}: A is a sister of B and precedes it. */
    LEFT_SISTER_OF("$..", "%.."),

    /** {@code A $,, B}: A is a sister of B and follows it. */
    RIGHT_SISTER_OF("$,,", "%,,");

    private final List<String> symbols;

    Relation(String... symbols) {
        this.symbols = List.of(symbols);
    }

    /**
     * Returns the operator symbols denoting this relation, the canonical one first. Empty for the
     * indexed relations.
     *
     * @return the symbols
     */
    public List<String> getSymbols() {
        return symbols;
    }

    /**
     * @return {@code true} for relations written with a numeric index
     */
    public boolean isIndexed() {
        return symbols.isEmpty();
    }

    /**
     * Finds the relation denoted by a fixed operator symbol.
     *
     * @param symbol operator symbol, without negation
     * @return the relation, or empty if the symbol is not a fixed operator
     * @throws NullPointerException if {@code symbol} is {@code null}
     */
    public static Optional<Relation> fromSymbol(String symbol) {
        for (Relation relation : values()) {
            if (relation.symbols.contains(symbol)) {
                return Optional.of(relation);
            }
        }
        return Optional.empty();
    }
}
