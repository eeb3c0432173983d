package io.github.cyfko.tgrep.core.tree;

import io.github.cyfko.tgrep.core.exception.TreeFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads trees written in the bracketed (Penn Treebank) notation.
 * <p>
 * {@code (label child ...)} is an internal node; a bare word is a leaf. The label may be omitted,
 * as in the empty root wrapper {@code ( (S ...))} found in treebank files, in which case it is the
 * empty string.
 * </p>
 *
 * <pre>{@code
 * ParentedTree tree = TreeReader.read("(S (NP (DT the) (NN dog)) (VP (VBD ran)))");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TreeReader {

    private final String text;
    private int pos;

    private TreeReader(String text) {
        this.text = text;
    }

    /**
     * Reads exactly one tree.
     *
     * @param text the bracketed text
     * @return the root of the tree
     * @throws TreeFormatException if the text is not exactly one well-formed tree
     */
    public static ParentedTree read(String text) {
        Objects.requireNonNull(text, "text");
        TreeReader reader = new TreeReader(text);
        reader.skipWhitespace();
        if (reader.pos >= text.length()) {
            throw new TreeFormatException("Empty tree text", 0);
        }
        ParentedTree tree = reader.readTree();
        reader.skipWhitespace();
        if (reader.pos < text.length()) {
            throw new TreeFormatException("Unexpected text after the tree", reader.pos);
        }
        return tree;
    }

    /**
     * Reads every tree of a text holding several bracketed trees separated by whitespace.
     *
     * @param text the bracketed text
     * @return the trees, in order; empty for blank text
     * @throws TreeFormatException if a tree is malformed
     */
    public static List<ParentedTree> readAll(String text) {
        Objects.requireNonNull(text, "text");
        TreeReader reader = new TreeReader(text);
        List<ParentedTree> trees = new ArrayList<>();
        reader.skipWhitespace();
        while (reader.pos < text.length()) {
            trees.add(reader.readTree());
            reader.skipWhitespace();
        }
        return trees;
    }

    private ParentedTree readTree() {
        if (peek() != '(') {
            throw new TreeFormatException("Expected '('", pos);
        }
        pos++;
        skipWhitespace();

        String label = "";
        if (pos < text.length() && peek() != '(' && peek() != ')') {
            label = readAtom();
        }

        List<ParentedTree> children = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                throw new TreeFormatException("Unbalanced parentheses: missing ')'", pos);
            }
            char c = peek();
            if (c == ')') {
                pos++;
                return ParentedTree.of(label, children);
            }
            children.add(c == '(' ? readTree() : ParentedTree.leaf(readAtom()));
        }
    }

    private String readAtom() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '(' || c == ')' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        return text.substring(start, pos);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }
}
