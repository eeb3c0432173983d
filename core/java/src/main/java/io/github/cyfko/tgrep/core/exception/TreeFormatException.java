package io.github.cyfko.tgrep.core.exception;

/**
 * Exception thrown when bracketed tree text cannot be read.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.tgrep.core.tree.TreeReader
 */
public class TreeFormatException extends TgrepException {

    /**
     * @param message  the description of the error
     * @param position zero-based offset in the tree text
     */
    public TreeFormatException(String message, int position) {
        super(message + " at position " + position);
    }
}
