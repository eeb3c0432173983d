package io.github.cyfko.tgrep.core.exception;

/**
 * Base type of every failure raised by the TGrep library.
 * <p>
 * All subclasses are unchecked. Catching {@code TgrepException} handles query syntax errors,
 * undefined macros and malformed tree text alike:
 * </p>
 * <pre>{@code
 * try {
 *     List<TreePosition> hits = TreeSearch.findPositions(tree, userQuery);
 * } catch (TgrepException e) {
 *     logger.warning("Query '" + userQuery + "' failed: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see TgrepSyntaxException
 * @see UndefinedMacroException
 * @see TreeFormatException
 */
public class TgrepException extends RuntimeException {

    /**
     * @param message the description of the failure
     */
    public TgrepException(String message) {
        super(message);
    }

    /**
     * @param message the description of the failure
     * @param cause   the underlying error
     */
    public TgrepException(String message, Throwable cause) {
        super(message, cause);
    }
}
