package io.github.cyfko.tgrep.core.exception;

import io.github.cyfko.tgrep.core.api.TgrepParser;

/**
 * Exception thrown when query text cannot be compiled.
 * <p>
 * Raised at compile time only, never while matching. Typical causes:
 * </p>
 * <ul>
 *   <li><strong>Malformed syntax:</strong> unterminated strings or regular expressions, unbalanced
 *       parentheses or brackets, an operator without a target node</li>
 *   <li><strong>Trailing text:</strong> input left over after the last statement the grammar
 *       could read</li>
 *   <li><strong>Unknown operators:</strong> text shaped like an operator that names no relation,
 *       such as {@code <<<}</li>
 *   <li><strong>Invalid regular expressions</strong> in {@code /.../} literals</li>
 *   <li><strong>Policy limits:</strong> query length or nesting depth beyond the parser's
 *       {@link io.github.cyfko.tgrep.core.config.QueryPolicy}</li>
 * </ul>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.compile("NP <");
 * // → "Expected a node at position 4"
 *
 * parser.compile("NP < DT )");
 * // → "Unexpected ')' at position 8"
 *
 * parser.compile("NP <<< DT");
 * // → "Unknown relation operator '<<<' at position 3"
 * }</pre>
 *
 * <p>
 * When the offending offset in the query is known it is available through {@link #getPosition()}
 * and already included in the message.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see TgrepParser
 */
public class TgrepSyntaxException extends TgrepException {

    private final int position;

    /**
     * Creates a syntax error without a known offset.
     *
     * @param message the description of the error
     */
    public TgrepSyntaxException(String message) {
        super(message);
        this.position = -1;
    }

    /**
     * Creates a syntax error located in the query text. The offset is appended to the message.
     *
     * @param message  the description of the error
     * @param position zero-based offset in the query text
     */
    public TgrepSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /**
     * Creates a syntax error caused by an underlying failure, such as an invalid regular expression.
     *
     * @param message  the description of the error
     * @param position zero-based offset in the query text
     * @param cause    the underlying error
     */
    public TgrepSyntaxException(String message, int position, Throwable cause) {
        super(message + " at position " + position, cause);
        this.position = position;
    }

    /**
     * @return the zero-based offset of the error in the query text, or {@code -1} if unknown
     */
    public int getPosition() {
        return position;
    }
}
