package io.github.cyfko.sheetlogic.core.exception;

/**
 * Exception thrown when a formula contains malformed syntax.
 * <p>
 * The exception carries the zero-based character position at which the problem was detected,
 * measured from the start of the formula text (the leading {@code '='} counts as position 0).
 * A position of {@code -1} means the error is not tied to a specific character.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("=(A1+2", cell);
 * // → "Mismatched parentheses: unmatched '(' at position 1"
 *
 * parser.parse("=A1 B1", cell);
 * // → "Missing operator before 'B1' at position 4"
 * }</pre>
 *
 * <p>Instances never escape {@link io.github.cyfko.sheetlogic.core.api.FormulaParser#parse}: the parser
 * converts them into a failed {@link io.github.cyfko.sheetlogic.core.parsing.ParseOutcome}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaSyntaxException extends RuntimeException {

    private final int position;

    /**
     * Constructor with an explanatory error message and no specific position.
     *
     * @param message the message describing the syntax error
     */
    public FormulaSyntaxException(String message) {
        this(message, -1);
    }

    /**
     * Constructor with an explanatory error message and the offending position.
     *
     * @param message  the message describing the syntax error
     * @param position zero-based position in the formula text, or -1 if unknown
     */
    public FormulaSyntaxException(String message, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.position = position;
    }

    /**
     * Returns the zero-based position of the error in the formula text.
     *
     * @return the position, or -1 when unknown
     */
    public int getPosition() {
        return position;
    }
}
