package io.github.cyfko.sheetlogic.core.exception;

/**
 * Exception thrown when a function is called with an argument count its signature does not accept,
 * or with an empty argument slot where the signature requires a value.
 *
 * <pre>{@code
 * parser.parse("=ROUND(A1)", cell);
 * // → "Function ROUND expects 2 arguments, got 1 at position 1"
 *
 * parser.parse("=SUM(,A1)", cell);
 * // → "Function SUM does not accept an empty argument in position 1 at position 1"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ArityException extends RuntimeException {

    private final String function;
    private final int position;

    public ArityException(String function, String message, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.function = function;
        this.position = position;
    }

    public String getFunction() {
        return function;
    }

    public int getPosition() {
        return position;
    }
}
