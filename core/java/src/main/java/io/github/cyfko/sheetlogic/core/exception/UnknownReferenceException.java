package io.github.cyfko.sheetlogic.core.exception;

/**
 * Exception thrown when a reference token resolves neither to a cell address nor to a named range.
 *
 * <pre>{@code
 * resolver.resolve("TaxRat", "Sheet1");
 * // → "Unknown reference 'TaxRat'"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnknownReferenceException extends RuntimeException {

    private final String reference;
    private final int position;

    public UnknownReferenceException(String reference) {
        this(reference, "Unknown reference '" + reference + "'", -1);
    }

    public UnknownReferenceException(String reference, String message) {
        this(reference, message, -1);
    }

    public UnknownReferenceException(String reference, String message, int position) {
        super(message);
        this.reference = reference;
        this.position = position;
    }

    /**
     * Returns a copy of this exception located at the given formula position.
     *
     * @param position zero-based position of the reference token
     * @return a new exception carrying the position
     */
    public UnknownReferenceException at(int position) {
        return new UnknownReferenceException(reference, getMessage(), position);
    }

    public String getReference() {
        return reference;
    }

    public int getPosition() {
        return position;
    }
}
