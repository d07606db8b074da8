package io.github.cyfko.sheetlogic.core.exception;

/**
 * Exception thrown when the classified workbook handed to the compiler is structurally invalid.
 * <p>
 * Unlike formula-level failures, which are recovered locally and reported, this exception signals
 * a programming error in the producer of the workbook model: a blank sheet name, a non-positive
 * row, two cells sharing one coordinate, a named range declared twice, and so on. It is raised
 * eagerly by the model constructors.
 * </p>
 *
 * <pre>{@code
 * new Coordinate("Sheet1", 0, 5);
 * // → "column must be >= 1, got 0"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class WorkbookDefinitionException extends RuntimeException {

    public WorkbookDefinitionException(String message) {
        super(message);
    }

    public WorkbookDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
