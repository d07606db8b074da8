package io.github.cyfko.sheetlogic.core.parsing;

import io.github.cyfko.sheetlogic.core.exception.ArityException;
import io.github.cyfko.sheetlogic.core.exception.FormulaSyntaxException;
import io.github.cyfko.sheetlogic.core.exception.UnknownReferenceException;
import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;

/**
 * Reason a formula could not be parsed.
 *
 * @param kind     failure category
 * @param message  human-readable message
 * @param position offset in the formula text, -1 when unknown
 * @since 1.0.0
 */
public record FormulaError(Kind kind, String message, int position) {

    public enum Kind {
        PARSE_ERROR,
        UNKNOWN_REFERENCE,
        ARITY_ERROR,
        /** The formula is well formed but designates something outside the workbook model. */
        INVALID_REFERENCE
    }

    public static FormulaError from(FormulaSyntaxException e) {
        return new FormulaError(Kind.PARSE_ERROR, e.getMessage(), e.getPosition());
    }

    public static FormulaError from(UnknownReferenceException e) {
        return new FormulaError(Kind.UNKNOWN_REFERENCE, e.getMessage(), e.getPosition());
    }

    public static FormulaError from(ArityException e) {
        return new FormulaError(Kind.ARITY_ERROR, e.getMessage(), e.getPosition());
    }

    public static FormulaError from(WorkbookDefinitionException e) {
        return new FormulaError(Kind.INVALID_REFERENCE, e.getMessage(), -1);
    }
}
