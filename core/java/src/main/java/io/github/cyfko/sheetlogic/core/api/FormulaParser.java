package io.github.cyfko.sheetlogic.core.api;

import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.parsing.ParseOutcome;

/**
 * Parses spreadsheet formulas into typed ASTs.
 * <p>
 * Parsing never throws for bad formula content: syntax errors, unknown references and arity
 * violations are returned as a failed {@link ParseOutcome} carrying the position of the problem.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FormulaParser {

    /**
     * Parses a formula located at {@code cell}.
     *
     * @param formula formula text starting with {@code =}
     * @param cell    the cell holding the formula; its sheet qualifies unqualified references
     * @return the outcome, never null
     */
    ParseOutcome parse(String formula, Coordinate cell);
}
