package io.github.cyfko.sheetlogic.core.report;

import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.parsing.FormulaError;

/**
 * A formula cell that could not be parsed.
 *
 * @param coordinate the cell
 * @param formula    its formula text
 * @param error      what went wrong and where
 * @since 1.0.0
 */
public record CellFailure(Coordinate coordinate, String formula, FormulaError error) {

    @Override
    public String toString() {
        return String.format("%s: %s (%s)", coordinate, error.message(), formula);
    }
}
