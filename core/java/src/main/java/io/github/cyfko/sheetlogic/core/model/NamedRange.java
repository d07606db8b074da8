package io.github.cyfko.sheetlogic.core.model;

import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;

import java.util.regex.Pattern;

/**
 * A user-defined alias for a single cell or a range. Exactly one of {@code cell} and {@code range} is set.
 *
 * <pre>{@code
 * NamedRange rate = NamedRange.ofCell("TaxRate", Coordinate.of("Settings", "B2"));
 * NamedRange table = NamedRange.ofRange("Prices", CellRange.of(...));
 * }</pre>
 *
 * @param name  the alias, matched case-insensitively
 * @param cell  target cell, or null when the name targets a range
 * @param range target range, or null when the name targets a cell
 * @since 1.0.0
 */
public record NamedRange(String name, Coordinate cell, CellRange range) {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_\\\\][A-Za-z0-9_.]*");

    public NamedRange {
        if (name == null || !NAME.matcher(name).matches())
            throw new WorkbookDefinitionException("invalid range name: " + name);
        if ((cell == null) == (range == null))
            throw new WorkbookDefinitionException("named range " + name + " must target exactly one cell or one range");
    }

    public static NamedRange ofCell(String name, Coordinate cell) {
        return new NamedRange(name, cell, null);
    }

    public static NamedRange ofRange(String name, CellRange range) {
        if (range != null && range.isSingleCell()) {
            return new NamedRange(name, range.start(), null);
        }
        return new NamedRange(name, null, range);
    }

    public boolean isRange() {
        return range != null;
    }
}
