package io.github.cyfko.sheetlogic.core.model;

import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;
import io.github.cyfko.sheetlogic.core.reference.ColumnLetters;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A resolved cell address: sheet, 1-based column and 1-based row.
 * <p>
 * Coordinates are immutable values with structural equality. Their natural order is sheet name,
 * then row, then column, which is the row-major order used for range expansion.
 * </p>
 *
 * <pre>{@code
 * Coordinate b5 = Coordinate.of("Sheet1", "B5");
 * b5.column();   // 2
 * b5.toString(); // "Sheet1!B5"
 * }</pre>
 *
 * @param sheet  sheet name, never blank
 * @param column 1-based column index
 * @param row    1-based row index
 * @since 1.0.0
 */
public record Coordinate(String sheet, int column, int row) implements Comparable<Coordinate> {

    private static final Pattern A1 = Pattern.compile("\\$?([A-Za-z]{1,3})\\$?([0-9]+)");
    private static final Pattern PLAIN_SHEET = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private static final Comparator<Coordinate> ORDER = Comparator
            .comparing(Coordinate::sheet)
            .thenComparingInt(Coordinate::row)
            .thenComparingInt(Coordinate::column);

    public Coordinate {
        if (sheet == null || sheet.isBlank())
            throw new WorkbookDefinitionException("sheet cannot be null nor blank");
        if (column < 1 || column > ColumnLetters.MAX_COLUMN)
            throw new WorkbookDefinitionException("column must be >= 1 and <= " + ColumnLetters.MAX_COLUMN + ", got " + column);
        if (row < 1 || row > ColumnLetters.MAX_ROW)
            throw new WorkbookDefinitionException("row must be >= 1 and <= " + ColumnLetters.MAX_ROW + ", got " + row);
    }

    /**
     * Creates a coordinate from an A1-style address on the given sheet. {@code $} anchors are ignored.
     *
     * @param sheet   the sheet name
     * @param address the A1 address, e.g. {@code B5} or {@code $B$5}
     * @return the coordinate
     * @throws WorkbookDefinitionException if the address is malformed
     */
    public static Coordinate of(String sheet, String address) {
        Matcher matcher = address == null ? null : A1.matcher(address.trim());
        if (matcher == null || !matcher.matches()) {
            throw new WorkbookDefinitionException("Malformed cell address: " + address);
        }
        return new Coordinate(sheet, ColumnLetters.toIndex(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    /**
     * Returns a new coordinate moved by the given offsets on the same sheet.
     *
     * @param rowOffset    rows to move (may be negative)
     * @param columnOffset columns to move (may be negative)
     * @return the shifted coordinate
     * @throws WorkbookDefinitionException if the result leaves the sheet
     */
    public Coordinate offset(int rowOffset, int columnOffset) {
        return new Coordinate(sheet, column + columnOffset, row + rowOffset);
    }

    /**
     * Returns the address without sheet qualifier, e.g. {@code B5}.
     *
     * @return the A1 address
     */
    public String toA1() {
        return ColumnLetters.toLetters(column) + row;
    }

    /**
     * Returns the sheet name as it must be written in a formula, quoted when needed.
     *
     * @param sheet the sheet name
     * @return {@code Sheet1} or {@code 'My Sheet'}
     */
    public static String quoteSheet(String sheet) {
        if (PLAIN_SHEET.matcher(sheet).matches() && !A1.matcher(sheet).matches()) {
            return sheet;
        }
        return "'" + sheet.replace("'", "''") + "'";
    }

    @Override
    public int compareTo(Coordinate other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return quoteSheet(sheet) + "!" + toA1();
    }
}
