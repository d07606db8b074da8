package io.github.cyfko.sheetlogic.core.model;

/**
 * Used area of a sheet, bounding whole-column ({@code A:A}) and whole-row ({@code 1:1}) references.
 *
 * @param maxColumn last used column, at least 1
 * @param maxRow    last used row, at least 1
 * @since 1.0.0
 */
public record SheetExtent(int maxColumn, int maxRow) {

    public SheetExtent {
        maxColumn = Math.max(1, maxColumn);
        maxRow = Math.max(1, maxRow);
    }
}
