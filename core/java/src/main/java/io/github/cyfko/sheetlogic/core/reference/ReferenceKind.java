package io.github.cyfko.sheetlogic.core.reference;

/**
 * How a reference was written, carried from the parser to the dependency-graph edges.
 * <p>
 * When several apply, the most specific wins: {@link #NAMED} over {@link #CROSS_SHEET} over
 * {@link #RANGE} over {@link #DIRECT}.
 * </p>
 *
 * @since 1.0.0
 */
public enum ReferenceKind {
    /** A single cell on the formula's own sheet, e.g. {@code B5}. */
    DIRECT,
    /** A rectangular range on the formula's own sheet, e.g. {@code B5:D9}. */
    RANGE,
    /** A named range or named cell, e.g. {@code TaxRate}. */
    NAMED,
    /** A cell or range on another sheet, e.g. {@code Sheet2!B5}. */
    CROSS_SHEET
}
