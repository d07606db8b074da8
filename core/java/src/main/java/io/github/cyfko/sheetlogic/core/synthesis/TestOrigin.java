package io.github.cyfko.sheetlogic.core.synthesis;

/**
 * Where the inputs of a synthesized test case come from.
 *
 * @since 1.0.0
 */
public enum TestOrigin {
    /** The values found in the workbook snapshot. */
    OBSERVED,
    /** A numeric input moved to zero, to a declared bound, or one past it. */
    BOUNDARY,
    /** A list-validated input set to one of its declared options. */
    SYNTHETIC
}
