package io.github.cyfko.sheetlogic.core.model;

/**
 * Role assigned to a cell by the upstream classifier.
 *
 * @since 1.0.0
 */
public enum CellRole {
    /** Value supplied by the user of the sheet. */
    INPUT,
    /** Calculated cell that is neither a declared output nor referenced as an intermediate. */
    FORMULA,
    /** Calculated cell feeding other calculations. */
    INTERMEDIATE,
    /** Result presented to the user of the sheet. */
    OUTPUT,
    /** Caption or structural text; never part of the dependency graph. */
    LABEL;

    public boolean participatesInGraph() {
        return this != LABEL;
    }
}
