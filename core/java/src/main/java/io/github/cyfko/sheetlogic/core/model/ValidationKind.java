package io.github.cyfko.sheetlogic.core.model;

/**
 * Data-validation rule kinds extracted by the upstream classifier.
 *
 * @since 1.0.0
 */
public enum ValidationKind {
    NUMBER,
    INTEGER,
    DATE,
    LIST,
    TEXT,
    ANY;

    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER || this == DATE;
    }
}
