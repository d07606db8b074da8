package io.github.cyfko.sheetlogic.core.value;

/**
 * Type tag of an {@link EvaluatedValue}, plus {@link #MIXED} for cells whose samples disagree.
 *
 * @since 1.0.0
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    DATE,
    ERROR,
    EMPTY,
    MIXED;

    /**
     * Joins two observed types: identical tags stay, anything else becomes {@link #MIXED}.
     *
     * @param other the other observed type, may be null for "nothing observed yet"
     * @return the joined type
     */
    public ValueType join(ValueType other) {
        if (other == null || other == this) return this;
        return MIXED;
    }
}
