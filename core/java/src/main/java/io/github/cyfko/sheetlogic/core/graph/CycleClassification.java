package io.github.cyfko.sheetlogic.core.graph;

/**
 * How a circular reference is treated during evaluation.
 *
 * @since 1.0.0
 */
public enum CycleClassification {
    /** Unintended cycle; every member evaluates to {@code #CIRCULAR!}. */
    ERROR,
    /** Every member allows iterative calculation; the cycle is solved by fixed-point iteration. */
    ITERATIVE
}
