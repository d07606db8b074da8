package io.github.cyfko.sheetlogic.core.model;

import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;

/**
 * Iterative-calculation settings allowing a circular reference to be resolved by bounded fixed-point iteration.
 *
 * @param maxIterations        iteration cap, at least 1
 * @param convergenceThreshold maximum change between two iterations for the cycle to count as converged
 * @since 1.0.0
 */
public record IterativeSettings(int maxIterations, double convergenceThreshold) {

    public IterativeSettings {
        if (maxIterations < 1)
            throw new WorkbookDefinitionException("maxIterations must be >= 1, got " + maxIterations);
        if (!(convergenceThreshold >= 0) || Double.isInfinite(convergenceThreshold))
            throw new WorkbookDefinitionException("convergenceThreshold must be a finite non-negative number, got " + convergenceThreshold);
    }

    /**
     * Spreadsheet application defaults: 100 iterations, 0.001 maximum change.
     *
     * @return default settings
     */
    public static IterativeSettings defaults() {
        return new IterativeSettings(100, 0.001);
    }
}
