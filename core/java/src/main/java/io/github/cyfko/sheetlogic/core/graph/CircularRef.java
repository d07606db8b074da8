package io.github.cyfko.sheetlogic.core.graph;

import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.model.IterativeSettings;

import java.util.List;

/**
 * A strongly connected group of cells that reference each other, directly or transitively.
 *
 * @param cycle          members, in coordinate order
 * @param classification whether the cycle is solved iteratively or reported as an error
 * @param settings       iteration limits, or null for {@link CycleClassification#ERROR} cycles
 * @since 1.0.0
 */
public record CircularRef(List<Coordinate> cycle, CycleClassification classification, IterativeSettings settings) {

    public CircularRef {
        if (cycle == null || cycle.isEmpty()) {
            throw new IllegalArgumentException("cycle cannot be empty");
        }
        if (classification == CycleClassification.ITERATIVE && settings == null) {
            throw new IllegalArgumentException("iterative cycle requires settings");
        }
        cycle = List.copyOf(cycle);
        if (classification == CycleClassification.ERROR) {
            settings = null;
        }
    }

    public boolean isIterative() {
        return classification == CycleClassification.ITERATIVE;
    }

    public int maxIterations() {
        return settings == null ? 0 : settings.maxIterations();
    }

    public double convergenceThreshold() {
        return settings == null ? 0 : settings.convergenceThreshold();
    }
}
