package io.github.cyfko.sheetlogic.core.report;

import io.github.cyfko.sheetlogic.core.model.Coordinate;

import java.util.List;

/**
 * Reach of the problems found in a workbook.
 *
 * @param totalCells         nodes in the dependency graph
 * @param affectedCells      nodes forward-reachable from a problem
 * @param percentageAffected {@code affectedCells} as a percentage of {@code totalCells}
 * @param blockedOutputs     output cells among the affected cells
 * @since 1.0.0
 */
public record ImpactAnalysis(int totalCells, int affectedCells, double percentageAffected, List<Coordinate> blockedOutputs) {

    public ImpactAnalysis {
        blockedOutputs = List.copyOf(blockedOutputs);
    }
}
