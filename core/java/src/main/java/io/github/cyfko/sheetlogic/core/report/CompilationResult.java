package io.github.cyfko.sheetlogic.core.report;

import io.github.cyfko.sheetlogic.core.graph.DependencyGraph;

import java.util.List;
import java.util.Optional;

/**
 * Output of one compilation pass over a workbook snapshot.
 *
 * @param graph         the dependency graph
 * @param results       one extraction result per cluster, in cluster order
 * @param parseFailures formula cells that could not be parsed
 * @param errorReport   problems and their impact
 * @since 1.0.0
 */
public record CompilationResult(
        DependencyGraph graph,
        List<LogicExtractionResult> results,
        List<CellFailure> parseFailures,
        ErrorReport errorReport
) {

    public CompilationResult {
        results = List.copyOf(results);
        parseFailures = List.copyOf(parseFailures);
    }

    public Optional<LogicExtractionResult> result(String clusterId) {
        return results.stream().filter(result -> result.clusterId().equals(clusterId)).findFirst();
    }

    public boolean canProceed() {
        return errorReport.canProceed();
    }
}
