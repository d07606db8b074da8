package io.github.cyfko.sheetlogic.core.report;

import io.github.cyfko.sheetlogic.core.model.Coordinate;

import java.util.List;

/**
 * Summary of everything that prevents, or may compromise, code generation for a workbook.
 * <p>
 * {@code canProceed} is false exactly when an output cell is forward-reachable from an unsupported
 * construct, from a member of an error cycle, or from a formula that failed to parse.
 * </p>
 *
 * @param canProceed     whether generated code would compute every output
 * @param criticalErrors problems blocking at least one output
 * @param warnings       problems that block no output
 * @param affectedCells  cells forward-reachable from any problem, in coordinate order
 * @param impactAnalysis counts and blocked outputs
 * @since 1.0.0
 */
public record ErrorReport(
        boolean canProceed,
        List<String> criticalErrors,
        List<String> warnings,
        List<Coordinate> affectedCells,
        ImpactAnalysis impactAnalysis
) {

    public ErrorReport {
        criticalErrors = List.copyOf(criticalErrors);
        warnings = List.copyOf(warnings);
        affectedCells = List.copyOf(affectedCells);
    }
}
