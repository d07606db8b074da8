package io.github.cyfko.sheetlogic.core.report;

import io.github.cyfko.sheetlogic.core.eval.CycleResolution;
import io.github.cyfko.sheetlogic.core.graph.CircularRef;
import io.github.cyfko.sheetlogic.core.graph.DependencyGraph;
import io.github.cyfko.sheetlogic.core.graph.GraphNode;
import io.github.cyfko.sheetlogic.core.model.CellRole;
import io.github.cyfko.sheetlogic.core.model.Coordinate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the {@link ErrorReport} of a compilation.
 * <p>
 * Each problem is traced forward through the dependency graph. A problem reaching an output cell
 * is critical; any other problem is a warning.
 * </p>
 *
 * @since 1.0.0
 */
public final class ErrorReporter {

    private final DependencyGraph graph;
    private final Set<Integer> affected = new TreeSet<>();
    private final Set<Coordinate> blockedOutputs = new TreeSet<>();
    private final List<String> criticalErrors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public ErrorReporter(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * Cells depending on {@code coordinate}, itself included, in coordinate order.
     *
     * @param coordinate a graph cell
     * @return the impacted cells, empty when the cell is not in the graph
     */
    public List<Coordinate> impactOf(Coordinate coordinate) {
        List<Coordinate> impacted = new ArrayList<>();
        graph.indexOf(coordinate).ifPresent(id -> {
            for (int reached : graph.forwardReachable(List.of(id))) {
                impacted.add(graph.node(reached).coordinate());
            }
        });
        impacted.sort(null);
        return impacted;
    }

    public ErrorReporter failures(Collection<CellFailure> failures) {
        for (CellFailure failure : failures) {
            problem(List.of(failure.coordinate()), String.format("Formula at %s could not be parsed: %s",
                    failure.coordinate(), failure.error().message()));
        }
        return this;
    }

    public ErrorReporter unsupported(Collection<UnsupportedFeature> features) {
        for (UnsupportedFeature feature : features) {
            problem(List.of(feature.coordinate()), String.format("%s at %s: %s",
                    feature.featureType(), feature.coordinate(), feature.reason()));
        }
        return this;
    }

    public ErrorReporter cycles(Collection<CircularRef> cycles) {
        for (CircularRef cycle : cycles) {
            if (!cycle.isIterative()) {
                problem(cycle.cycle(), "Circular reference between " + cycle.cycle());
            }
        }
        return this;
    }

    /**
     * Non-converging iterative cycles are reported as warnings only.
     */
    public ErrorReporter resolutions(Collection<CycleResolution> resolutions) {
        for (CycleResolution resolution : resolutions) {
            if (resolution.cycle().isIterative() && resolution.outcome() != CycleResolution.Outcome.CONVERGED) {
                warnings.add(String.format("Iterative cycle %s ended as %s after %d iterations",
                        resolution.cycle().cycle(), resolution.outcome(), resolution.iterations()));
            }
        }
        return this;
    }

    public ErrorReporter mixedTypes(Collection<Coordinate> cells) {
        for (Coordinate cell : cells) {
            warnings.add(String.format("Cell %s takes values of different types across test cases", cell));
        }
        return this;
    }

    public ErrorReport build() {
        List<Coordinate> affectedCells = new ArrayList<>();
        for (int id : affected) {
            affectedCells.add(graph.node(id).coordinate());
        }
        affectedCells.sort(null);
        int total = graph.size();
        double percentage = total == 0 ? 0 : (affectedCells.size() * 100.0) / total;
        ImpactAnalysis impact = new ImpactAnalysis(total, affectedCells.size(), percentage, new ArrayList<>(blockedOutputs));
        return new ErrorReport(blockedOutputs.isEmpty(), criticalErrors, warnings, affectedCells, impact);
    }

    private void problem(List<Coordinate> origin, String message) {
        List<Integer> seeds = new ArrayList<>();
        for (Coordinate coordinate : origin) {
            graph.indexOf(coordinate).ifPresent(seeds::add);
        }
        boolean blocking = false;
        for (int id : graph.forwardReachable(seeds)) {
            affected.add(id);
            GraphNode node = graph.node(id);
            if (node.role() == CellRole.OUTPUT) {
                blockedOutputs.add(node.coordinate());
                blocking = true;
            }
        }
        if (blocking) {
            criticalErrors.add(message);
        } else {
            warnings.add(message);
        }
    }
}
