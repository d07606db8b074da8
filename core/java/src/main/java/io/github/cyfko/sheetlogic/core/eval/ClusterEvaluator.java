package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.graph.CircularRef;
import io.github.cyfko.sheetlogic.core.graph.Cluster;
import io.github.cyfko.sheetlogic.core.graph.DependencyGraph;
import io.github.cyfko.sheetlogic.core.graph.EvaluationStep;
import io.github.cyfko.sheetlogic.core.graph.GraphNode;
import io.github.cyfko.sheetlogic.core.model.ClassifiedCell;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.model.Workbook;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Evaluates the cells of one cluster following the graph schedule.
 *
 * <h2>Per step</h2>
 * <ul>
 *   <li>input cells take the supplied value, else their workbook value</li>
 *   <li>formula cells that failed to parse are {@code #PARSE!}</li>
 *   <li>error cycles set every member to {@code #CIRCULAR!}</li>
 *   <li>iterative cycles run Gauss-Seidel sweeps in member order, starting from the members'
 *       workbook values, until every member moves by less than the convergence threshold or the
 *       iteration limit is reached ({@code #DIDNOTCONVERGE!}); a non-numeric member value turns
 *       the whole cycle into {@code #CIRCULAR!}</li>
 * </ul>
 *
 * <p>
 * An evaluator holds no mutable state, so clusters can be evaluated concurrently.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ClusterEvaluator {

    private static final Logger logger = Logger.getLogger(ClusterEvaluator.class.getName());

    private final FormulaEvaluator evaluator;
    private final DependencyGraph graph;
    private final Workbook workbook;

    public ClusterEvaluator(FormulaEvaluator evaluator, DependencyGraph graph, Workbook workbook) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.workbook = Objects.requireNonNull(workbook, "workbook");
    }

    /**
     * Evaluates a cluster with the workbook's current input values.
     *
     * @param cluster the cluster
     * @return the values of every member
     */
    public ClusterEvaluation evaluate(Cluster cluster) {
        return evaluate(cluster, Map.of());
    }

    /**
     * Evaluates a cluster with some inputs replaced.
     *
     * @param cluster   the cluster
     * @param overrides replacement values for input cells
     * @return the values of every member
     */
    public ClusterEvaluation evaluate(Cluster cluster, Map<Coordinate, EvaluatedValue> overrides) {
        Map<Coordinate, EvaluatedValue> values = new LinkedHashMap<>();
        ValueBinding binding = coordinate -> {
            EvaluatedValue value = values.get(coordinate);
            if (value != null) {
                return value;
            }
            EvaluatedValue override = overrides.get(coordinate);
            return override != null ? override : snapshotValue(coordinate);
        };
        List<CycleResolution> cycles = new ArrayList<>();

        for (EvaluationStep step : graph.schedule()) {
            if (graph.node(step.nodes().get(0)).clusterId() != cluster.id()) {
                continue;
            }
            if (step instanceof EvaluationStep.NodeStep single) {
                GraphNode node = graph.node(single.node());
                values.put(node.coordinate(), evaluateNode(node, overrides, binding));
            } else if (step instanceof EvaluationStep.CycleStep cycle) {
                cycles.add(resolve(cycle, values, binding));
            }
        }
        return new ClusterEvaluation(values, cycles);
    }

    private EvaluatedValue evaluateNode(GraphNode node, Map<Coordinate, EvaluatedValue> overrides, ValueBinding binding) {
        Coordinate coordinate = node.coordinate();
        if (graph.failedCells().contains(coordinate)) {
            return EvaluatedValue.error(ErrorKind.PARSE);
        }
        if (node.ast() == null) {
            EvaluatedValue override = overrides.get(coordinate);
            return override != null ? override : snapshotValue(coordinate);
        }
        return evaluator.evaluate(node.ast(), binding);
    }

    private CycleResolution resolve(EvaluationStep.CycleStep step, Map<Coordinate, EvaluatedValue> values,
                                    ValueBinding binding) {
        CircularRef cycle = step.cycle();
        List<GraphNode> members = new ArrayList<>(step.members().size());
        for (int id : step.members()) {
            members.add(graph.node(id));
        }

        if (!cycle.isIterative()) {
            fill(members, values, ErrorKind.CIRCULAR_REFERENCE);
            return new CycleResolution(cycle, CycleResolution.Outcome.CIRCULAR, 0);
        }

        Map<Coordinate, Double> previous = new HashMap<>();
        for (GraphNode member : members) {
            EvaluatedValue seed = workbook.cell(member.coordinate())
                    .map(ClassifiedCell::currentValue)
                    .orElse(EvaluatedValue.empty());
            values.put(member.coordinate(), seed);
            previous.put(member.coordinate(), seed.isNumeric() ? Coercions.toNumber(seed) : 0.0);
        }

        for (int iteration = 1; iteration <= cycle.maxIterations(); iteration++) {
            boolean converged = true;
            for (GraphNode member : members) {
                EvaluatedValue value = member.ast() == null
                        ? EvaluatedValue.error(ErrorKind.PARSE)
                        : evaluator.evaluate(member.ast(), binding);
                if (!(value.isNumeric() || value.isEmpty())) {
                    logger.fine(() -> String.format("Iterative cycle %s produced non-numeric %s at %s",
                            cycle.cycle(), value.display(), member.coordinate()));
                    fill(members, values, ErrorKind.CIRCULAR_REFERENCE);
                    return new CycleResolution(cycle, CycleResolution.Outcome.CIRCULAR, iteration);
                }
                double current = value.isEmpty() ? 0.0 : Coercions.toNumber(value);
                if (Math.abs(current - previous.get(member.coordinate())) >= cycle.convergenceThreshold()) {
                    converged = false;
                }
                previous.put(member.coordinate(), current);
                values.put(member.coordinate(), value);
            }
            if (converged) {
                return new CycleResolution(cycle, CycleResolution.Outcome.CONVERGED, iteration);
            }
        }

        logger.fine(() -> String.format("Iterative cycle %s did not converge within %d iterations",
                cycle.cycle(), cycle.maxIterations()));
        fill(members, values, ErrorKind.DID_NOT_CONVERGE);
        return new CycleResolution(cycle, CycleResolution.Outcome.DID_NOT_CONVERGE, cycle.maxIterations());
    }

    private static void fill(List<GraphNode> members, Map<Coordinate, EvaluatedValue> values, ErrorKind kind) {
        for (GraphNode member : members) {
            values.put(member.coordinate(), EvaluatedValue.error(kind));
        }
    }

    private EvaluatedValue snapshotValue(Coordinate coordinate) {
        return workbook.cell(coordinate)
                .filter(cell -> !cell.hasFormula())
                .map(ClassifiedCell::currentValue)
                .orElse(EvaluatedValue.empty());
    }
}
