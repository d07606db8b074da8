package io.github.cyfko.sheetlogic.core.graph;

import io.github.cyfko.sheetlogic.core.model.Coordinate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable dependency graph of a workbook snapshot.
 * <p>
 * Nodes are stored in a dense array and addressed by integer id; adjacency is kept as id lists in
 * both directions. Edges point from a dependency to its dependent, so a topological order lists
 * every cell after the cells it reads.
 * </p>
 *
 * <h2>Orders</h2>
 * <ul>
 *   <li>{@link #topologicalOrder()}: every node outside a cycle, dependencies first, ties broken by id</li>
 *   <li>{@link #schedule()}: the full evaluation plan, where each cycle is one {@link EvaluationStep.CycleStep}
 *       placed after everything it reads</li>
 * </ul>
 *
 * <pre>{@code
 * DependencyGraph graph = new DependencyGraphBuilder(ParserPolicy.defaults()).build(workbook, asts, failed);
 * Set<Integer> impacted = graph.forwardReachable(List.of(graph.indexOf(cell).getAsInt()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DependencyGraph {

    private final List<GraphNode> nodes;
    private final Map<Coordinate, Integer> index;
    private final List<Edge> edges;
    private final List<List<Integer>> successors;
    private final List<List<Integer>> predecessors;
    private final List<Integer> topologicalOrder;
    private final List<EvaluationStep> schedule;
    private final List<CircularRef> circularRefs;
    private final List<Cluster> clusters;
    private final Set<Coordinate> failedCells;

    DependencyGraph(List<GraphNode> nodes,
                    Map<Coordinate, Integer> index,
                    List<Edge> edges,
                    List<List<Integer>> successors,
                    List<List<Integer>> predecessors,
                    List<Integer> topologicalOrder,
                    List<EvaluationStep> schedule,
                    List<CircularRef> circularRefs,
                    List<Cluster> clusters,
                    Set<Coordinate> failedCells) {
        this.nodes = List.copyOf(nodes);
        this.index = Collections.unmodifiableMap(index);
        this.edges = List.copyOf(edges);
        this.successors = freeze(successors);
        this.predecessors = freeze(predecessors);
        this.topologicalOrder = List.copyOf(topologicalOrder);
        this.schedule = List.copyOf(schedule);
        this.circularRefs = List.copyOf(circularRefs);
        this.clusters = List.copyOf(clusters);
        this.failedCells = Set.copyOf(failedCells);
    }

    private static List<List<Integer>> freeze(List<List<Integer>> adjacency) {
        List<List<Integer>> frozen = new ArrayList<>(adjacency.size());
        for (List<Integer> ids : adjacency) {
            frozen.add(List.copyOf(ids));
        }
        return Collections.unmodifiableList(frozen);
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public GraphNode node(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    public OptionalInt indexOf(Coordinate coordinate) {
        Integer id = index.get(coordinate);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public Optional<GraphNode> node(Coordinate coordinate) {
        Integer id = index.get(coordinate);
        return id == null ? Optional.empty() : Optional.of(nodes.get(id));
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * @param id node id
     * @return ids of the nodes whose formulas read {@code id}, ascending
     */
    public List<Integer> successors(int id) {
        return successors.get(id);
    }

    /**
     * @param id node id
     * @return ids of the nodes read by the formula of {@code id}, ascending
     */
    public List<Integer> predecessors(int id) {
        return predecessors.get(id);
    }

    public List<Integer> topologicalOrder() {
        return topologicalOrder;
    }

    public List<EvaluationStep> schedule() {
        return schedule;
    }

    public List<CircularRef> circularRefs() {
        return circularRefs;
    }

    public List<Cluster> clusters() {
        return clusters;
    }

    public Cluster clusterOf(int id) {
        return clusters.get(nodes.get(id).clusterId());
    }

    /**
     * Formula cells that could not be parsed; they are nodes without incoming edges.
     *
     * @return coordinates of the failed cells
     */
    public Set<Coordinate> failedCells() {
        return failedCells;
    }

    /**
     * Every node reachable from the seeds along dependency edges, seeds included.
     *
     * @param seeds starting node ids
     * @return reachable node ids, ascending
     */
    public Set<Integer> forwardReachable(Collection<Integer> seeds) {
        BitSet seen = new BitSet(nodes.size());
        Deque<Integer> queue = new ArrayDeque<>();
        for (Integer seed : seeds) {
            if (!seen.get(seed)) {
                seen.set(seed);
                queue.add(seed);
            }
        }
        while (!queue.isEmpty()) {
            for (int next : successors.get(queue.poll())) {
                if (!seen.get(next)) {
                    seen.set(next);
                    queue.add(next);
                }
            }
        }
        Set<Integer> reachable = new TreeSet<>();
        seen.stream().forEach(reachable::add);
        return Collections.unmodifiableSet(reachable);
    }

    @Override
    public String toString() {
        return String.format("DependencyGraph[nodes=%d, edges=%d, cycles=%d, clusters=%d]",
                nodes.size(), edges.size(), circularRefs.size(), clusters.size());
    }
}
