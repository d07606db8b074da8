package io.github.cyfko.sheetlogic.core.graph;

import io.github.cyfko.sheetlogic.core.ast.CellReference;
import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.ast.FormulaNodes;
import io.github.cyfko.sheetlogic.core.ast.RangeReference;
import io.github.cyfko.sheetlogic.core.config.ParserPolicy;
import io.github.cyfko.sheetlogic.core.model.CellRole;
import io.github.cyfko.sheetlogic.core.model.ClassifiedCell;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.model.IterativeSettings;
import io.github.cyfko.sheetlogic.core.model.Workbook;
import io.github.cyfko.sheetlogic.core.reference.ReferenceKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds the {@link DependencyGraph} of a workbook from its parsed formulas.
 *
 * <h2>Build phases</h2>
 * <ol>
 *   <li>one node per non-label cell, in workbook order; cells referenced but not declared are
 *       appended as implicit inputs</li>
 *   <li>one edge per distinct (dependency, dependent) pair; ranges up to the policy's
 *       {@code maxRangeExpansion} are expanded cell by cell, larger ranges only connect the nodes
 *       they contain</li>
 *   <li>strongly connected components (Tarjan); components with more than one member, or with a
 *       self-reference, become {@link CircularRef}s</li>
 *   <li>Kahn ordering of the acyclic nodes and of the condensed graph, ties broken by lowest id</li>
 *   <li>depths, degrees and weakly connected clusters</li>
 * </ol>
 *
 * <p>
 * A cycle is {@link CycleClassification#ITERATIVE} when every member allows iterative calculation,
 * either through its own settings or through the workbook-wide switch. Its limits are those of
 * the first member in coordinate order.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DependencyGraphBuilder {

    private static final Logger logger = Logger.getLogger(DependencyGraphBuilder.class.getName());

    private final ParserPolicy policy;

    public DependencyGraphBuilder(ParserPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public DependencyGraph build(Workbook workbook, Map<Coordinate, FormulaNode> formulas) {
        return build(workbook, formulas, Set.of());
    }

    /**
     * Builds the graph of a workbook snapshot.
     *
     * @param workbook the classified workbook
     * @param formulas parsed formula of every formula cell that parsed successfully
     * @param failed   formula cells that failed to parse
     * @return the graph
     */
    public DependencyGraph build(Workbook workbook, Map<Coordinate, FormulaNode> formulas, Set<Coordinate> failed) {
        Objects.requireNonNull(workbook, "workbook");
        Objects.requireNonNull(formulas, "formulas");
        Objects.requireNonNull(failed, "failed");
        return new Build(workbook, formulas, failed).run();
    }

    private final class Build {

        private final Workbook workbook;
        private final Map<Coordinate, FormulaNode> formulas;
        private final Set<Coordinate> failed;

        private final List<Coordinate> coordinates = new ArrayList<>();
        private final List<CellRole> roles = new ArrayList<>();
        private final List<Boolean> implicit = new ArrayList<>();
        private final Map<Coordinate, Integer> index = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Set<Long> edgeKeys = new HashSet<>();

        private Build(Workbook workbook, Map<Coordinate, FormulaNode> formulas, Set<Coordinate> failed) {
            this.workbook = workbook;
            this.formulas = formulas;
            this.failed = failed;
        }

        DependencyGraph run() {
            for (ClassifiedCell cell : workbook.cells()) {
                if (cell.role().participatesInGraph()) {
                    addNode(cell.coordinate(), cell.role(), false);
                }
            }
            connect();

            int n = coordinates.size();
            List<List<Integer>> successors = adjacency(n, true);
            List<List<Integer>> predecessors = adjacency(n, false);

            List<List<Integer>> components = stronglyConnected(n, successors);
            int[] component = new int[n];
            boolean[] cyclic = new boolean[n];
            for (int c = 0; c < components.size(); c++) {
                List<Integer> members = components.get(c);
                boolean isCycle = members.size() > 1 || successors.get(members.get(0)).contains(members.get(0));
                for (int member : members) {
                    component[member] = c;
                    cyclic[member] = isCycle;
                }
            }

            List<Integer> order = acyclicOrder(n, successors, predecessors, cyclic);
            List<EvaluationStep> schedule = schedule(components, component, cyclic, successors);
            List<CircularRef> circularRefs = new ArrayList<>();
            for (EvaluationStep step : schedule) {
                if (step instanceof EvaluationStep.CycleStep cycle) {
                    circularRefs.add(cycle.cycle());
                }
            }
            int[] depth = depths(n, schedule, predecessors);

            int[] clusterOf = new int[n];
            List<Cluster> clusters = clusters(n, clusterOf);

            List<GraphNode> nodes = new ArrayList<>(n);
            for (int id = 0; id < n; id++) {
                Coordinate coordinate = coordinates.get(id);
                nodes.add(new GraphNode(id, coordinate, roles.get(id),
                        implicit.get(id) ? null : formulas.get(coordinate), implicit.get(id),
                        predecessors.get(id).size(), successors.get(id).size(), depth[id], clusterOf[id]));
            }

            logger.fine(() -> String.format("Dependency graph built: %d nodes, %d edges, %d cycles, %d clusters",
                    nodes.size(), edges.size(), circularRefs.size(), clusters.size()));
            return new DependencyGraph(nodes, index, edges, successors, predecessors, order, schedule,
                    circularRefs, clusters, failed);
        }

        private int addNode(Coordinate coordinate, CellRole role, boolean discovered) {
            Integer existing = index.get(coordinate);
            if (existing != null) {
                return existing;
            }
            int id = coordinates.size();
            coordinates.add(coordinate);
            roles.add(role);
            implicit.add(discovered);
            index.put(coordinate, id);
            return id;
        }

        private void connect() {
            List<DeferredRange> deferred = new ArrayList<>();
            int declared = coordinates.size();

            for (int id = 0; id < declared; id++) {
                FormulaNode ast = formulas.get(coordinates.get(id));
                if (ast == null) {
                    continue;
                }
                int dependent = id;
                FormulaNodes.walk(ast, node -> {
                    if (node instanceof CellReference reference) {
                        addEdge(addNode(reference.coordinate(), CellRole.INPUT, true), dependent, reference.kind());
                    } else if (node instanceof RangeReference reference) {
                        if (reference.range().size() <= policy.maxRangeExpansion()) {
                            for (Coordinate member : reference.range()) {
                                addEdge(addNode(member, CellRole.INPUT, true), dependent, reference.kind());
                            }
                        } else {
                            deferred.add(new DeferredRange(reference, dependent));
                        }
                    }
                });
            }

            for (DeferredRange range : deferred) {
                RangeReference reference = range.reference();
                logger.fine(() -> String.format("Range %s exceeds %d cells, connecting present cells only",
                        reference.range(), policy.maxRangeExpansion()));
                for (int id = 0; id < coordinates.size(); id++) {
                    if (reference.range().contains(coordinates.get(id))) {
                        addEdge(id, range.dependent(), reference.kind());
                    }
                }
            }
        }

        private void addEdge(int from, int to, ReferenceKind kind) {
            if (edgeKeys.add(((long) from << 32) | to)) {
                edges.add(new Edge(from, to, kind));
            }
        }

        private List<List<Integer>> adjacency(int n, boolean forward) {
            List<List<Integer>> adjacency = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                adjacency.add(new ArrayList<>());
            }
            for (Edge edge : edges) {
                if (forward) {
                    adjacency.get(edge.from()).add(edge.to());
                } else {
                    adjacency.get(edge.to()).add(edge.from());
                }
            }
            adjacency.forEach(Collections::sort);
            return adjacency;
        }

        private List<Integer> acyclicOrder(int n, List<List<Integer>> successors, List<List<Integer>> predecessors,
                                           boolean[] cyclic) {
            int[] inDegree = new int[n];
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int id = 0; id < n; id++) {
                if (cyclic[id]) continue;
                for (int pred : predecessors.get(id)) {
                    if (!cyclic[pred]) inDegree[id]++;
                }
                if (inDegree[id] == 0) ready.add(id);
            }
            List<Integer> order = new ArrayList<>(n);
            while (!ready.isEmpty()) {
                int id = ready.poll();
                order.add(id);
                for (int next : successors.get(id)) {
                    if (!cyclic[next] && --inDegree[next] == 0) {
                        ready.add(next);
                    }
                }
            }
            return order;
        }

        private List<EvaluationStep> schedule(List<List<Integer>> components, int[] component, boolean[] cyclic,
                                              List<List<Integer>> successors) {
            int count = components.size();
            List<Set<Integer>> condensed = new ArrayList<>(count);
            for (int c = 0; c < count; c++) {
                condensed.add(new HashSet<>());
            }
            int[] inDegree = new int[count];
            for (Edge edge : edges) {
                int from = component[edge.from()];
                int to = component[edge.to()];
                if (from != to && condensed.get(from).add(to)) {
                    inDegree[to]++;
                }
            }

            int[] leader = new int[count];
            for (int c = 0; c < count; c++) {
                leader[c] = Collections.min(components.get(c));
            }
            PriorityQueue<Integer> ready = new PriorityQueue<>(Comparator.comparingInt(c -> leader[c]));
            for (int c = 0; c < count; c++) {
                if (inDegree[c] == 0) ready.add(c);
            }

            List<EvaluationStep> steps = new ArrayList<>(count);
            while (!ready.isEmpty()) {
                int c = ready.poll();
                List<Integer> members = new ArrayList<>(components.get(c));
                Collections.sort(members);
                if (cyclic[members.get(0)]) {
                    steps.add(new EvaluationStep.CycleStep(classify(members), members));
                } else {
                    steps.add(new EvaluationStep.NodeStep(members.get(0)));
                }
                for (int next : condensed.get(c)) {
                    if (--inDegree[next] == 0) ready.add(next);
                }
            }
            return steps;
        }

        private CircularRef classify(List<Integer> members) {
            List<Coordinate> cycle = new ArrayList<>(members.size());
            for (int member : members) {
                cycle.add(coordinates.get(member));
            }
            Collections.sort(cycle);

            IterativeSettings settings = null;
            for (Coordinate coordinate : cycle) {
                Optional<IterativeSettings> own = workbook.iterativeSettingsOf(coordinate);
                if (own.isEmpty()) {
                    return new CircularRef(cycle, CycleClassification.ERROR, null);
                }
                if (settings == null) {
                    settings = own.get();
                }
            }
            return new CircularRef(cycle, CycleClassification.ITERATIVE, settings);
        }

        private int[] depths(int n, List<EvaluationStep> schedule, List<List<Integer>> predecessors) {
            int[] depth = new int[n];
            for (EvaluationStep step : schedule) {
                List<Integer> members = step.nodes();
                int stepDepth = 0;
                for (int member : members) {
                    for (int pred : predecessors.get(member)) {
                        if (!members.contains(pred)) {
                            stepDepth = Math.max(stepDepth, depth[pred] + 1);
                        }
                    }
                }
                for (int member : members) {
                    depth[member] = stepDepth;
                }
            }
            return depth;
        }

        private List<Cluster> clusters(int n, int[] clusterOf) {
            UnionFind sets = new UnionFind(n);
            for (Edge edge : edges) {
                sets.union(edge.from(), edge.to());
            }

            Map<Integer, Integer> clusterByRoot = new HashMap<>();
            List<List<Integer>> members = new ArrayList<>();
            for (int id = 0; id < n; id++) {
                int root = sets.find(id);
                Integer cluster = clusterByRoot.get(root);
                if (cluster == null) {
                    cluster = members.size();
                    clusterByRoot.put(root, cluster);
                    members.add(new ArrayList<>());
                }
                members.get(cluster).add(id);
                clusterOf[id] = cluster;
            }

            List<Cluster> clusters = new ArrayList<>(members.size());
            for (int c = 0; c < members.size(); c++) {
                List<Coordinate> inputs = new ArrayList<>();
                List<Coordinate> intermediates = new ArrayList<>();
                List<Coordinate> outputs = new ArrayList<>();
                List<FormulaNode> asts = new ArrayList<>();
                for (int id : members.get(c)) {
                    Coordinate coordinate = coordinates.get(id);
                    switch (roles.get(id)) {
                        case INPUT -> inputs.add(coordinate);
                        case OUTPUT -> outputs.add(coordinate);
                        default -> intermediates.add(coordinate);
                    }
                    FormulaNode ast = implicit.get(id) ? null : formulas.get(coordinate);
                    if (ast != null) {
                        asts.add(ast);
                    }
                }
                Collections.sort(inputs);
                Collections.sort(intermediates);
                Collections.sort(outputs);

                List<String> labels = new ArrayList<>();
                for (Coordinate coordinate : outputs) labels.add(label(coordinate));
                for (Coordinate coordinate : inputs) labels.add(label(coordinate));

                clusters.add(new Cluster(c, ClusterProfiler.name(c, labels), inputs, intermediates, outputs,
                        ClusterProfiler.purpose(asts)));
            }
            return clusters;
        }

        private String label(Coordinate coordinate) {
            return workbook.cell(coordinate).map(ClassifiedCell::label).orElse(null);
        }
    }

    private record DeferredRange(RangeReference reference, int dependent) {}

    /**
     * Iterative Tarjan; components come out in reverse topological order of the condensation.
     */
    private static List<List<Integer>> stronglyConnected(int n, List<List<Integer>> successors) {
        int[] order = new int[n];
        int[] low = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(order, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        List<List<Integer>> components = new ArrayList<>();
        int counter = 0;

        int[] cursor = new int[n];
        Deque<Integer> call = new ArrayDeque<>();
        for (int start = 0; start < n; start++) {
            if (order[start] != -1) continue;
            call.push(start);
            order[start] = low[start] = counter++;
            stack.push(start);
            onStack[start] = true;

            while (!call.isEmpty()) {
                int v = call.peek();
                List<Integer> next = successors.get(v);
                if (cursor[v] < next.size()) {
                    int w = next.get(cursor[v]++);
                    if (order[w] == -1) {
                        order[w] = low[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        call.push(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], order[w]);
                    }
                } else {
                    call.pop();
                    if (!call.isEmpty()) {
                        int parent = call.peek();
                        low[parent] = Math.min(low[parent], low[v]);
                    }
                    if (low[v] == order[v]) {
                        List<Integer> component = new ArrayList<>();
                        int w;
                        do {
                            w = stack.pop();
                            onStack[w] = false;
                            component.add(w);
                        } while (w != v);
                        components.add(component);
                    }
                }
            }
        }
        return components;
    }
}
