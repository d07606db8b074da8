package io.github.cyfko.sheetlogic.core.graph;

import io.github.cyfko.sheetlogic.core.Formulas;
import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.config.ParserPolicy;
import io.github.cyfko.sheetlogic.core.model.CellRole;
import io.github.cyfko.sheetlogic.core.model.ClassifiedCell;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.model.IterativeSettings;
import io.github.cyfko.sheetlogic.core.model.Workbook;
import io.github.cyfko.sheetlogic.core.reference.ReferenceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.cyfko.sheetlogic.core.Formulas.cell;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DependencyGraphBuilder Tests")
class DependencyGraphBuilderTest {

    private static DependencyGraph graphOf(Workbook workbook) {
        return graphOf(workbook, ParserPolicy.defaults(), Set.of());
    }

    private static DependencyGraph graphOf(Workbook workbook, ParserPolicy policy, Set<Coordinate> failed) {
        Map<Coordinate, FormulaNode> formulas = new HashMap<>();
        for (ClassifiedCell c : workbook.cells()) {
            if (c.hasFormula() && !failed.contains(c.coordinate())) {
                formulas.put(c.coordinate(), Formulas.parse(c.rawFormula()));
            }
        }
        return new DependencyGraphBuilder(policy).build(workbook, formulas, failed);
    }

    private static ClassifiedCell formula(String address, CellRole role, String text) {
        return ClassifiedCell.formula(cell(address), role, text);
    }

    private static ClassifiedCell input(String address, Object value) {
        return ClassifiedCell.input(cell(address), value);
    }

    private static List<Coordinate> coordinates(DependencyGraph graph, List<Integer> ids) {
        return ids.stream().map(id -> graph.node(id).coordinate()).toList();
    }

    @Nested
    @DisplayName("Acyclic graphs")
    class Acyclic {

        private final Workbook workbook = Workbook.builder()
                .cell(formula("C1", CellRole.OUTPUT, "=B1*2"))
                .cell(formula("B1", CellRole.FORMULA, "=A1+A2"))
                .cell(input("A1", 10))
                .cell(input("A2", 5))
                .build();

        @Test
        @DisplayName("Should order dependencies before dependents, lowest id first")
        void topologicalOrder() {
            DependencyGraph graph = graphOf(workbook);

            assertEquals(List.of(cell("A1"), cell("A2"), cell("B1"), cell("C1")),
                    coordinates(graph, graph.topologicalOrder()));
            assertTrue(graph.circularRefs().isEmpty());
            assertEquals(4, graph.schedule().size());
        }

        @Test
        @DisplayName("Should record one edge per dependency with its kind")
        void edgesAndDegrees() {
            DependencyGraph graph = graphOf(workbook);
            GraphNode b1 = graph.node(cell("B1")).orElseThrow();
            GraphNode c1 = graph.node(cell("C1")).orElseThrow();

            assertEquals(3, graph.edges().size());
            assertEquals(2, b1.inDegree());
            assertEquals(1, b1.outDegree());
            assertEquals(2, c1.depth());
            assertEquals(0, graph.node(cell("A1")).orElseThrow().depth());
            assertTrue(graph.edges().stream().allMatch(edge -> edge.kind() == ReferenceKind.DIRECT));
            assertEquals(List.of(c1.id()), graph.successors(b1.id()));
        }

        @Test
        @DisplayName("Repeated references produce a single edge")
        void duplicateReferences() {
            DependencyGraph graph = graphOf(Workbook.builder()
                    .cell(input("A1", 1))
                    .cell(formula("B1", CellRole.OUTPUT, "=A1*A1+SUM(A1:A1)"))
                    .build());

            assertEquals(1, graph.edges().size());
        }

        @Test
        @DisplayName("Forward reach follows dependents transitively")
        void forwardReach() {
            DependencyGraph graph = graphOf(workbook);
            int a1 = graph.indexOf(cell("A1")).orElseThrow();

            assertEquals(List.of(cell("C1"), cell("B1"), cell("A1")),
                    coordinates(graph, List.copyOf(graph.forwardReachable(List.of(a1)))));
        }
    }

    @Nested
    @DisplayName("Implicit nodes and ranges")
    class ImplicitNodes {

        @Test
        @DisplayName("Referenced but undeclared cells become implicit inputs")
        void implicitInputs() {
            DependencyGraph graph = graphOf(Workbook.builder()
                    .cell(formula("E1", CellRole.OUTPUT, "=SUM(D1:D3)+F9"))
                    .build());

            assertEquals(5, graph.size());
            GraphNode d2 = graph.node(cell("D2")).orElseThrow();
            assertTrue(d2.implicit());
            assertEquals(CellRole.INPUT, d2.role());
            assertTrue(d2.formula().isEmpty());
            assertTrue(graph.edges().stream().anyMatch(edge -> edge.kind() == ReferenceKind.RANGE));
        }

        @Test
        @DisplayName("Ranges above the expansion limit only connect present cells")
        void largeRanges() {
            ParserPolicy policy = ParserPolicy.builder().maxRangeExpansion(10).build();
            DependencyGraph graph = graphOf(Workbook.builder()
                    .cell(input("A5", 1))
                    .cell(input("A50", 2))
                    .cell(input("B7", 3))
                    .cell(formula("E1", CellRole.OUTPUT, "=SUM(A1:A100)"))
                    .build(), policy, Set.of());

            assertEquals(4, graph.size());
            assertEquals(2, graph.edges().size());
            assertEquals(2, graph.node(cell("E1")).orElseThrow().inDegree());
            assertEquals(0, graph.node(cell("B7")).orElseThrow().outDegree());
        }

        @Test
        @DisplayName("Failed cells are nodes without incoming edges")
        void failedCells() {
            Workbook workbook = Workbook.builder()
                    .cell(input("A1", 1))
                    .cell(formula("B1", CellRole.FORMULA, "=A1+"))
                    .cell(formula("C1", CellRole.OUTPUT, "=B1*2"))
                    .build();

            DependencyGraph graph = graphOf(workbook, ParserPolicy.defaults(), Set.of(cell("B1")));

            GraphNode b1 = graph.node(cell("B1")).orElseThrow();
            assertEquals(0, b1.inDegree());
            assertEquals(1, b1.outDegree());
            assertEquals(Set.of(cell("B1")), graph.failedCells());
        }

        @Test
        @DisplayName("Labels are not graph nodes")
        void labels() {
            DependencyGraph graph = graphOf(Workbook.builder()
                    .cell(ClassifiedCell.label(cell("A1"), "Price"))
                    .cell(input("B1", 1))
                    .build());

            assertTrue(graph.node(cell("A1")).isEmpty());
            assertEquals(1, graph.size());
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        private Workbook.Builder twoCellLoop() {
            return Workbook.builder()
                    .cell(formula("A1", CellRole.FORMULA, "=B1+1"))
                    .cell(formula("B1", CellRole.FORMULA, "=A1+1"))
                    .cell(formula("C1", CellRole.OUTPUT, "=A1"));
        }

        @Test
        @DisplayName("Should classify a cycle as ERROR without iterative calculation")
        void errorCycle() {
            DependencyGraph graph = graphOf(twoCellLoop().build());

            assertEquals(1, graph.circularRefs().size());
            CircularRef cycle = graph.circularRefs().get(0);
            assertEquals(List.of(cell("A1"), cell("B1")), cycle.cycle());
            assertEquals(CycleClassification.ERROR, cycle.classification());
            assertFalse(cycle.isIterative());
            assertEquals(0, cycle.maxIterations());
        }

        @Test
        @DisplayName("Should classify a cycle as ITERATIVE with the workbook switch")
        void iterativeCycle() {
            DependencyGraph graph = graphOf(twoCellLoop().iterativeCalculation(new IterativeSettings(5, 0.01)).build());

            CircularRef cycle = graph.circularRefs().get(0);
            assertEquals(CycleClassification.ITERATIVE, cycle.classification());
            assertEquals(5, cycle.maxIterations());
            assertEquals(0.01, cycle.convergenceThreshold());
        }

        @Test
        @DisplayName("A cycle member without settings makes the cycle an error")
        void partialSettings() {
            Workbook workbook = Workbook.builder()
                    .cell(formula("A1", CellRole.FORMULA, "=B1+1").withIterative(IterativeSettings.defaults()))
                    .cell(formula("B1", CellRole.FORMULA, "=A1+1"))
                    .build();

            assertEquals(CycleClassification.ERROR, graphOf(workbook).circularRefs().get(0).classification());
        }

        @Test
        @DisplayName("Cycles are scheduled as one step before their dependents")
        void schedule() {
            DependencyGraph graph = graphOf(twoCellLoop().build());

            assertInstanceOf(EvaluationStep.CycleStep.class, graph.schedule().get(0));
            assertEquals(List.of(0, 1), graph.schedule().get(0).nodes());
            assertEquals(new EvaluationStep.NodeStep(2), graph.schedule().get(1));
            assertEquals(List.of(2), graph.topologicalOrder());
            assertEquals(1, graph.node(cell("C1")).orElseThrow().depth());
        }

        @Test
        @DisplayName("A self-reference is a cycle of one cell")
        void selfReference() {
            DependencyGraph graph = graphOf(Workbook.builder()
                    .cell(formula("A1", CellRole.OUTPUT, "=A1+1"))
                    .build());

            assertEquals(List.of(cell("A1")), graph.circularRefs().get(0).cycle());
        }
    }

    @Nested
    @DisplayName("Clusters")
    class Clusters {

        private final Workbook workbook = Workbook.builder()
                .cell(input("A1", 100))
                .cell(formula("B1", CellRole.OUTPUT, "=ROUND(A1*1.2,2)").withLabel("Net Price!"))
                .cell(input("D1", 1))
                .cell(formula("E1", CellRole.OUTPUT, "=SUM(D1:D3)"))
                .build();

        @Test
        @DisplayName("Should split weakly connected components")
        void components() {
            DependencyGraph graph = graphOf(workbook);

            assertEquals(2, graph.clusters().size());
            Cluster pricing = graph.clusters().get(0);
            assertEquals(List.of(cell("A1")), pricing.inputs());
            assertEquals(List.of(cell("B1")), pricing.outputs());
            assertTrue(pricing.intermediates().isEmpty());

            Cluster totals = graph.clusters().get(1);
            assertEquals(List.of(cell("D1"), cell("D2"), cell("D3")), totals.inputs());
            assertEquals(4, totals.size());
            assertEquals(totals, graph.clusterOf(graph.indexOf(cell("D3")).orElseThrow()));
        }

        @Test
        @DisplayName("Should name clusters after labels and infer their purpose")
        void namesAndPurpose() {
            DependencyGraph graph = graphOf(workbook);

            assertEquals("cluster_0_net_price", graph.clusters().get(0).name());
            assertEquals("rounding", graph.clusters().get(0).purpose());
            assertEquals("cluster_1", graph.clusters().get(1).name());
            assertEquals("aggregation", graph.clusters().get(1).purposeHint().orElseThrow());
        }

        @Test
        void noPurposeForPlainArithmetic() {
            DependencyGraph graph = graphOf(Workbook.builder()
                    .cell(input("A1", 1))
                    .cell(formula("B1", CellRole.OUTPUT, "=A1+1"))
                    .build());

            assertTrue(graph.clusters().get(0).purposeHint().isEmpty());
        }
    }
}
