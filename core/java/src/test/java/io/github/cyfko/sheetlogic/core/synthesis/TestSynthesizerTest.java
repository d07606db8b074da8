package io.github.cyfko.sheetlogic.core.synthesis;

import io.github.cyfko.sheetlogic.core.Formulas;
import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.config.EvaluationPolicy;
import io.github.cyfko.sheetlogic.core.config.ParserPolicy;
import io.github.cyfko.sheetlogic.core.config.SynthesisPolicy;
import io.github.cyfko.sheetlogic.core.eval.ClusterEvaluator;
import io.github.cyfko.sheetlogic.core.eval.FormulaEvaluator;
import io.github.cyfko.sheetlogic.core.graph.Cluster;
import io.github.cyfko.sheetlogic.core.graph.DependencyGraph;
import io.github.cyfko.sheetlogic.core.graph.DependencyGraphBuilder;
import io.github.cyfko.sheetlogic.core.model.CellRole;
import io.github.cyfko.sheetlogic.core.model.ClassifiedCell;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.model.Validation;
import io.github.cyfko.sheetlogic.core.model.Workbook;
import io.github.cyfko.sheetlogic.core.spi.FunctionRegistry;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.cyfko.sheetlogic.core.Formulas.cell;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TestSynthesizer Tests")
class TestSynthesizerTest {

    private static final Workbook WORKBOOK = Workbook.builder()
            .cell(ClassifiedCell.input(cell("A1"), 50).withValidation(Validation.number(0.0, 100.0)))
            .cell(ClassifiedCell.formula(cell("B1"), CellRole.OUTPUT, "=A1*2"))
            .cell(ClassifiedCell.input(cell("C1"), "S").withValidation(Validation.list(List.of("S", "M", "L"))))
            .cell(ClassifiedCell.formula(cell("D1"), CellRole.OUTPUT, "=IF(C1=\"L\",10,5)"))
            .cell(ClassifiedCell.input(cell("E1"), 3))
            .cell(ClassifiedCell.formula(cell("F1"), CellRole.INTERMEDIATE, "=E1+1"))
            .build();

    private static List<TestCase> synthesize(int clusterIndex, SynthesisPolicy policy) {
        Map<Coordinate, FormulaNode> formulas = new HashMap<>();
        for (ClassifiedCell c : WORKBOOK.cells()) {
            if (c.hasFormula()) {
                formulas.put(c.coordinate(), Formulas.parse(c.rawFormula()));
            }
        }
        DependencyGraph graph = new DependencyGraphBuilder(ParserPolicy.defaults()).build(WORKBOOK, formulas);
        ClusterEvaluator evaluator = new ClusterEvaluator(
                new FormulaEvaluator(FunctionRegistry.withBuiltins(), EvaluationPolicy.sequential()), graph, WORKBOOK);
        Cluster cluster = graph.clusters().get(clusterIndex);
        return new TestSynthesizer(evaluator, WORKBOOK, policy).synthesize(cluster, evaluator.evaluate(cluster));
    }

    @Test
    @DisplayName("Should emit the observed case, then boundaries, without duplicates")
    void boundaries() {
        List<TestCase> cases = synthesize(0, SynthesisPolicy.defaults());

        assertEquals(5, cases.size());
        assertEquals(List.of(TestOrigin.OBSERVED, TestOrigin.BOUNDARY, TestOrigin.BOUNDARY, TestOrigin.BOUNDARY,
                TestOrigin.BOUNDARY), cases.stream().map(TestCase::origin).toList());
        assertEquals(List.of(50.0, 0.0, -1.0, 100.0, 101.0), cases.stream()
                .map(c -> ((EvaluatedValue.NumberValue) c.inputs().get(cell("A1"))).value()).toList());
        assertEquals(List.of(100.0, 0.0, -2.0, 200.0, 202.0), cases.stream()
                .map(c -> ((EvaluatedValue.NumberValue) c.expectedOutputs().get(cell("B1"))).value()).toList());
    }

    @Test
    @DisplayName("Should number case ids per origin")
    void ids() {
        List<TestCase> cases = synthesize(0, SynthesisPolicy.defaults());

        assertEquals("cluster_0_observed_1", cases.get(0).id());
        assertEquals("cluster_0_boundary_1", cases.get(1).id());
        assertEquals("cluster_0_boundary_4", cases.get(4).id());
        assertEquals("cluster_0", cases.get(0).clusterName());
        assertTrue(cases.get(2).description().contains("below minimum"));
    }

    @Test
    @DisplayName("Should try every list option")
    void listOptions() {
        List<TestCase> cases = synthesize(1, SynthesisPolicy.defaults());

        assertEquals(3, cases.size());
        assertEquals(TestOrigin.SYNTHETIC, cases.get(2).origin());
        assertEquals(EvaluatedValue.text("L"), cases.get(2).inputs().get(cell("C1")));
        assertEquals(EvaluatedValue.number(10), cases.get(2).expectedOutputs().get(cell("D1")));
        assertEquals(EvaluatedValue.number(5), cases.get(1).expectedOutputs().get(cell("D1")));
    }

    @Test
    @DisplayName("Clusters without outputs report their formula cells")
    void intermediatesAsOutputs() {
        List<TestCase> cases = synthesize(2, SynthesisPolicy.defaults());

        assertEquals(EvaluatedValue.number(4), cases.get(0).expectedOutputs().get(cell("F1")));
        assertEquals(EvaluatedValue.number(1), cases.get(1).expectedOutputs().get(cell("F1")));
    }

    @Test
    @DisplayName("Should honor the policy switches and cap")
    void policy() {
        assertEquals(2, synthesize(0, new SynthesisPolicy(true, true, 2)).size());
        assertEquals(1, synthesize(0, SynthesisPolicy.observedOnly()).size());
        assertEquals(1, synthesize(1, new SynthesisPolicy(true, false, 10)).size());
    }
}
