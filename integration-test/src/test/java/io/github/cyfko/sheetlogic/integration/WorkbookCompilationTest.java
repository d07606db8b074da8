package io.github.cyfko.sheetlogic.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.sheetlogic.core.SheetLogicCompiler;
import io.github.cyfko.sheetlogic.core.config.CompilerConfig;
import io.github.cyfko.sheetlogic.core.config.EvaluationPolicy;
import io.github.cyfko.sheetlogic.core.eval.CycleResolution;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.parsing.UnsupportedConstruct;
import io.github.cyfko.sheetlogic.core.report.CompilationResult;
import io.github.cyfko.sheetlogic.core.report.CompiledFormula;
import io.github.cyfko.sheetlogic.core.report.LogicExtractionResult;
import io.github.cyfko.sheetlogic.core.report.UnsupportedFeature;
import io.github.cyfko.sheetlogic.core.synthesis.TestOrigin;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compiles the JSON workbooks under {@code src/test/resources/workbooks} end to end.
 */
@DisplayName("Workbook Compilation Integration Tests")
class WorkbookCompilationTest {

    private static final double TOLERANCE = 0.01;

    private final ObjectMapper mapper = new ObjectMapper();

    private static CompilationResult compile(WorkbookFixture fixture) {
        SheetLogicCompiler compiler = SheetLogicCompiler.create(CompilerConfig.builder()
                .evaluationPolicy(EvaluationPolicy.builder().parallelism(2).build())
                .build());
        return compiler.compile(fixture.toWorkbook());
    }

    private static Map<Coordinate, CompiledFormula> formulasOf(CompilationResult result) {
        Map<Coordinate, CompiledFormula> formulas = new HashMap<>();
        for (LogicExtractionResult extraction : result.results()) {
            extraction.formulas().forEach(formula -> formulas.put(formula.coordinate(), formula));
        }
        return formulas;
    }

    private static void assertValue(String cell, JsonNode expected, EvaluatedValue actual) {
        if (expected.isNumber()) {
            double number;
            if (actual instanceof EvaluatedValue.NumberValue n) {
                number = n.value();
            } else if (actual instanceof EvaluatedValue.DateSerialValue d) {
                number = d.serial();
            } else {
                fail(cell + " should be numeric but was " + actual.display());
                return;
            }
            assertEquals(expected.doubleValue(), number, TOLERANCE, cell);
        } else if (expected.isBoolean()) {
            assertEquals(EvaluatedValue.bool(expected.booleanValue()), actual, cell);
        } else {
            assertEquals(expected.asText(), actual.display(), cell);
        }
    }

    // ==================== Expected Values ====================

    @ParameterizedTest
    @ValueSource(strings = {"pricing.json", "loan.json", "broken.json"})
    @DisplayName("Should reproduce the expected values of every fixture")
    void shouldReproduceExpectedValues(String resource) {
        // Given
        WorkbookFixture fixture = WorkbookFixture.load(resource);

        // When
        CompilationResult result = compile(fixture);
        Map<Coordinate, CompiledFormula> formulas = formulasOf(result);

        // Then
        assertEquals(fixture.expectsToProceed(), result.canProceed(), resource);
        fixture.expected().forEach((cell, expected) -> {
            CompiledFormula formula = formulas.get(WorkbookFixture.coordinate(cell));
            assertNotNull(formula, "no compiled formula at " + cell);
            assertValue(cell, expected, formula.value());
        });
    }

    // ==================== Pricing ====================

    @Nested
    @DisplayName("Pricing workbook")
    class Pricing {

        private final CompilationResult result = compile(WorkbookFixture.load("pricing.json"));

        @Test
        @DisplayName("Should keep named references by name")
        void shouldKeepNamedReferences() {
            CompiledFormula total = formulasOf(result).get(WorkbookFixture.coordinate("Orders!D3"));

            assertTrue(total.references().contains("TaxRate"));
            assertEquals("=ROUND(D2*(1+TaxRate),2)", total.printed());
        }

        @Test
        @DisplayName("Should gather the order cells and the tax rate into one cluster")
        void shouldBuildOneCluster() {
            assertEquals(1, result.results().size());
            LogicExtractionResult cluster = result.results().get(0);

            assertTrue(cluster.cluster().inputs().contains(WorkbookFixture.coordinate("Rates!B1")));
            assertEquals(3, cluster.outputTypes().size());
        }

        @Test
        @DisplayName("Should synthesize boundary cases from the quantity validation")
        void shouldSynthesizeBoundaries() {
            LogicExtractionResult cluster = result.results().get(0);

            assertEquals(TestOrigin.OBSERVED, cluster.testCases().get(0).origin());
            assertTrue(cluster.testCases().stream().anyMatch(testCase -> testCase.origin() == TestOrigin.BOUNDARY));
        }
    }

    // ==================== Loan ====================

    @Nested
    @DisplayName("Loan workbook")
    class Loan {

        @Test
        @DisplayName("Should settle the fee cycle by iteration")
        void shouldConvergeCycle() {
            CompilationResult result = compile(WorkbookFixture.load("loan.json"));

            assertEquals(1, result.graph().circularRefs().size());
            List<CycleResolution> resolutions = result.results().stream()
                    .flatMap(extraction -> extraction.cycles().stream())
                    .toList();
            assertEquals(1, resolutions.size());
            assertEquals(CycleResolution.Outcome.CONVERGED, resolutions.get(0).outcome());
            assertTrue(resolutions.get(0).iterations() > 0);
        }
    }

    // ==================== Broken ====================

    @Nested
    @DisplayName("Broken workbook")
    class Broken {

        private final CompilationResult result = compile(WorkbookFixture.load("broken.json"));

        @Test
        @DisplayName("Should report the syntax error as a parse failure")
        void shouldReportParseFailure() {
            assertEquals(1, result.parseFailures().size());
            assertEquals(WorkbookFixture.coordinate("Sheet1!B1"), result.parseFailures().get(0).coordinate());
            assertFalse(result.errorReport().criticalErrors().isEmpty());
        }

        @Test
        @DisplayName("Should flag INDIRECT as a dynamic reference with a fix")
        void shouldFlagDynamicReference() {
            List<UnsupportedFeature> features = result.results().stream()
                    .flatMap(extraction -> extraction.unsupportedFeatures().stream())
                    .toList();

            assertEquals(1, features.size());
            assertEquals("INDIRECT", features.get(0).function());
            assertEquals(UnsupportedConstruct.FeatureType.DYNAMIC_REFERENCE, features.get(0).featureType());
            assertTrue(features.get(0).suggestedFix().startsWith("Replace dynamic references"));
        }

        @Test
        @DisplayName("Should export the error report as JSON")
        void shouldExportReport() {
            JsonNode report = mapper.valueToTree(result.errorReport());

            assertFalse(report.get("canProceed").asBoolean());
            assertTrue(report.get("criticalErrors").isArray());
            assertTrue(report.get("criticalErrors").size() > 0);
            assertTrue(report.get("impactAnalysis").get("blockedOutputs").size() > 0);
        }
    }
}
