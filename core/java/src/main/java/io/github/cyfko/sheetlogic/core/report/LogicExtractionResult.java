package io.github.cyfko.sheetlogic.core.report;

import io.github.cyfko.sheetlogic.core.eval.CycleResolution;
import io.github.cyfko.sheetlogic.core.graph.Cluster;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.synthesis.TestCase;
import io.github.cyfko.sheetlogic.core.value.ValueType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything extracted from one cluster: its formulas in evaluation order, the inferred types of
 * its inputs and outputs, and its regression tests.
 * <p>
 * {@code annotations} hold optional descriptive metadata added by a
 * {@link io.github.cyfko.sheetlogic.core.spi.RuleEnricher}; nothing else in the result depends on them.
 * </p>
 *
 * @param cluster             the cluster
 * @param formulas            formula cells, dependencies first
 * @param inputTypes          inferred type of each input
 * @param outputTypes         inferred type of each output
 * @param testCases           synthesized regression cases
 * @param unsupportedFeatures constructs of the cluster that cannot be translated
 * @param cycles              how each circular reference of the cluster was settled
 * @param annotations         enrichment metadata, possibly empty
 * @since 1.0.0
 */
public record LogicExtractionResult(
        Cluster cluster,
        List<CompiledFormula> formulas,
        Map<Coordinate, ValueType> inputTypes,
        Map<Coordinate, ValueType> outputTypes,
        List<TestCase> testCases,
        List<UnsupportedFeature> unsupportedFeatures,
        List<CycleResolution> cycles,
        Map<String, String> annotations
) {

    public LogicExtractionResult {
        formulas = List.copyOf(formulas);
        inputTypes = Collections.unmodifiableMap(new LinkedHashMap<>(inputTypes));
        outputTypes = Collections.unmodifiableMap(new LinkedHashMap<>(outputTypes));
        testCases = List.copyOf(testCases);
        unsupportedFeatures = List.copyOf(unsupportedFeatures);
        cycles = List.copyOf(cycles);
        annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
    }

    public String clusterId() {
        return cluster.name();
    }

    public Optional<String> purpose() {
        return cluster.purposeHint();
    }

    /**
     * Copy of this result with extra annotations; existing keys are kept.
     *
     * @param extra annotations to add
     * @return the annotated result
     */
    public LogicExtractionResult withAnnotations(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(annotations);
        extra.forEach(merged::putIfAbsent);
        return new LogicExtractionResult(cluster, formulas, inputTypes, outputTypes, testCases,
                unsupportedFeatures, cycles, merged);
    }
}
