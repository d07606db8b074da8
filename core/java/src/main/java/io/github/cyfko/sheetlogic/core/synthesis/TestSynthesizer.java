package io.github.cyfko.sheetlogic.core.synthesis;

import io.github.cyfko.sheetlogic.core.config.SynthesisPolicy;
import io.github.cyfko.sheetlogic.core.eval.ClusterEvaluation;
import io.github.cyfko.sheetlogic.core.eval.ClusterEvaluator;
import io.github.cyfko.sheetlogic.core.graph.Cluster;
import io.github.cyfko.sheetlogic.core.model.ClassifiedCell;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.model.Validation;
import io.github.cyfko.sheetlogic.core.model.ValidationKind;
import io.github.cyfko.sheetlogic.core.model.Workbook;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueFormat;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Synthesizes regression test cases for a cluster.
 *
 * <h2>Cases, in emission order</h2>
 * <ol>
 *   <li>one {@link TestOrigin#OBSERVED} case with the workbook values</li>
 *   <li>for each numeric input, {@link TestOrigin#BOUNDARY} cases at zero, at the declared minimum
 *       and one below it, at the declared maximum and one above it</li>
 *   <li>for each list-validated input, one {@link TestOrigin#SYNTHETIC} case per option</li>
 * </ol>
 * <p>
 * Each case changes a single input; its expected outputs come from re-evaluating the cluster.
 * Cases whose full input binding repeats an earlier case are dropped, and at most
 * {@link SynthesisPolicy#maxCasesPerCluster()} cases are kept.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TestSynthesizer {

    private static final Logger logger = Logger.getLogger(TestSynthesizer.class.getName());

    private final ClusterEvaluator evaluator;
    private final Workbook workbook;
    private final SynthesisPolicy policy;

    public TestSynthesizer(ClusterEvaluator evaluator, Workbook workbook, SynthesisPolicy policy) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.workbook = Objects.requireNonNull(workbook, "workbook");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param cluster  the cluster
     * @param observed evaluation of the cluster with the workbook values
     * @return the synthesized cases
     */
    public List<TestCase> synthesize(Cluster cluster, ClusterEvaluation observed) {
        Map<Coordinate, EvaluatedValue> baseline = new LinkedHashMap<>();
        for (Coordinate input : cluster.inputs()) {
            baseline.put(input, observed.valueOf(input));
        }

        List<Candidate> candidates = new ArrayList<>();
        candidates.add(new Candidate(TestOrigin.OBSERVED, baseline, "Observed workbook values"));
        for (Coordinate input : cluster.inputs()) {
            Optional<Validation> validation = workbook.cell(input).map(ClassifiedCell::validation);
            if (policy.includeBoundaries() && isNumeric(baseline.get(input), validation.orElse(null))) {
                candidates.addAll(boundaries(input, baseline, validation.orElse(null)));
            }
            if (policy.includeListOptions() && validation.isPresent() && validation.get().kind() == ValidationKind.LIST) {
                for (String option : validation.get().options()) {
                    candidates.add(new Candidate(TestOrigin.SYNTHETIC, with(baseline, input, EvaluatedValue.parse(option)),
                            String.format("%s set to option \"%s\"", input, option)));
                }
            }
        }

        List<TestCase> cases = new ArrayList<>();
        Set<Map<Coordinate, EvaluatedValue>> seen = new HashSet<>();
        Map<TestOrigin, Integer> counters = new EnumMap<>(TestOrigin.class);
        for (Candidate candidate : candidates) {
            if (cases.size() >= policy.maxCasesPerCluster()) {
                logger.fine(() -> String.format("Cluster %s: test cases capped at %d",
                        cluster.name(), policy.maxCasesPerCluster()));
                break;
            }
            if (!seen.add(candidate.inputs())) {
                continue;
            }
            ClusterEvaluation evaluation = candidate.origin() == TestOrigin.OBSERVED
                    ? observed
                    : evaluator.evaluate(cluster, candidate.inputs());
            int n = counters.merge(candidate.origin(), 1, Integer::sum);
            String id = cluster.name() + "_" + candidate.origin().name().toLowerCase(Locale.ROOT) + "_" + n;
            cases.add(new TestCase(id, cluster.name(), candidate.inputs(), outputs(cluster, evaluation),
                    candidate.origin(), candidate.description()));
        }
        return cases;
    }

    private List<Candidate> boundaries(Coordinate input, Map<Coordinate, EvaluatedValue> baseline, Validation validation) {
        List<Candidate> candidates = new ArrayList<>();
        candidates.add(boundary(input, baseline, 0, "at zero"));
        if (validation != null && validation.min() != null) {
            candidates.add(boundary(input, baseline, validation.min(), "at minimum"));
            candidates.add(boundary(input, baseline, validation.min() - 1, "below minimum"));
        }
        if (validation != null && validation.max() != null) {
            candidates.add(boundary(input, baseline, validation.max(), "at maximum"));
            candidates.add(boundary(input, baseline, validation.max() + 1, "above maximum"));
        }
        return candidates;
    }

    private static Candidate boundary(Coordinate input, Map<Coordinate, EvaluatedValue> baseline, double value, String what) {
        return new Candidate(TestOrigin.BOUNDARY, with(baseline, input, EvaluatedValue.number(value)),
                String.format("%s %s (%s)", input, what, ValueFormat.formatNumber(value)));
    }

    private static boolean isNumeric(EvaluatedValue current, Validation validation) {
        if (validation != null) {
            return validation.kind().isNumeric();
        }
        return current.isNumeric();
    }

    private static Map<Coordinate, EvaluatedValue> with(Map<Coordinate, EvaluatedValue> baseline, Coordinate input,
                                                        EvaluatedValue value) {
        Map<Coordinate, EvaluatedValue> inputs = new LinkedHashMap<>(baseline);
        inputs.put(input, value);
        return inputs;
    }

    /**
     * Declared outputs; clusters without any report their formula cells instead.
     */
    private static Map<Coordinate, EvaluatedValue> outputs(Cluster cluster, ClusterEvaluation evaluation) {
        List<Coordinate> targets = cluster.outputs().isEmpty() ? cluster.intermediates() : cluster.outputs();
        Map<Coordinate, EvaluatedValue> outputs = new LinkedHashMap<>();
        for (Coordinate target : targets) {
            outputs.put(target, evaluation.valueOf(target));
        }
        return outputs;
    }

    private record Candidate(TestOrigin origin, Map<Coordinate, EvaluatedValue> inputs, String description) {}
}
