package io.github.cyfko.sheetlogic.core.synthesis;

import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A regression case: a full input binding of one cluster and the outputs it must produce.
 *
 * @param id              {@code <cluster name>_<origin>_<n>}
 * @param clusterName     name of the cluster under test
 * @param inputs          value of every input cell of the cluster
 * @param expectedOutputs value of every output cell under {@code inputs}
 * @param origin          how the inputs were chosen
 * @param description     human-readable summary of the perturbation
 * @since 1.0.0
 */
public record TestCase(
        String id,
        String clusterName,
        Map<Coordinate, EvaluatedValue> inputs,
        Map<Coordinate, EvaluatedValue> expectedOutputs,
        TestOrigin origin,
        String description
) {

    public TestCase {
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        expectedOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(expectedOutputs));
    }
}
