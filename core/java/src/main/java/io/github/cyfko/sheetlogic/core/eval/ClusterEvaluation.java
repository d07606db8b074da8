package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values of every cell of a cluster after one evaluation pass.
 *
 * @param values     value per cell, in evaluation order
 * @param cycles     how each circular reference of the cluster was settled
 * @since 1.0.0
 */
public record ClusterEvaluation(Map<Coordinate, EvaluatedValue> values, List<CycleResolution> cycles) {

    public ClusterEvaluation {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        cycles = List.copyOf(cycles);
    }

    public EvaluatedValue valueOf(Coordinate coordinate) {
        return values.getOrDefault(coordinate, EvaluatedValue.empty());
    }
}
