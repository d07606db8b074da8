package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.Map;

/**
 * Values of the cells a formula reads. Unbound cells are blank.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValueBinding {

    /**
     * @param coordinate the cell
     * @return its value, {@link EvaluatedValue#empty()} when unbound
     */
    EvaluatedValue valueOf(Coordinate coordinate);

    static ValueBinding of(Map<Coordinate, EvaluatedValue> values) {
        return coordinate -> values.getOrDefault(coordinate, EvaluatedValue.empty());
    }

    static ValueBinding empty() {
        return coordinate -> EvaluatedValue.empty();
    }
}
