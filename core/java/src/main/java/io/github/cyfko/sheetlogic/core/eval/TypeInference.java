package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Infers the type of each cell from the values it takes across evaluations.
 * <p>
 * Blank observations are neutral: a cell is {@link ValueType#EMPTY} only if it was never
 * anything else. Two different non-blank tags join to {@link ValueType#MIXED}.
 * </p>
 * <p>Instances are not thread-safe; use one per cluster.</p>
 *
 * @since 1.0.0
 */
public final class TypeInference {

    private final Map<Coordinate, ValueType> types = new LinkedHashMap<>();

    public void observe(Coordinate coordinate, EvaluatedValue value) {
        types.merge(coordinate, value.type(), TypeInference::join);
    }

    public void observeAll(Map<Coordinate, EvaluatedValue> values) {
        values.forEach(this::observe);
    }

    /**
     * @param coordinate the cell
     * @return the joined type, {@link ValueType#EMPTY} when never observed
     */
    public ValueType typeOf(Coordinate coordinate) {
        return types.getOrDefault(coordinate, ValueType.EMPTY);
    }

    public Map<Coordinate, ValueType> types() {
        return Collections.unmodifiableMap(types);
    }

    /**
     * @return cells whose observations disagree, in coordinate order
     */
    public Set<Coordinate> mixed() {
        Set<Coordinate> mixed = new TreeSet<>();
        types.forEach((coordinate, type) -> {
            if (type == ValueType.MIXED) mixed.add(coordinate);
        });
        return mixed;
    }

    static ValueType join(ValueType seen, ValueType observed) {
        if (seen == ValueType.EMPTY) return observed;
        if (observed == ValueType.EMPTY) return seen;
        return seen.join(observed);
    }
}
