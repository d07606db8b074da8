package io.github.cyfko.sheetlogic.core.spi;

import io.github.cyfko.sheetlogic.core.config.EvaluationPolicy;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueGrid;

/**
 * Arguments handed to a {@link FormulaFunction}.
 * <p>
 * Arguments are evaluated lazily, on first access, so {@code IF} and {@code IFERROR} only evaluate
 * the branch they return. Each argument can be read as a scalar or as a grid.
 * </p>
 *
 * @since 1.0.0
 */
public interface FunctionArguments {

    int size();

    /**
     * Scalar value of an argument. A multi-cell range read as a scalar is {@code #VALUE!}, an
     * array literal yields its top-left element, an empty slot yields an empty value.
     *
     * @param index zero-based argument index
     * @return the value
     */
    EvaluatedValue value(int index);

    /**
     * Argument as a grid. Ranges keep their shape, scalars become a 1x1 grid.
     *
     * @param index zero-based argument index
     * @return the grid
     */
    ValueGrid grid(int index);

    /**
     * Whether the argument is a range or array rather than a single value.
     *
     * @param index zero-based argument index
     * @return true for ranges and array literals
     */
    boolean isGrid(int index);

    /**
     * Whether the argument is written as a cell or range reference. Aggregates skip text and
     * booleans found through references but coerce them when passed directly.
     *
     * @param index zero-based argument index
     * @return true for cell and range references
     */
    boolean isReference(int index);

    /**
     * Whether the argument slot is absent or written empty.
     *
     * @param index zero-based argument index
     * @return true when the caller omitted the argument
     */
    boolean isMissing(int index);

    EvaluationPolicy policy();
}
