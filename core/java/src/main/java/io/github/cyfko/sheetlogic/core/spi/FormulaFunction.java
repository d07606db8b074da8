package io.github.cyfko.sheetlogic.core.spi;

import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

/**
 * Body of a spreadsheet function.
 * <p>
 * Implementations must be pure: the same arguments always give the same value, and errors are
 * returned as {@link EvaluatedValue.ErrorValue}, never thrown.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface FormulaFunction {

    EvaluatedValue apply(FunctionArguments args);
}
