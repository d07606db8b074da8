package io.github.cyfko.sheetlogic.core;

import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.config.EvaluationPolicy;
import io.github.cyfko.sheetlogic.core.eval.FormulaEvaluator;
import io.github.cyfko.sheetlogic.core.eval.ValueBinding;
import io.github.cyfko.sheetlogic.core.impl.BasicFormulaParser;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.parsing.ParseOutcome;
import io.github.cyfko.sheetlogic.core.reference.ReferenceResolver;
import io.github.cyfko.sheetlogic.core.spi.FunctionRegistry;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared fixtures: parse and evaluate formulas on {@code Sheet1} against a handful of cell values.
 */
public final class Formulas {

    public static final String SHEET = "Sheet1";

    private static final FunctionRegistry REGISTRY = FunctionRegistry.withBuiltins();

    private Formulas() {}

    public static Coordinate cell(String address) {
        return Coordinate.of(SHEET, address);
    }

    public static FormulaNode parse(String formula) {
        ParseOutcome outcome = new BasicFormulaParser(new ReferenceResolver(), REGISTRY).parse(formula, cell("Z100"));
        if (!outcome.isSuccess()) {
            throw new AssertionError("Could not parse " + formula + ": " + outcome.error());
        }
        return outcome.ast();
    }

    /**
     * Evaluates a formula with the given cells bound.
     *
     * @param formula formula text
     * @param cells   alternating addresses and raw values, e.g. {@code "A1", 1, "A2", "x"}
     * @return the value
     */
    public static EvaluatedValue eval(String formula, Object... cells) {
        return eval(EvaluationPolicy.sequential(), formula, cells);
    }

    public static EvaluatedValue eval(EvaluationPolicy policy, String formula, Object... cells) {
        Map<Coordinate, EvaluatedValue> values = new HashMap<>();
        for (int i = 0; i < cells.length; i += 2) {
            values.put(cell((String) cells[i]), EvaluatedValue.of(cells[i + 1]));
        }
        return new FormulaEvaluator(REGISTRY, policy).evaluate(parse(formula), ValueBinding.of(values));
    }

    public static double number(String formula, Object... cells) {
        EvaluatedValue value = eval(formula, cells);
        if (value instanceof EvaluatedValue.NumberValue n) return n.value();
        if (value instanceof EvaluatedValue.DateSerialValue d) return d.serial();
        throw new AssertionError(formula + " evaluated to " + value.display());
    }
}
