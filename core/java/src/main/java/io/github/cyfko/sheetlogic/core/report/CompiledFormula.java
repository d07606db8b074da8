package io.github.cyfko.sheetlogic.core.report;

import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.model.CellRole;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueType;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A formula cell ready for code generation.
 *
 * @param coordinate the cell
 * @param role       its role
 * @param source     formula text as found in the workbook
 * @param printed    canonical formula text printed from {@code ast}
 * @param ast        parsed formula
 * @param functions  functions called, in first-seen order
 * @param references cells and ranges read, in first-seen order
 * @param type       type inferred across the test cases
 * @param value      value computed from the workbook inputs
 * @since 1.0.0
 */
public record CompiledFormula(
        Coordinate coordinate,
        CellRole role,
        String source,
        String printed,
        FormulaNode ast,
        Set<String> functions,
        List<String> references,
        ValueType type,
        EvaluatedValue value
) {

    public CompiledFormula {
        functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
        references = List.copyOf(references);
    }
}
